package org.Dirac.routing.heuristic;

import lombok.experimental.UtilityClass;
import org.Dirac.routing.graph.ProximityGraph;
import org.Dirac.routing.route.Route;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Greedy nearest-neighbor tour construction.
 *
 * <p>Distances are taken between all vertex pairs, not only proximity edges, so the tour may
 * cross gaps the graph does not connect. It always succeeds.</p>
 */
@UtilityClass
public class NearestNeighborRouteBuilder {

    /**
     * Builds a tour from the first label of the graph.
     */
    public static Route build(ProximityGraph graph) {
        Objects.requireNonNull(graph, "graph");
        return build(graph, graph.label(0));
    }

    /**
     * Builds a tour from {@code startLabel}. Equidistant candidates resolve to the
     * earliest label.
     *
     * @param graph graph whose point data drives the tour.
     * @param startLabel label of the first and last stop.
     * @return closed route over every vertex.
     * @throws org.Dirac.core.id.LabelIndex.UnknownLabelException if the start is not in the graph.
     */
    public static Route build(ProximityGraph graph, String startLabel) {
        Objects.requireNonNull(graph, "graph");
        int n = graph.vertexCount();
        int current = graph.labelIndex().toIndex(startLabel);
        boolean[] visited = new boolean[n];
        visited[current] = true;

        List<String> order = new ArrayList<>(n);
        order.add(graph.label(current));

        for (int step = 1; step < n; step++) {
            int next = -1;
            double best = Double.POSITIVE_INFINITY;
            for (int candidate = 0; candidate < n; candidate++) {
                if (visited[candidate]) {
                    continue;
                }
                double distance = graph.distance(current, candidate);
                // Strict comparison keeps the earliest label on ties.
                if (distance < best) {
                    best = distance;
                    next = candidate;
                }
            }
            visited[next] = true;
            order.add(graph.label(next));
            current = next;
        }
        return Route.closing(order);
    }
}
