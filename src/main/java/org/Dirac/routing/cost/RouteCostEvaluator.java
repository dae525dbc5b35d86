package org.Dirac.routing.cost;

import lombok.experimental.UtilityClass;
import org.Dirac.routing.graph.ProximityGraph;
import org.Dirac.routing.route.Route;

import java.util.Objects;

/**
 * Sums full-precision Euclidean leg lengths along a closed route.
 *
 * <p>Legs need not be graph edges; the graph only supplies point data.</p>
 */
@UtilityClass
public class RouteCostEvaluator {

    /**
     * @param route closed route over labels of {@code graph}.
     * @param graph point data source.
     * @return total travelled distance.
     * @throws org.Dirac.core.id.LabelIndex.UnknownLabelException if a label is not in the graph.
     */
    public static double totalDistance(Route route, ProximityGraph graph) {
        Objects.requireNonNull(route, "route");
        Objects.requireNonNull(graph, "graph");
        double total = 0.0d;
        int previous = graph.labelIndex().toIndex(route.labelAt(0));
        for (int i = 1; i < route.length(); i++) {
            int next = graph.labelIndex().toIndex(route.labelAt(i));
            total += graph.distance(previous, next);
            previous = next;
        }
        return total;
    }
}
