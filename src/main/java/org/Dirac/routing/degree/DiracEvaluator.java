package org.Dirac.routing.degree;

import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import lombok.experimental.UtilityClass;
import org.Dirac.routing.graph.ProximityGraph;
import org.Dirac.routing.graph.Vertex;

import java.util.Objects;

/**
 * Computes vertex degrees and Dirac's condition: {@code n >= 3} and every degree {@code >= n / 2}.
 */
@UtilityClass
public class DiracEvaluator {
    static final int MIN_APPLICABLE_VERTICES = 3;

    /**
     * Counts incident edges per vertex in label order.
     */
    public static DegreeMap degrees(ProximityGraph graph) {
        Objects.requireNonNull(graph, "graph");
        Object2IntLinkedOpenHashMap<String> degrees = new Object2IntLinkedOpenHashMap<>(graph.vertexCount());
        for (Vertex vertex : graph.vertices()) {
            degrees.put(vertex.getLabel(), graph.degree(vertex.getIndex()));
        }
        return new DegreeMap(degrees);
    }

    /**
     * Evaluates the degree condition using real-valued division, so {@code n = 5}
     * needs degree 3 everywhere.
     */
    public static DiracVerdict evaluate(ProximityGraph graph) {
        DegreeMap degrees = degrees(graph);
        int n = graph.vertexCount();
        double threshold = n / 2.0d;
        boolean satisfied = n >= MIN_APPLICABLE_VERTICES && degrees.minDegree() >= threshold;
        return new DiracVerdict(degrees, n, threshold, satisfied);
    }
}
