package org.Dirac.routing.graph;

import lombok.Value;
import org.Dirac.routing.geometry.GeometryDistance;

/**
 * Undirected proximity edge. The lower-index endpoint is always stored first.
 *
 * <p>{@code weight} keeps full precision; only {@link #displayWeight()} rounds.</p>
 */
@Value
public class Edge {
    String firstLabel;
    String secondLabel;
    int firstIndex;
    int secondIndex;
    double weight;

    /**
     * Weight rounded to two decimals for presentation.
     */
    public double displayWeight() {
        return GeometryDistance.roundForDisplay(weight, GeometryDistance.EDGE_WEIGHT_DISPLAY_PLACES);
    }

    /**
     * Checks whether the given label is one of the endpoints.
     */
    public boolean touches(String label) {
        return firstLabel.equals(label) || secondLabel.equals(label);
    }
}
