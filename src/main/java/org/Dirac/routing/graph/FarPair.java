package org.Dirac.routing.graph;

import lombok.Value;

/**
 * Vertex pair whose distance exceeds the proximity radius ("too far to connect").
 */
@Value
public class FarPair {
    String firstLabel;
    String secondLabel;
    double distance;
}
