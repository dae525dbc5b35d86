package org.Dirac.routing.core;

import lombok.Builder;
import lombok.Value;

/**
 * Client-facing planning request: the three layout scalars plus an optional tour start.
 */
@Value
@Builder
public class PlanningRequest {
    /** Number of delivery locations. */
    int vertexCount;
    /** Connection threshold ("road" distance). */
    double radius;
    /** Layout seed. */
    long seed;
    /** Start label for the heuristic tour; {@code null} means the first label. */
    String startLabel;
}
