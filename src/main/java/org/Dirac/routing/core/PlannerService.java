package org.Dirac.routing.core;

import org.Dirac.routing.graph.ProximityGraph;

/**
 * Public planning contract.
 *
 * <p>Implementations validate input at the boundary and throw {@link RoutePlanningException}
 * for contract failures.</p>
 */
public interface PlannerService {
    /**
     * Generates a seeded layout and plans on it.
     *
     * @param request layout scalars and optional start label.
     * @return complete planning response.
     */
    PlanningResponse plan(PlanningRequest request);

    /**
     * Plans on an already built graph.
     *
     * @param graph immutable proximity graph.
     * @param startLabel heuristic tour start, or {@code null} for the first label.
     * @return complete planning response.
     */
    PlanningResponse evaluate(ProximityGraph graph, String startLabel);
}
