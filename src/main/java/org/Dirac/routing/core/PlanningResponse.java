package org.Dirac.routing.core;

import lombok.Builder;
import lombok.Value;
import org.Dirac.routing.degree.DegreeMap;
import org.Dirac.routing.degree.DiracVerdict;
import org.Dirac.routing.graph.ProximityGraph;
import org.Dirac.routing.route.Route;
import org.Dirac.routing.search.CycleSearchResult;
import org.Dirac.routing.search.CycleSearchStatus;

import java.util.Optional;

/**
 * Client-facing planning response.
 *
 * <p>{@code hamiltonianDistance} is {@code NaN} unless the cycle search status is
 * {@link CycleSearchStatus#FOUND}. All distances are full precision.</p>
 */
@Value
@Builder
public class PlanningResponse {
    /** Graph the plan was computed on; vertices, edges and far pairs for drawing. */
    ProximityGraph graph;
    /** Degrees and Dirac condition outcome. */
    DiracVerdict diracVerdict;
    /** Exact search outcome. */
    CycleSearchResult cycleSearch;
    /** Total distance of the Hamiltonian cycle. */
    double hamiltonianDistance;
    /** Greedy nearest-neighbor tour. */
    Route heuristicRoute;
    /** Total distance of the heuristic tour. */
    double heuristicDistance;

    public DegreeMap degrees() {
        return diracVerdict.getDegrees();
    }

    public boolean isDiracSatisfied() {
        return diracVerdict.isSatisfied();
    }

    public Optional<Route> hamiltonianRoute() {
        return cycleSearch.route();
    }

    /**
     * Route to display: the Hamiltonian cycle when one was found, else the heuristic tour.
     */
    public Route preferredRoute() {
        return cycleSearch.route().orElse(heuristicRoute);
    }
}
