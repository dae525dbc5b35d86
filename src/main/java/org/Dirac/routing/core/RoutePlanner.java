package org.Dirac.routing.core;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.Dirac.core.id.LabelIndex;
import org.Dirac.routing.cost.RouteCostEvaluator;
import org.Dirac.routing.degree.DiracEvaluator;
import org.Dirac.routing.degree.DiracVerdict;
import org.Dirac.routing.graph.GenerationBounds;
import org.Dirac.routing.graph.ProximityGraph;
import org.Dirac.routing.graph.ProximityGraphBuilder;
import org.Dirac.routing.heuristic.NearestNeighborRouteBuilder;
import org.Dirac.routing.route.Route;
import org.Dirac.routing.search.CycleSearchResult;
import org.Dirac.routing.search.HamiltonianCycleFinder;

/**
 * Main planning entry point.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Validate the request against generation bounds; reject degenerate input.</li>
 * <li>Build the seeded proximity graph.</li>
 * <li>Evaluate degrees and Dirac's condition.</li>
 * <li>Run the capped exact cycle search.</li>
 * <li>Build the nearest-neighbor tour and cost both routes.</li>
 * </ul>
 * <p>Every step is a pure function of its inputs, so identical requests give identical responses.</p>
 */
@Slf4j
public final class RoutePlanner implements PlannerService {
    public static final String REASON_REQUEST_REQUIRED = "DRP_REQUEST_REQUIRED";
    public static final String REASON_GRAPH_REQUIRED = "DRP_GRAPH_REQUIRED";
    public static final String REASON_VERTEX_COUNT_OUT_OF_RANGE = GenerationBounds.REASON_VERTEX_COUNT_OUT_OF_RANGE;
    public static final String REASON_RADIUS_OUT_OF_RANGE = GenerationBounds.REASON_RADIUS_OUT_OF_RANGE;
    public static final String REASON_UNKNOWN_START_LABEL = "DRP_UNKNOWN_START_LABEL";

    private final ProximityGraphBuilder graphBuilder;
    private final HamiltonianCycleFinder cycleFinder;

    /**
     * Creates a planner.
     *
     * @param bounds optional generation bounds; system-property defaults when null.
     * @param cycleFinder optional exact search; system-property cap when null.
     */
    @Builder
    public RoutePlanner(GenerationBounds bounds, HamiltonianCycleFinder cycleFinder) {
        this.graphBuilder = new ProximityGraphBuilder(bounds == null ? GenerationBounds.defaults() : bounds);
        this.cycleFinder = cycleFinder == null ? HamiltonianCycleFinder.defaults() : cycleFinder;
    }

    /**
     * Creates a planner with system-property defaults.
     */
    public RoutePlanner() {
        this(null, null);
    }

    /**
     * Executes one seeded planning request.
     *
     * @throws RoutePlanningException when the request is missing or out of range.
     */
    @Override
    public PlanningResponse plan(PlanningRequest request) {
        if (request == null) {
            throw new RoutePlanningException(REASON_REQUEST_REQUIRED, "planning request must be provided");
        }
        ProximityGraph graph;
        try {
            graph = graphBuilder.build(request.getVertexCount(), request.getRadius(), request.getSeed());
        } catch (GenerationBounds.BoundsViolationException ex) {
            throw new RoutePlanningException(ex.reasonCode(), ex.getMessage(), ex);
        }
        return evaluate(graph, request.getStartLabel());
    }

    /**
     * Plans on an existing graph.
     *
     * @throws RoutePlanningException when the graph is missing, degenerate, or the start is unknown.
     */
    @Override
    public PlanningResponse evaluate(ProximityGraph graph, String startLabel) {
        if (graph == null) {
            throw new RoutePlanningException(REASON_GRAPH_REQUIRED, "graph must be provided");
        }
        if (graph.vertexCount() < GenerationBounds.ABSOLUTE_MIN_VERTICES) {
            throw new RoutePlanningException(
                    REASON_VERTEX_COUNT_OUT_OF_RANGE,
                    "at least " + GenerationBounds.ABSOLUTE_MIN_VERTICES + " vertices required: " + graph.vertexCount()
            );
        }
        String start = resolveStartLabel(graph, startLabel);

        DiracVerdict verdict = DiracEvaluator.evaluate(graph);
        CycleSearchResult cycleSearch = cycleFinder.find(graph);
        Route heuristicRoute = NearestNeighborRouteBuilder.build(graph, start);

        double hamiltonianDistance = cycleSearch.route()
                .map(route -> RouteCostEvaluator.totalDistance(route, graph))
                .orElse(Double.NaN);
        double heuristicDistance = RouteCostEvaluator.totalDistance(heuristicRoute, graph);

        log.debug("plan: vertices={}, edges={}, dirac={}, exact={}, heuristic={} ({})",
                graph.vertexCount(), graph.edgeCount(), verdict.isSatisfied(),
                cycleSearch.getStatus(), heuristicRoute, heuristicDistance);

        return PlanningResponse.builder()
                .graph(graph)
                .diracVerdict(verdict)
                .cycleSearch(cycleSearch)
                .hamiltonianDistance(hamiltonianDistance)
                .heuristicRoute(heuristicRoute)
                .heuristicDistance(heuristicDistance)
                .build();
    }

    private static String resolveStartLabel(ProximityGraph graph, String startLabel) {
        if (startLabel == null) {
            return graph.label(0);
        }
        LabelIndex labelIndex = graph.labelIndex();
        if (!labelIndex.containsLabel(startLabel)) {
            throw new RoutePlanningException(
                    REASON_UNKNOWN_START_LABEL,
                    "start label not in graph: " + startLabel + " " + labelIndex.labels()
            );
        }
        return startLabel;
    }
}
