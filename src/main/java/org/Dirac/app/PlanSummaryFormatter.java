package org.Dirac.app;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import lombok.experimental.UtilityClass;
import org.Dirac.routing.core.PlanningResponse;
import org.Dirac.routing.graph.Edge;
import org.Dirac.routing.geometry.GeometryDistance;
import org.Dirac.routing.search.CycleSearchResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders a planning response as plain summary lines.
 */
@UtilityClass
class PlanSummaryFormatter {

    static List<String> format(PlanningResponse response) {
        List<String> lines = new ArrayList<>();
        lines.add("Delivery locations: " + response.getGraph().vertexCount());
        lines.add("Dirac's condition: " + (response.isDiracSatisfied() ? "satisfied" : "not satisfied"));
        lines.add("Degrees: " + formatDegrees(response.degrees().asMap()));

        CycleSearchResult cycleSearch = response.getCycleSearch();
        switch (cycleSearch.getStatus()) {
            case FOUND -> {
                lines.add("Hamiltonian route found: " + cycleSearch.getCycle());
                lines.add("Total distance: " + formatTotal(response.getHamiltonianDistance()));
            }
            case NOT_FOUND -> lines.add("No Hamiltonian cycle found: the network isn't dense enough.");
            case NOT_ATTEMPTED -> lines.add("Hamiltonian search not attempted: too many locations for exhaustive search.");
        }

        lines.add("Heuristic (greedy) route: " + response.getHeuristicRoute());
        lines.add("Total distance: " + formatTotal(response.getHeuristicDistance()));

        lines.add("Connected roads: " + response.getGraph().edgeCount());
        for (Edge edge : response.getGraph().edges()) {
            lines.add("  " + edge.getFirstLabel() + " - " + edge.getSecondLabel() + ": "
                    + String.format(Locale.ROOT, "%.2f", edge.displayWeight()));
        }
        return lines;
    }

    private static String formatDegrees(Object2IntMap<String> degrees) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Object2IntMap.Entry<String> entry : degrees.object2IntEntrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getIntValue());
            first = false;
        }
        return sb.append('}').toString();
    }

    private static String formatTotal(double distance) {
        double rounded = GeometryDistance.roundForDisplay(distance, GeometryDistance.ROUTE_TOTAL_DISPLAY_PLACES);
        return String.format(Locale.ROOT, "%.3f", rounded);
    }
}
