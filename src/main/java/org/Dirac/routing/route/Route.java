package org.Dirac.routing.route;

import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable closed tour expressed in vertex labels.
 *
 * <p>The first and last labels are equal and positions {@code 0..length-2} hold distinct
 * labels. A route references labels only, not a graph, so it can be compared against any
 * graph through {@link #coversExactly(List)}.</p>
 */
@EqualsAndHashCode
public final class Route {
    private static final String ARROW = " → ";

    private final List<String> labels;

    private Route(List<String> labels) {
        this.labels = labels;
    }

    /**
     * Creates a route from an already closed label sequence.
     *
     * @param closedLabels labels with the start repeated at the end.
     * @return validated route.
     */
    public static Route of(List<String> closedLabels) {
        Objects.requireNonNull(closedLabels, "closedLabels");
        if (closedLabels.size() < 2) {
            throw new IllegalArgumentException("closed route needs at least 2 labels: " + closedLabels);
        }
        List<String> copy = List.copyOf(closedLabels);
        if (!copy.get(0).equals(copy.get(copy.size() - 1))) {
            throw new IllegalArgumentException("route must start and end at the same label: " + copy);
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < copy.size() - 1; i++) {
            if (!seen.add(copy.get(i))) {
                throw new IllegalArgumentException("label visited twice: " + copy.get(i) + " in " + copy);
            }
        }
        return new Route(copy);
    }

    /**
     * Creates a route from an open visiting order by appending its first label.
     */
    public static Route closing(List<String> visitOrder) {
        Objects.requireNonNull(visitOrder, "visitOrder");
        if (visitOrder.isEmpty()) {
            throw new IllegalArgumentException("visit order must be non-empty");
        }
        List<String> closed = new ArrayList<>(visitOrder.size() + 1);
        closed.addAll(visitOrder);
        closed.add(visitOrder.get(0));
        return of(closed);
    }

    /**
     * Full closed label sequence, length {@code stops() + 1}.
     */
    public List<String> labels() {
        return labels;
    }

    public int length() {
        return labels.size();
    }

    /**
     * Number of distinct stops visited.
     */
    public int stops() {
        return labels.size() - 1;
    }

    public String start() {
        return labels.get(0);
    }

    public String labelAt(int position) {
        return labels.get(position);
    }

    /**
     * Same tour traversed in the opposite direction from the same start.
     */
    public Route reversed() {
        List<String> reversed = new ArrayList<>(labels);
        Collections.reverse(reversed);
        return new Route(List.copyOf(reversed));
    }

    /**
     * Checks that this route visits every label of {@code vertexLabels} exactly once.
     */
    public boolean coversExactly(List<String> vertexLabels) {
        Objects.requireNonNull(vertexLabels, "vertexLabels");
        if (stops() != vertexLabels.size()) {
            return false;
        }
        return new HashSet<>(labels.subList(0, stops())).equals(new HashSet<>(vertexLabels));
    }

    @Override
    public String toString() {
        return String.join(ARROW, labels);
    }
}
