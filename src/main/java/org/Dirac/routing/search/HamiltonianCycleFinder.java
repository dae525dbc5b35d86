package org.Dirac.routing.search;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.Dirac.routing.graph.ProximityGraph;
import org.Dirac.routing.route.Route;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Exhaustive Hamiltonian cycle search over vertex orderings.
 *
 * <p>Orderings are scanned in lexicographic index order (label order) and the first one whose
 * consecutive pairs, including last to first, are all edges wins. A failing pair at positions
 * {@code (i, i + 1)} skips every ordering sharing that prefix; since skipped orderings all fail
 * the same check, the winner is the one a naive full scan would return.</p>
 *
 * <p>Graphs larger than the size cap are reported as {@link CycleSearchStatus#NOT_ATTEMPTED}.</p>
 */
@Slf4j
public final class HamiltonianCycleFinder {
    /** Worst case is {@code n! * n} adjacency checks; the cap can be lowered, never raised. */
    public static final int HARD_MAX_VERTICES = 9;
    static final int MIN_CYCLE_VERTICES = 3;
    static final String PROP_MAX_EXACT_VERTICES = "dirac.search.maxExactVertices";

    @Getter
    @Accessors(fluent = true)
    private final int maxVertices;

    /**
     * @param maxVertices largest vertex count searched, in {@code [1, 9]}.
     */
    public HamiltonianCycleFinder(int maxVertices) {
        if (maxVertices < 1 || maxVertices > HARD_MAX_VERTICES) {
            throw new IllegalArgumentException(
                    "maxVertices must be in [1, " + HARD_MAX_VERTICES + "]: " + maxVertices
            );
        }
        this.maxVertices = maxVertices;
    }

    /**
     * Reads the cap from {@code dirac.search.maxExactVertices}. Missing, malformed or
     * out-of-range values fall back to {@link #HARD_MAX_VERTICES}.
     */
    public static HamiltonianCycleFinder defaults() {
        return new HamiltonianCycleFinder(readCap());
    }

    /**
     * Searches one graph.
     *
     * @param graph immutable proximity graph.
     * @return FOUND with a closed route of {@code n + 1} labels, NOT_FOUND, or NOT_ATTEMPTED.
     */
    public CycleSearchResult find(ProximityGraph graph) {
        Objects.requireNonNull(graph, "graph");
        int n = graph.vertexCount();
        if (n > maxVertices) {
            log.debug("exact search skipped: {} vertices exceeds cap {}", n, maxVertices);
            return CycleSearchResult.notAttempted();
        }
        if (n < MIN_CYCLE_VERTICES) {
            return CycleSearchResult.notFound(0L);
        }

        PermutationSequence.Cursor cursor = PermutationSequence.of(n).cursor();
        long examined = 0L;
        while (cursor.advance()) {
            examined++;
            int brokenLink = firstMissingLink(graph, cursor);
            if (brokenLink >= 0) {
                cursor.skipPrefix(brokenLink + 2);
                continue;
            }
            if (!graph.hasEdge(cursor.get(n - 1), cursor.get(0))) {
                continue;
            }
            Route cycle = toRoute(graph, cursor);
            log.debug("hamiltonian cycle {} found after {} orderings", cycle, examined);
            return CycleSearchResult.found(cycle, examined);
        }
        log.debug("no hamiltonian cycle among {} vertices after {} orderings", n, examined);
        return CycleSearchResult.notFound(examined);
    }

    /**
     * Returns the first position {@code i} with no edge between elements {@code i} and
     * {@code i + 1}, or -1 when the open path is fully connected.
     */
    private static int firstMissingLink(ProximityGraph graph, PermutationSequence.Cursor cursor) {
        for (int i = 0; i + 1 < cursor.size(); i++) {
            if (!graph.hasEdge(cursor.get(i), cursor.get(i + 1))) {
                return i;
            }
        }
        return -1;
    }

    private static Route toRoute(ProximityGraph graph, PermutationSequence.Cursor cursor) {
        List<String> order = new ArrayList<>(cursor.size());
        for (int i = 0; i < cursor.size(); i++) {
            order.add(graph.label(cursor.get(i)));
        }
        return Route.closing(order);
    }

    private static int readCap() {
        String raw = System.getProperty(PROP_MAX_EXACT_VERTICES);
        if (raw == null || raw.isBlank()) {
            return HARD_MAX_VERTICES;
        }
        try {
            int cap = Integer.parseInt(raw.trim());
            return cap >= 1 && cap <= HARD_MAX_VERTICES ? cap : HARD_MAX_VERTICES;
        } catch (NumberFormatException ex) {
            return HARD_MAX_VERTICES;
        }
    }
}
