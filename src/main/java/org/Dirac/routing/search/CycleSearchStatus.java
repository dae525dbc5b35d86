package org.Dirac.routing.search;

/**
 * Outcome of an exact Hamiltonian cycle search.
 *
 * <p>{@code NOT_ATTEMPTED} means the graph exceeded the size cap and nothing was searched;
 * {@code NOT_FOUND} means the search ran to completion without a match.</p>
 */
public enum CycleSearchStatus {
    FOUND,
    NOT_FOUND,
    NOT_ATTEMPTED
}
