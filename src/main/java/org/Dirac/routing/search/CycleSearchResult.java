package org.Dirac.routing.search;

import lombok.Value;
import org.Dirac.routing.route.Route;

import java.util.Objects;
import java.util.Optional;

/**
 * Exact search result. A route is present iff the status is {@link CycleSearchStatus#FOUND}.
 */
@Value
public class CycleSearchResult {
    CycleSearchStatus status;
    Route cycle;
    /** Complete orderings whose adjacency was checked; 0 when not attempted. */
    long examinedOrderings;

    private CycleSearchResult(CycleSearchStatus status, Route cycle, long examinedOrderings) {
        this.status = Objects.requireNonNull(status, "status");
        this.cycle = cycle;
        this.examinedOrderings = examinedOrderings;
    }

    static CycleSearchResult found(Route cycle, long examinedOrderings) {
        return new CycleSearchResult(CycleSearchStatus.FOUND, Objects.requireNonNull(cycle, "cycle"), examinedOrderings);
    }

    static CycleSearchResult notFound(long examinedOrderings) {
        return new CycleSearchResult(CycleSearchStatus.NOT_FOUND, null, examinedOrderings);
    }

    static CycleSearchResult notAttempted() {
        return new CycleSearchResult(CycleSearchStatus.NOT_ATTEMPTED, null, 0L);
    }

    public boolean isFound() {
        return status == CycleSearchStatus.FOUND;
    }

    public boolean isAttempted() {
        return status != CycleSearchStatus.NOT_ATTEMPTED;
    }

    public Optional<Route> route() {
        return Optional.ofNullable(cycle);
    }
}
