package org.Dirac.app;

import lombok.extern.slf4j.Slf4j;
import org.Dirac.routing.core.PlanningRequest;
import org.Dirac.routing.core.PlanningResponse;
import org.Dirac.routing.core.RoutePlanner;
import org.Dirac.routing.core.RoutePlanningException;

import java.io.PrintStream;

/**
 * Command-line entry point: {@code Main [n radius seed [startLabel]]}.
 *
 * <p>Without arguments the demo layout is used: 6 locations, radius 0.3, seed 42.</p>
 */
@Slf4j
public class Main {
    static final int DEFAULT_VERTEX_COUNT = 6;
    static final double DEFAULT_RADIUS = 0.3d;
    static final long DEFAULT_SEED = 42L;
    static final String USAGE = "usage: Main [n radius seed [startLabel]]";

    /**
     * Launches one planning run and prints its summary.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        PlanningRequest request;
        try {
            request = parse(args);
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            err.println(USAGE);
            return 2;
        }

        try {
            PlanningResponse response = new RoutePlanner().plan(request);
            for (String line : PlanSummaryFormatter.format(response)) {
                out.println(line);
            }
            return 0;
        } catch (RoutePlanningException ex) {
            log.debug("planning rejected: {}", ex.getReasonCode());
            err.println(ex.getMessage());
            return 1;
        }
    }

    static PlanningRequest parse(String[] args) {
        if (args.length == 0) {
            return PlanningRequest.builder()
                    .vertexCount(DEFAULT_VERTEX_COUNT)
                    .radius(DEFAULT_RADIUS)
                    .seed(DEFAULT_SEED)
                    .build();
        }
        if (args.length < 3 || args.length > 4) {
            throw new IllegalArgumentException("expected 0, 3 or 4 arguments, got " + args.length);
        }
        try {
            return PlanningRequest.builder()
                    .vertexCount(Integer.parseInt(args[0].trim()))
                    .radius(Double.parseDouble(args[1].trim()))
                    .seed(Long.parseLong(args[2].trim()))
                    .startLabel(args.length == 4 ? args[3].trim() : null)
                    .build();
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("malformed number: " + ex.getMessage(), ex);
        }
    }
}
