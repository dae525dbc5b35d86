package org.Dirac.routing.graph;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Dirac.core.id.LabelAlphabet;

/**
 * Deterministic configuration bounds for seeded layout generation.
 *
 * <p>Defaults follow the planner's configuration range (4 to 10 locations, radius up to 1)
 * and may be overridden through system properties. Blank, malformed or out-of-range property
 * values fall back per field; the radius ceiling never exceeds 1.</p>
 */
@Getter
@Accessors(fluent = true)
public final class GenerationBounds {
    public static final int DEFAULT_MIN_VERTICES = 4;
    public static final int DEFAULT_MAX_VERTICES = 10;
    public static final double DEFAULT_MAX_RADIUS = 1.0d;
    /** Seeded layouts live in the unit square; a larger threshold is never configurable. */
    public static final double ABSOLUTE_MAX_RADIUS = 1.0d;
    /** A Hamiltonian cycle on fewer vertices is not meaningful for routing. */
    public static final int ABSOLUTE_MIN_VERTICES = 3;

    public static final String REASON_VERTEX_COUNT_OUT_OF_RANGE = "DRP_VERTEX_COUNT_OUT_OF_RANGE";
    public static final String REASON_RADIUS_OUT_OF_RANGE = "DRP_RADIUS_OUT_OF_RANGE";

    static final String PROP_MIN_VERTICES = "dirac.planner.minVertices";
    static final String PROP_MAX_VERTICES = "dirac.planner.maxVertices";
    static final String PROP_MAX_RADIUS = "dirac.planner.maxRadius";

    private final int minVertices;
    private final int maxVertices;
    private final double maxRadius;

    private GenerationBounds(int minVertices, int maxVertices, double maxRadius) {
        if (minVertices < ABSOLUTE_MIN_VERTICES) {
            throw new IllegalArgumentException(
                    "minVertices must be >= " + ABSOLUTE_MIN_VERTICES + ": " + minVertices
            );
        }
        if (maxVertices < minVertices || maxVertices > LabelAlphabet.MAX_SIZE) {
            throw new IllegalArgumentException(
                    "maxVertices must be in [" + minVertices + ", " + LabelAlphabet.MAX_SIZE + "]: " + maxVertices
            );
        }
        if (!Double.isFinite(maxRadius) || maxRadius <= 0.0d || maxRadius > ABSOLUTE_MAX_RADIUS) {
            throw new IllegalArgumentException(
                    "maxRadius must be in (0, " + ABSOLUTE_MAX_RADIUS + "]: " + maxRadius
            );
        }
        this.minVertices = minVertices;
        this.maxVertices = maxVertices;
        this.maxRadius = maxRadius;
    }

    /**
     * Creates bounds with explicit values.
     */
    public static GenerationBounds of(int minVertices, int maxVertices, double maxRadius) {
        return new GenerationBounds(minVertices, maxVertices, maxRadius);
    }

    /**
     * Loads bounds from system properties. Never throws: each unusable value is replaced
     * independently, so a bad minimum does not discard a valid maximum.
     */
    public static GenerationBounds defaults() {
        int minVertices = readInt(PROP_MIN_VERTICES, DEFAULT_MIN_VERTICES);
        if (minVertices < ABSOLUTE_MIN_VERTICES || minVertices > LabelAlphabet.MAX_SIZE) {
            minVertices = DEFAULT_MIN_VERTICES;
        }
        int maxVertices = readInt(PROP_MAX_VERTICES, DEFAULT_MAX_VERTICES);
        if (maxVertices < minVertices || maxVertices > LabelAlphabet.MAX_SIZE) {
            maxVertices = Math.max(DEFAULT_MAX_VERTICES, minVertices);
        }
        double maxRadius = readDouble(PROP_MAX_RADIUS, DEFAULT_MAX_RADIUS);
        if (!Double.isFinite(maxRadius) || maxRadius <= 0.0d) {
            maxRadius = DEFAULT_MAX_RADIUS;
        }
        return GenerationBounds.of(minVertices, maxVertices, Math.min(maxRadius, ABSOLUTE_MAX_RADIUS));
    }

    /**
     * Validates a requested vertex count against configured bounds.
     */
    public void checkVertexCount(int vertexCount) {
        if (vertexCount < minVertices || vertexCount > maxVertices) {
            throw new BoundsViolationException(
                    REASON_VERTEX_COUNT_OUT_OF_RANGE,
                    "vertex count must be in [" + minVertices + ", " + maxVertices + "]: " + vertexCount
            );
        }
    }

    /**
     * Validates a requested radius against {@code (0, maxRadius]}.
     */
    public void checkRadius(double radius) {
        if (!Double.isFinite(radius) || radius <= 0.0d || radius > maxRadius) {
            throw new BoundsViolationException(
                    REASON_RADIUS_OUT_OF_RANGE,
                    "radius must be in (0, " + maxRadius + "]: " + radius
            );
        }
    }

    private static int readInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static double readDouble(String property, double fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    /**
     * Reason-coded rejection of an out-of-range generation request.
     */
    @Getter
    @Accessors(fluent = true)
    public static final class BoundsViolationException extends IllegalArgumentException {
        private final String reasonCode;

        BoundsViolationException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }
    }
}
