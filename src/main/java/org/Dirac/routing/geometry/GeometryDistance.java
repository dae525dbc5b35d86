package org.Dirac.routing.geometry;

import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Numeric helpers for planar distance computations and presentation rounding.
 */
@UtilityClass
public class GeometryDistance {
    /** Decimal places used when presenting edge weights. */
    public static final int EDGE_WEIGHT_DISPLAY_PLACES = 2;
    /** Decimal places used when presenting route totals. */
    public static final int ROUTE_TOTAL_DISPLAY_PLACES = 3;

    /**
     * Computes Euclidean distance between two points at full precision.
     */
    public static double euclideanDistance(Point a, Point b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        return Math.hypot(b.getX() - a.getX(), b.getY() - a.getY());
    }

    /**
     * Rounds a finite value half-even to the given number of decimal places.
     * Presentation only; never feed the result back into search or cost logic.
     */
    public static double roundForDisplay(double value, int places) {
        if (places < 0) {
            throw new IllegalArgumentException("places must be >= 0: " + places);
        }
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }
}
