package org.Dirac.routing.geometry;

import lombok.Value;

/**
 * Immutable location in the unit square {@code [0,1] x [0,1]}.
 */
@Value
public class Point {
    double x;
    double y;

    /**
     * Creates a point after validating both coordinates.
     *
     * @param x first coordinate in {@code [0, 1]}.
     * @param y second coordinate in {@code [0, 1]}.
     */
    public Point(double x, double y) {
        this.x = requireUnitCoordinate(x, "x");
        this.y = requireUnitCoordinate(y, "y");
    }

    public static Point of(double x, double y) {
        return new Point(x, y);
    }

    /**
     * Full-precision Euclidean distance to another point.
     */
    public double distanceTo(Point other) {
        return GeometryDistance.euclideanDistance(this, other);
    }

    private static double requireUnitCoordinate(double value, String name) {
        if (!Double.isFinite(value) || value < 0.0d || value > 1.0d) {
            throw new IllegalArgumentException(name + " must be finite and in [0, 1]: " + value);
        }
        return value;
    }
}
