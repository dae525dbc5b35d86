package org.Dirac.routing.testutil;

import org.Dirac.routing.geometry.Point;
import org.Dirac.routing.graph.PointSampler;
import org.Dirac.routing.graph.ProximityGraph;
import org.Dirac.routing.graph.ProximityGraphBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared layout fixtures for routing tests.
 */
public final class LayoutFixtureFactory {
    public static final double SQRT_2 = Math.sqrt(2.0d);

    private LayoutFixtureFactory() {
    }

    /**
     * Unit square A(0,0), B(1,0), C(1,1), D(0,1).
     */
    public static List<Point> unitSquarePoints() {
        return List.of(Point.of(0, 0), Point.of(1, 0), Point.of(1, 1), Point.of(0, 1));
    }

    public static ProximityGraph unitSquare(double radius) {
        return ProximityGraphBuilder.fromPoints(unitSquarePoints(), radius);
    }

    /**
     * Regular pentagon of circumradius 0.4 around (0.5, 0.5), labelled counter-clockwise from the top.
     * With radius 0.6 only the five sides (about 0.47) connect; diagonals are about 0.76.
     */
    public static ProximityGraph pentagon(double radius) {
        List<Point> points = new ArrayList<>(5);
        for (int k = 0; k < 5; k++) {
            double angle = Math.toRadians(90.0d + 72.0d * k);
            points.add(Point.of(0.5d + 0.4d * Math.cos(angle), 0.5d + 0.4d * Math.sin(angle)));
        }
        return ProximityGraphBuilder.fromPoints(points, radius);
    }

    /**
     * Points spaced 0.2 apart on a horizontal line; radius 0.25 yields a simple path.
     */
    public static ProximityGraph line(int count, double radius) {
        List<Point> points = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            points.add(Point.of(0.05d + 0.2d * i, 0.5d));
        }
        return ProximityGraphBuilder.fromPoints(points, radius);
    }

    /**
     * Seeded random layout with an unrestricted radius.
     */
    public static ProximityGraph seeded(int count, double radius, long seed) {
        return ProximityGraphBuilder.fromPoints(PointSampler.seeded(seed).sample(count), radius);
    }

    public static Point[] points(double... coordinates) {
        if (coordinates.length % 2 != 0) {
            throw new IllegalArgumentException("coordinates must come in x/y pairs");
        }
        Point[] points = new Point[coordinates.length / 2];
        for (int i = 0; i < points.length; i++) {
            points[i] = Point.of(coordinates[2 * i], coordinates[2 * i + 1]);
        }
        return points;
    }

    public static ProximityGraph graph(double radius, double... coordinates) {
        return ProximityGraphBuilder.fromPoints(List.of(points(coordinates)), radius);
    }
}
