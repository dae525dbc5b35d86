package org.Dirac.routing.graph;

import org.Dirac.routing.geometry.Point;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Draws layout points uniformly from {@code [0.1, 0.9]^2}.
 *
 * <p>The random source is passed in, never ambient. Each point consumes two draws, x then y.</p>
 */
public final class PointSampler {
    static final double LOWER_BOUND = 0.1d;
    static final double UPPER_BOUND = 0.9d;

    private final Random random;

    public PointSampler(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Creates a sampler over a fresh generator seeded with {@code seed}.
     */
    public static PointSampler seeded(long seed) {
        return new PointSampler(new Random(seed));
    }

    public Point next() {
        double x = uniform();
        double y = uniform();
        return Point.of(x, y);
    }

    /**
     * Draws {@code count} points in order.
     */
    public List<Point> sample(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0: " + count);
        }
        List<Point> points = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            points.add(next());
        }
        return points;
    }

    private double uniform() {
        return LOWER_BOUND + (UPPER_BOUND - LOWER_BOUND) * random.nextDouble();
    }
}
