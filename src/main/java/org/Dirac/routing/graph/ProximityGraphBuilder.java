package org.Dirac.routing.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.extern.slf4j.Slf4j;
import org.Dirac.core.id.LabelAlphabet;
import org.Dirac.core.id.LabelIndex;
import org.Dirac.routing.geometry.Point;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds deterministic proximity graphs from a seed or from an explicit layout.
 *
 * <p>Labels follow point order: the first point is {@code A}. Pairs are visited as
 * {@code (i, j)} with {@code i < j}; a pair becomes an edge iff its distance is at most
 * the radius.</p>
 */
@Slf4j
public final class ProximityGraphBuilder {
    private final GenerationBounds bounds;

    public ProximityGraphBuilder() {
        this(GenerationBounds.defaults());
    }

    public ProximityGraphBuilder(GenerationBounds bounds) {
        this.bounds = Objects.requireNonNull(bounds, "bounds");
    }

    /**
     * Samples {@code vertexCount} points from a generator seeded with {@code seed} and
     * connects every pair within {@code radius}.
     *
     * @param vertexCount number of delivery locations, within the generation bounds.
     * @param radius connection threshold in {@code (0, maxRadius]}.
     * @param seed layout seed.
     * @return immutable graph; identical inputs give identical graphs.
     */
    public ProximityGraph build(int vertexCount, double radius, long seed) {
        bounds.checkVertexCount(vertexCount);
        bounds.checkRadius(radius);
        List<Point> points = PointSampler.seeded(seed).sample(vertexCount);
        log.debug("sampled {} points with seed {}", vertexCount, seed);
        return fromPoints(points, radius);
    }

    /**
     * Builds a graph over a fixed layout. The radius may exceed 1 here so that a
     * layout can be made complete.
     *
     * @param points ordered layout, 1 to 26 points.
     * @param radius connection threshold, positive and finite.
     * @return immutable graph.
     */
    public static ProximityGraph fromPoints(List<Point> points, double radius) {
        Objects.requireNonNull(points, "points");
        if (points.isEmpty() || points.size() > LabelAlphabet.MAX_SIZE) {
            throw new IllegalArgumentException(
                    "point count must be in [1, " + LabelAlphabet.MAX_SIZE + "]: " + points.size()
            );
        }
        if (!Double.isFinite(radius) || radius <= 0.0d) {
            throw new IllegalArgumentException("radius must be positive and finite: " + radius);
        }

        int n = points.size();
        LabelIndex labelIndex = LabelIndex.of(LabelAlphabet.firstLabels(n));
        List<Vertex> vertices = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Point point = Objects.requireNonNull(points.get(i), "points[" + i + "]");
            vertices.add(new Vertex(labelIndex.toLabel(i), i, point));
        }

        boolean[] adjacency = new boolean[n * n];
        IntArrayList[] neighbors = new IntArrayList[n];
        for (int i = 0; i < n; i++) {
            neighbors[i] = new IntArrayList();
        }
        List<Edge> edges = new ArrayList<>();
        List<FarPair> farPairs = new ArrayList<>();

        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double distance = vertices.get(i).getPoint().distanceTo(vertices.get(j).getPoint());
                String first = vertices.get(i).getLabel();
                String second = vertices.get(j).getLabel();
                if (distance <= radius) {
                    adjacency[i * n + j] = true;
                    adjacency[j * n + i] = true;
                    neighbors[i].add(j);
                    neighbors[j].add(i);
                    edges.add(new Edge(first, second, i, j, distance));
                } else {
                    farPairs.add(new FarPair(first, second, distance));
                }
            }
        }

        log.debug("built proximity graph: vertices={}, edges={}, farPairs={}, radius={}",
                n, edges.size(), farPairs.size(), radius);
        return new ProximityGraph(vertices, labelIndex, radius, adjacency, neighbors, edges, farPairs);
    }
}
