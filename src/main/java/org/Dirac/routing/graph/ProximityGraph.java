package org.Dirac.routing.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Dirac.core.id.LabelIndex;
import org.Dirac.routing.geometry.Point;

import java.util.List;

/**
 * Immutable undirected proximity graph over labelled points.
 * <p>
 * Invariant: edge {u, v} exists iff {@code distance(u, v) <= radius}. No self-loops,
 * no parallel edges. Vertices are ordered by index, which is the label order.
 * <p>
 * Layout:
 * - Flat {@code n * n} adjacency matrix for O(1) edge checks in the exact search.
 * - Per-vertex neighbor lists in ascending index order.
 * - Edge and far-pair lists in (i, j) lexicographic order, i < j.
 */
public final class ProximityGraph {
    private final List<Vertex> vertices;
    private final LabelIndex labelIndex;
    private final boolean[] adjacency;
    private final IntList[] neighbors;
    private final List<Edge> edges;
    private final List<FarPair> farPairs;

    @Getter
    @Accessors(fluent = true)
    private final int vertexCount;
    @Getter
    @Accessors(fluent = true)
    private final double radius;

    ProximityGraph(List<Vertex> vertices, LabelIndex labelIndex, double radius,
                   boolean[] adjacency, IntArrayList[] neighbors,
                   List<Edge> edges, List<FarPair> farPairs) {
        this.vertices = List.copyOf(vertices);
        this.labelIndex = labelIndex;
        this.vertexCount = vertices.size();
        this.radius = radius;
        this.adjacency = adjacency;
        this.neighbors = new IntList[neighbors.length];
        for (int i = 0; i < neighbors.length; i++) {
            neighbors[i].trim();
            this.neighbors[i] = IntLists.unmodifiable(neighbors[i]);
        }
        this.edges = List.copyOf(edges);
        this.farPairs = List.copyOf(farPairs);
    }

    // ========================================================================
    // VERTEX ACCESS
    // ========================================================================

    public List<Vertex> vertices() {
        return vertices;
    }

    public Vertex vertex(int index) {
        checkIndex(index);
        return vertices.get(index);
    }

    /**
     * @throws LabelIndex.UnknownLabelException if the label is not in this graph.
     */
    public Vertex vertex(String label) {
        return vertices.get(labelIndex.toIndex(label));
    }

    public Point point(int index) {
        return vertex(index).getPoint();
    }

    public String label(int index) {
        return labelIndex.toLabel(index);
    }

    public List<String> labels() {
        return labelIndex.labels();
    }

    public LabelIndex labelIndex() {
        return labelIndex;
    }

    // ========================================================================
    // ADJACENCY (O(1))
    // ========================================================================

    /**
     * UNCHECKED - caller must pass valid indices; used on the search hot path.
     */
    public boolean hasEdge(int first, int second) {
        assert first >= 0 && first < vertexCount && second >= 0 && second < vertexCount;
        return adjacency[first * vertexCount + second];
    }

    public boolean hasEdge(String firstLabel, String secondLabel) {
        return hasEdge(labelIndex.toIndex(firstLabel), labelIndex.toIndex(secondLabel));
    }

    /**
     * Neighbor indices in ascending order.
     */
    public IntList neighbors(int index) {
        checkIndex(index);
        return neighbors[index];
    }

    public int degree(int index) {
        return neighbors(index).size();
    }

    /**
     * Full-precision Euclidean distance between two vertices, edge or not.
     */
    public double distance(int first, int second) {
        return point(first).distanceTo(point(second));
    }

    public List<Edge> edges() {
        return edges;
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * Pairs farther apart than the radius. Edges plus far pairs cover every unordered pair once.
     */
    public List<FarPair> farPairs() {
        return farPairs;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= vertexCount) {
            throw new IndexOutOfBoundsException(
                    "vertex index out of bounds: " + index + " [0, " + vertexCount + ")"
            );
        }
    }
}
