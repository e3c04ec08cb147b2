package org.Aayush.graphlib.graph;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectLists;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.graphlib.core.GraphAlgorithmException;
import org.Aayush.graphlib.weight.WeightType;

import java.util.List;
import java.util.Objects;

/**
 * Fixed-size adjacency-list graph with generic edge weights.
 * <p>
 * The vertex count is set at construction and never changes; only arcs are added.
 * {@code edgesFrom(v)} lists the arcs leaving {@code v} in insertion order.
 * </p>
 * <pre>{@code
 * Graph<Integer> g = Graph.create(4, WeightTypes.INTEGER);
 * g.addEdge(0, 1, 4);   // undirected: 0->1 and 1->0
 * g.addArc(2, 3, 2);    // directed: 2->3 only
 * g.addEdge(0, 2);      // undirected with the type's unit weight
 * }</pre>
 * <p><strong>Thread Safety:</strong> NOT thread-safe. Owned by the calling context.</p>
 *
 * @param <W> weight type.
 */
public final class Graph<W> {

    @Getter
    @Accessors(fluent = true)
    private final WeightType<W> weightType;

    @Getter
    @Accessors(fluent = true)
    private final int vertexCount;

    // adjacency[v] = arcs with from == v
    private final ObjectArrayList<ObjectArrayList<Edge<W>>> adjacency;

    @Getter
    @Accessors(fluent = true)
    private int arcCount;

    private Graph(int vertexCount, WeightType<W> weightType) {
        this.vertexCount = GraphAlgorithmException.requireVertexCount(vertexCount);
        this.weightType = Objects.requireNonNull(weightType, "weightType");
        this.adjacency = new ObjectArrayList<>(vertexCount);
        for (int v = 0; v < vertexCount; v++) {
            adjacency.add(new ObjectArrayList<>());
        }
    }

    /**
     * Creates an empty graph with {@code vertexCount} isolated vertices.
     *
     * @param vertexCount number of vertices; must be {@code >= 0}.
     * @param weightType arithmetic for edge weights.
     * @return empty graph.
     * @throws GraphAlgorithmException if {@code vertexCount} is negative.
     */
    public static <W> Graph<W> create(int vertexCount, WeightType<W> weightType) {
        return new Graph<>(vertexCount, weightType);
    }

    /**
     * Adds an undirected edge: arcs {@code from -> to} and {@code to -> from} with the same weight.
     *
     * @throws IndexOutOfBoundsException if either endpoint is out of range.
     */
    public Graph<W> addEdge(int from, int to, W weight) {
        VertexBounds.requireVertex(from, vertexCount, "from");
        VertexBounds.requireVertex(to, vertexCount, "to");
        W checked = weightType.requireValid(weight);
        Edge<W> forward = Edge.of(from, to, checked);
        appendArc(forward);
        appendArc(forward.reversed());
        return this;
    }

    /**
     * Adds an undirected edge with the weight type's unit weight.
     */
    public Graph<W> addEdge(int from, int to) {
        return addEdge(from, to, weightType.one());
    }

    /**
     * Adds a directed arc {@code from -> to}.
     *
     * @throws IndexOutOfBoundsException if either endpoint is out of range.
     */
    public Graph<W> addArc(int from, int to, W weight) {
        VertexBounds.requireVertex(from, vertexCount, "from");
        VertexBounds.requireVertex(to, vertexCount, "to");
        appendArc(Edge.of(from, to, weightType.requireValid(weight)));
        return this;
    }

    /**
     * Adds a directed arc with the weight type's unit weight.
     */
    public Graph<W> addArc(int from, int to) {
        return addArc(from, to, weightType.one());
    }

    /**
     * Unmodifiable view of the arcs leaving {@code vertex}, in insertion order.
     */
    public List<Edge<W>> edgesFrom(int vertex) {
        VertexBounds.requireVertex(vertex, vertexCount);
        return ObjectLists.unmodifiable(adjacency.get(vertex));
    }

    public int outDegree(int vertex) {
        VertexBounds.requireVertex(vertex, vertexCount);
        return adjacency.get(vertex).size();
    }

    /**
     * Flattens every arc into a new {@link EdgeList}, vertex by vertex in adjacency order.
     * An undirected edge contributes both of its arcs.
     */
    public EdgeList<W> edgeList() {
        EdgeList<W> edges = EdgeList.create(weightType);
        for (int v = 0; v < vertexCount; v++) {
            for (Edge<W> edge : adjacency.get(v)) {
                edges.append(edge);
            }
        }
        return edges;
    }

    /**
     * Returns a new graph with every arc flipped.
     * <p>
     * Single-destination shortest paths on this graph are single-source shortest paths
     * on the reversed graph.
     * </p>
     */
    public Graph<W> reversed() {
        Graph<W> reversed = new Graph<>(vertexCount, weightType);
        for (int v = 0; v < vertexCount; v++) {
            for (Edge<W> edge : adjacency.get(v)) {
                reversed.appendArc(edge.reversed());
            }
        }
        return reversed;
    }

    private void appendArc(Edge<W> edge) {
        adjacency.get(edge.from()).add(edge);
        arcCount++;
    }

    @Override
    public String toString() {
        return "Graph{vertices=" + vertexCount + ", arcs=" + arcCount + ", weightType=" + weightType.name() + "}";
    }
}
