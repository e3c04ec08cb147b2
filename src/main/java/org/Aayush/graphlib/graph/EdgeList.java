package org.Aayush.graphlib.graph;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectLists;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.graphlib.weight.WeightType;

import java.util.List;
import java.util.Objects;

/**
 * Flat, insertion-ordered collection of arcs.
 * <p>
 * Input representation for algorithms that scan every edge and need no adjacency
 * structure (Bellman-Ford, Kruskal). The vertex count is supplied by the caller at
 * algorithm time; endpoints are range-checked there.
 * </p>
 * <pre>{@code
 * EdgeList<Integer> edges = EdgeList.create(WeightTypes.INTEGER);
 * edges.add(0, 1, 4).add(1, 2, -3);
 * }</pre>
 *
 * @param <W> weight type.
 */
public final class EdgeList<W> {

    @Getter
    @Accessors(fluent = true)
    private final WeightType<W> weightType;

    private final ObjectArrayList<Edge<W>> edges = new ObjectArrayList<>();

    private EdgeList(WeightType<W> weightType) {
        this.weightType = Objects.requireNonNull(weightType, "weightType");
    }

    /**
     * Creates an empty edge list.
     */
    public static <W> EdgeList<W> create(WeightType<W> weightType) {
        return new EdgeList<>(weightType);
    }

    /**
     * Appends the arc {@code from -> to}.
     *
     * @throws IndexOutOfBoundsException if an endpoint is negative.
     */
    public EdgeList<W> add(int from, int to, W weight) {
        edges.add(Edge.of(from, to, weightType.requireValid(weight)));
        return this;
    }

    /**
     * Appends the arc {@code from -> to} with the weight type's unit weight.
     */
    public EdgeList<W> add(int from, int to) {
        return add(from, to, weightType.one());
    }

    public int size() {
        return edges.size();
    }

    public boolean isEmpty() {
        return edges.isEmpty();
    }

    public Edge<W> get(int index) {
        return edges.get(index);
    }

    /**
     * Unmodifiable view of the stored arcs, in insertion order.
     */
    public List<Edge<W>> edges() {
        return ObjectLists.unmodifiable(edges);
    }

    /**
     * Checks every endpoint against {@code vertexCount}.
     *
     * @throws IndexOutOfBoundsException naming the first offending arc.
     */
    public void requireVerticesBelow(int vertexCount) {
        for (int i = 0; i < edges.size(); i++) {
            Edge<W> edge = edges.get(i);
            if (edge.from() >= vertexCount || edge.to() >= vertexCount) {
                throw new IndexOutOfBoundsException(
                        "edge #" + i + " " + edge.from() + "->" + edge.to()
                                + " out of bounds for vertexCount " + vertexCount
                );
            }
        }
    }

    void append(Edge<W> edge) {
        edges.add(edge);
    }

    @Override
    public String toString() {
        return "EdgeList{size=" + edges.size() + ", weightType=" + weightType.name() + "}";
    }
}
