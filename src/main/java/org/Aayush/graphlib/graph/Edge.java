package org.Aayush.graphlib.graph;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Immutable weighted arc {@code from -> to}.
 * <p>
 * Vertex ids are zero-based indices into the owning {@link Graph} or the vertex count
 * supplied alongside an {@link EdgeList}. An undirected logical edge is stored as two
 * {@code Edge} instances carrying the same weight.
 * </p>
 *
 * @param <W> weight type.
 */
@Value
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Edge<W> {
    /** Origin vertex id. */
    int from;
    /** Destination vertex id. */
    int to;
    /** Arc weight, never null. */
    W weight;

    /**
     * Creates an arc.
     *
     * @param from origin vertex id; must be {@code >= 0}.
     * @param to destination vertex id; must be {@code >= 0}.
     * @param weight arc weight; must be non-null.
     * @return immutable arc.
     */
    public static <W> Edge<W> of(int from, int to, W weight) {
        if (from < 0) {
            throw new IndexOutOfBoundsException("from vertex must be >= 0, got " + from);
        }
        if (to < 0) {
            throw new IndexOutOfBoundsException("to vertex must be >= 0, got " + to);
        }
        return new Edge<>(from, to, Objects.requireNonNull(weight, "weight"));
    }

    /**
     * Returns the opposite arc {@code to -> from} with the same weight.
     */
    public Edge<W> reversed() {
        return new Edge<>(to, from, weight);
    }
}
