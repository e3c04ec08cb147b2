package org.Aayush.graphlib.shortestpath;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.graphlib.graph.VertexBounds;
import org.Aayush.graphlib.weight.WeightType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable single-source shortest-path result.
 * <p>
 * Holds one distance per vertex (absent when unreachable) and the predecessor of each
 * reached vertex on one shortest path from {@link #source()}.
 * </p>
 *
 * @param <W> weight type.
 */
public final class ShortestPathTree<W> {
    public static final int NO_PREDECESSOR = -1;

    @Getter
    @Accessors(fluent = true)
    private final WeightType<W> weightType;

    @Getter
    @Accessors(fluent = true)
    private final int source;

    private final List<W> distances;
    private final int[] predecessors;

    ShortestPathTree(WeightType<W> weightType, int source, List<W> distances, int[] predecessors) {
        if (distances.size() != predecessors.length) {
            throw new IllegalArgumentException(
                    "distance/predecessor length mismatch: " + distances.size() + " != " + predecessors.length
            );
        }
        this.weightType = Objects.requireNonNull(weightType, "weightType");
        this.source = source;
        this.distances = Collections.unmodifiableList(new ArrayList<>(distances));
        this.predecessors = Arrays.copyOf(predecessors, predecessors.length);
    }

    public int vertexCount() {
        return predecessors.length;
    }

    /**
     * Shortest distance from the source to {@code vertex}, or empty when unreachable.
     */
    public Optional<W> distance(int vertex) {
        VertexBounds.requireVertex(vertex, vertexCount());
        return Optional.ofNullable(distances.get(vertex));
    }

    public boolean isReachable(int vertex) {
        VertexBounds.requireVertex(vertex, vertexCount());
        return distances.get(vertex) != null;
    }

    /**
     * All distances indexed by vertex id; unreachable vertices map to {@link Optional#empty()}.
     */
    public List<Optional<W>> distances() {
        List<Optional<W>> view = new ArrayList<>(distances.size());
        for (W distance : distances) {
            view.add(Optional.ofNullable(distance));
        }
        return Collections.unmodifiableList(view);
    }

    /**
     * Previous vertex on the recorded shortest path, or {@link #NO_PREDECESSOR}
     * for the source and for unreachable vertices.
     */
    public int predecessor(int vertex) {
        VertexBounds.requireVertex(vertex, vertexCount());
        return predecessors[vertex];
    }

    /**
     * Vertex sequence {@code source, ..., vertex} of the recorded shortest path.
     *
     * @return the path, or empty when {@code vertex} is unreachable.
     */
    public Optional<IntList> pathTo(int vertex) {
        if (!isReachable(vertex)) {
            return Optional.empty();
        }
        IntArrayList path = new IntArrayList();
        int current = vertex;
        while (current != NO_PREDECESSOR) {
            path.add(current);
            if (path.size() > vertexCount()) {
                throw new IllegalStateException("predecessor chain does not terminate at source " + source);
            }
            current = predecessors[current];
        }
        Collections.reverse(path);
        return Optional.of(IntLists.unmodifiable(path));
    }

    @Override
    public String toString() {
        return "ShortestPathTree{source=" + source + ", distances=" + distances + "}";
    }
}
