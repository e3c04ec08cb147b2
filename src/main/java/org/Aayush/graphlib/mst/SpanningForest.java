package org.Aayush.graphlib.mst;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import org.Aayush.graphlib.graph.Edge;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable minimum spanning forest selected by {@link Kruskal}.
 *
 * @param <W> weight type.
 */
@Getter
@ToString
@Accessors(fluent = true)
public final class SpanningForest<W> {
    /** Selected edges in selection (ascending weight) order. */
    private final List<Edge<W>> edges;
    /** Sum of the selected edge weights. */
    private final W totalWeight;
    /** Number of trees in the forest, isolated vertices included. */
    private final int componentCount;

    SpanningForest(List<Edge<W>> edges, W totalWeight, int componentCount) {
        this.edges = Collections.unmodifiableList(Objects.requireNonNull(edges, "edges"));
        this.totalWeight = Objects.requireNonNull(totalWeight, "totalWeight");
        this.componentCount = componentCount;
    }

    /**
     * Whether the forest is a single tree spanning every vertex.
     */
    public boolean isSpanningTree() {
        return componentCount == 1;
    }
}
