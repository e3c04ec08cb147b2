package org.Aayush.graphlib.mst;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import lombok.experimental.UtilityClass;
import org.Aayush.graphlib.core.GraphAlgorithmException;
import org.Aayush.graphlib.graph.Edge;
import org.Aayush.graphlib.graph.EdgeList;
import org.Aayush.graphlib.unionfind.DisjointSet;
import org.Aayush.graphlib.weight.WeightType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.Objects;

/**
 * Kruskal minimum spanning tree (forest, on disconnected input).
 * <p>
 * Edges are taken in ascending weight order and kept whenever they join two different
 * components of a {@link DisjointSet}.
 * </p>
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * EdgeList<Integer> edges = EdgeList.create(WeightTypes.INTEGER);
 * edges.add(a, b, c);                                       // edge a-b of weight c
 * int weight = Kruskal.totalWeight(edges, V);               // MST weight of the V-vertex graph
 * SpanningForest<Integer> mst = Kruskal.spanningForest(edges, V);
 * }</pre>
 * <p>
 * <strong>Complexity:</strong> O(E log E).
 * </p>
 * <p>
 * <strong>Caveats:</strong> arc direction is ignored. The caller's list is not reordered;
 * a sorted copy is used.
 * </p>
 */
@UtilityClass
public final class Kruskal {
    private static final Logger log = LoggerFactory.getLogger(Kruskal.class);

    /**
     * Total weight of a minimum spanning forest.
     *
     * @param edges candidate edges.
     * @param vertexCount number of vertices; every endpoint must be below it.
     * @return sum of the selected weights ({@code zero()} for an edgeless input).
     * @throws IndexOutOfBoundsException if an endpoint is out of range.
     */
    public static <W> W totalWeight(EdgeList<W> edges, int vertexCount) {
        return spanningForest(edges, vertexCount).totalWeight();
    }

    /**
     * Minimum spanning forest with its selected edges.
     *
     * @param edges candidate edges.
     * @param vertexCount number of vertices; every endpoint must be below it.
     * @return selected forest.
     * @throws IndexOutOfBoundsException if an endpoint is out of range.
     */
    public static <W> SpanningForest<W> spanningForest(EdgeList<W> edges, int vertexCount) {
        Objects.requireNonNull(edges, "edges");
        GraphAlgorithmException.requireVertexCount(vertexCount);
        edges.requireVerticesBelow(vertexCount);
        WeightType<W> weightType = edges.weightType();

        ObjectArrayList<Edge<W>> sorted = new ObjectArrayList<>(edges.edges());
        // ObjectArrayList.sort is a stable merge sort.
        sorted.sort(Comparator.comparing((Edge<W> edge) -> edge.weight(), weightType));

        DisjointSet components = DisjointSet.create(vertexCount);
        ObjectArrayList<Edge<W>> selected = new ObjectArrayList<>();
        W total = weightType.zero();
        for (Edge<W> edge : sorted) {
            if (components.unite(edge.from(), edge.to())) {
                selected.add(edge);
                total = weightType.add(total, edge.weight());
            }
        }

        log.debug("kruskal vertices={} candidates={} selected={} components={} totalWeight={}",
                vertexCount, sorted.size(), selected.size(), components.componentCount(), total);
        return new SpanningForest<>(selected, total, components.componentCount());
    }
}
