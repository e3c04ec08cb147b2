package org.Aayush.graphlib.shortestpath;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import lombok.experimental.UtilityClass;
import org.Aayush.graphlib.graph.Edge;
import org.Aayush.graphlib.graph.Graph;
import org.Aayush.graphlib.graph.VertexBounds;
import org.Aayush.graphlib.weight.WeightType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Dijkstra single-source shortest paths for graphs without negative arc weights.
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * ShortestPathTree<Integer> tree = Dijkstra.shortestPaths(g, s);   // distances from s
 * tree.distance(t);                                                // Optional: empty if unreachable
 * ShortestPathTree<Integer> toT = Dijkstra.shortestPathsTo(g, t);  // distances to t
 * }</pre>
 * <p>
 * <strong>Complexity:</strong> O(E log V).
 * </p>
 * <p>
 * <strong>Caveats:</strong> every arc weight must be {@code >= 0}. This is not checked;
 * a negative arc may silently produce wrong distances. Use {@link BellmanFord} for
 * general weights.
 * </p>
 */
@UtilityClass
public final class Dijkstra {
    private static final Logger log = LoggerFactory.getLogger(Dijkstra.class);

    /**
     * Computes shortest distances and a shortest-path tree from {@code source}.
     *
     * @param graph graph with non-negative weights.
     * @param source source vertex.
     * @return shortest-path tree rooted at {@code source}.
     * @throws IndexOutOfBoundsException if {@code source} is out of range.
     */
    public static <W> ShortestPathTree<W> shortestPaths(Graph<W> graph, int source) {
        Objects.requireNonNull(graph, "graph");
        int vertexCount = graph.vertexCount();
        VertexBounds.requireVertex(source, vertexCount, "source");
        WeightType<W> weightType = graph.weightType();

        ObjectArrayList<W> best = new ObjectArrayList<>(vertexCount);
        best.size(vertexCount);
        int[] predecessors = new int[vertexCount];
        Arrays.fill(predecessors, ShortestPathTree.NO_PREDECESSOR);

        best.set(source, weightType.zero());
        PriorityQueue<FrontierEntry<W>> frontier = new PriorityQueue<>(FrontierEntry.ordering(weightType));
        frontier.add(new FrontierEntry<>(source, weightType.zero()));

        int settled = 0;
        int stale = 0;
        while (!frontier.isEmpty()) {
            FrontierEntry<W> entry = frontier.poll();
            int vertex = entry.vertex();
            W distance = entry.distance();
            if (weightType.compare(best.get(vertex), distance) < 0) {
                stale++;
                continue;
            }
            settled++;

            for (Edge<W> edge : graph.edgesFrom(vertex)) {
                W next = weightType.add(distance, edge.weight());
                if (!weightType.improves(next, best.get(edge.to()))) {
                    continue;
                }
                best.set(edge.to(), next);
                predecessors[edge.to()] = vertex;
                frontier.add(new FrontierEntry<>(edge.to(), next));
            }
        }

        if (log.isTraceEnabled()) {
            log.trace("dijkstra source={} vertices={} arcs={} settled={} staleSkipped={}",
                    source, vertexCount, graph.arcCount(), settled, stale);
        }
        return new ShortestPathTree<>(weightType, source, best, predecessors);
    }

    /**
     * Shortest distances from {@code source}, indexed by vertex; empty entries are unreachable.
     */
    public static <W> List<Optional<W>> distances(Graph<W> graph, int source) {
        return shortestPaths(graph, source).distances();
    }

    /**
     * Single-destination shortest paths, solved as single-source on {@link Graph#reversed()}.
     * <p>
     * In the returned tree, {@code distance(v)} is the distance from {@code v} to {@code target},
     * {@code predecessor(v)} is the next hop from {@code v} toward {@code target}, and
     * {@code pathTo(v)} lists the route {@code v -> target} backwards (starting at {@code target}).
     * </p>
     */
    public static <W> ShortestPathTree<W> shortestPathsTo(Graph<W> graph, int target) {
        Objects.requireNonNull(graph, "graph");
        VertexBounds.requireVertex(target, graph.vertexCount(), "target");
        return shortestPaths(graph.reversed(), target);
    }
}
