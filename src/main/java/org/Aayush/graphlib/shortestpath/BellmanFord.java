package org.Aayush.graphlib.shortestpath;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import lombok.experimental.UtilityClass;
import org.Aayush.graphlib.core.ComputationBudget;
import org.Aayush.graphlib.core.GraphAlgorithmException;
import org.Aayush.graphlib.graph.Edge;
import org.Aayush.graphlib.graph.EdgeList;
import org.Aayush.graphlib.graph.VertexBounds;
import org.Aayush.graphlib.weight.WeightType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Bellman-Ford single-source shortest paths for arbitrary (including negative) weights.
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * EdgeList<Integer> edges = EdgeList.create(WeightTypes.INTEGER);
 * edges.add(a, b, c);                                                  // arc a->b of weight c
 * Optional<ShortestPathTree<Integer>> bf = BellmanFord.shortestPaths(edges, V, s);
 * if (bf.isEmpty()) { ... }                                            // negative cycle reachable from s
 * }</pre>
 * <p>
 * <strong>Complexity:</strong> O(V * E).
 * </p>
 * <p>
 * <strong>Caveats:</strong> the edge list is directed; add both arcs for an undirected edge
 * (or use {@code graph.edgeList()}). Only negative cycles reachable from the source are
 * detected. Work is bounded by {@link ComputationBudget#checkRelaxations(int, int)}.
 * </p>
 */
@UtilityClass
public final class BellmanFord {
    private static final Logger log = LoggerFactory.getLogger(BellmanFord.class);

    /**
     * Computes shortest paths from {@code source} using {@link ComputationBudget#defaults()}.
     * <p>
     * The system properties behind the default budget are read again on every call.
     * </p>
     *
     * @see #shortestPaths(EdgeList, int, int, ComputationBudget)
     */
    public static <W> Optional<ShortestPathTree<W>> shortestPaths(EdgeList<W> edges, int vertexCount, int source) {
        return shortestPaths(edges, vertexCount, source, ComputationBudget.defaults());
    }

    /**
     * Computes shortest paths from {@code source}.
     *
     * @param edges directed arcs.
     * @param vertexCount number of vertices; every endpoint must be below it.
     * @param source source vertex.
     * @param budget work bound.
     * @return the shortest-path tree, or empty when a negative cycle is reachable from {@code source}.
     * @throws IndexOutOfBoundsException if {@code source} or any endpoint is out of range.
     * @throws ComputationBudget.BudgetExceededException if {@code vertexCount * edges.size()} exceeds the budget.
     */
    public static <W> Optional<ShortestPathTree<W>> shortestPaths(
            EdgeList<W> edges,
            int vertexCount,
            int source,
            ComputationBudget budget
    ) {
        Objects.requireNonNull(edges, "edges");
        Objects.requireNonNull(budget, "budget");
        GraphAlgorithmException.requireVertexCount(vertexCount);
        VertexBounds.requireVertex(source, vertexCount, "source");
        edges.requireVerticesBelow(vertexCount);
        budget.checkRelaxations(vertexCount, edges.size());

        WeightType<W> weightType = edges.weightType();
        List<Edge<W>> arcs = edges.edges();

        ObjectArrayList<W> best = new ObjectArrayList<>(vertexCount);
        best.size(vertexCount);
        int[] predecessors = new int[vertexCount];
        Arrays.fill(predecessors, ShortestPathTree.NO_PREDECESSOR);
        best.set(source, weightType.zero());

        int passes = 0;
        for (int pass = 0; pass < vertexCount - 1; pass++) {
            passes++;
            if (!relaxAll(arcs, weightType, best, predecessors)) {
                break;
            }
        }

        for (Edge<W> edge : arcs) {
            W from = best.get(edge.from());
            if (from == null) {
                continue;
            }
            if (weightType.improves(weightType.add(from, edge.weight()), best.get(edge.to()))) {
                log.debug("bellman-ford source={} negative cycle detected via arc {}->{}",
                        source, edge.from(), edge.to());
                return Optional.empty();
            }
        }

        if (log.isTraceEnabled()) {
            log.trace("bellman-ford source={} vertices={} arcs={} passes={}",
                    source, vertexCount, arcs.size(), passes);
        }
        return Optional.of(new ShortestPathTree<>(weightType, source, best, predecessors));
    }

    /**
     * One full relaxation pass over every arc with a reached origin.
     *
     * @return whether any distance improved.
     */
    private static <W> boolean relaxAll(
            List<Edge<W>> arcs,
            WeightType<W> weightType,
            ObjectArrayList<W> best,
            int[] predecessors
    ) {
        boolean changed = false;
        for (Edge<W> edge : arcs) {
            W from = best.get(edge.from());
            if (from == null) {
                continue;
            }
            W candidate = weightType.add(from, edge.weight());
            if (weightType.improves(candidate, best.get(edge.to()))) {
                best.set(edge.to(), candidate);
                predecessors[edge.to()] = edge.from();
                changed = true;
            }
        }
        return changed;
    }
}
