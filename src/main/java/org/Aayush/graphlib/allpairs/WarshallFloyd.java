package org.Aayush.graphlib.allpairs;

import lombok.experimental.UtilityClass;
import org.Aayush.graphlib.core.ComputationBudget;
import org.Aayush.graphlib.graph.Edge;
import org.Aayush.graphlib.graph.Graph;
import org.Aayush.graphlib.weight.WeightType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Warshall-Floyd all-pairs shortest paths, plus O(V^2) single-edge insertion.
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * DistanceMatrix<Integer> wf = WarshallFloyd.computeAllPairs(g);   // all-pairs distances of g
 * WarshallFloyd.insertEdge(wf, a, b, c);                            // add undirected edge a-b (weight c), update wf
 * wf.hasNegativeCycle();                                            // some d[v][v] < 0
 * }</pre>
 * <p>
 * <strong>Complexity:</strong> O(V^3) for {@link #computeAllPairs}; O(V^2) per inserted edge.
 * </p>
 * <p>
 * <strong>Caveats:</strong> a negative cycle shows up as a negative diagonal cell; closure stops
 * at the first one, so only {@link DistanceMatrix#hasNegativeCycle()} is meaningful then. Insertion is valid only on a transitively closed matrix and
 * cannot express removals or weight increases. Matrix size is bounded by
 * {@link ComputationBudget#checkMatrixVertices(int)}.
 * </p>
 */
@UtilityClass
public final class WarshallFloyd {
    private static final Logger log = LoggerFactory.getLogger(WarshallFloyd.class);

    /**
     * Computes all-pairs shortest paths using {@link ComputationBudget#defaults()}.
     * <p>
     * The system properties behind the default budget are read again on every call.
     * </p>
     */
    public static <W> DistanceMatrix<W> computeAllPairs(Graph<W> graph) {
        return computeAllPairs(graph, ComputationBudget.defaults());
    }

    /**
     * Computes all-pairs shortest paths.
     * <p>
     * The matrix starts with zero on the diagonal, the lightest direct arc between each
     * ordered pair, and unreachable elsewhere; every vertex is then used as a pivot in turn.
     * </p>
     *
     * @param graph input graph.
     * @param budget matrix-size bound.
     * @return closed distance matrix.
     * @throws ComputationBudget.BudgetExceededException if the vertex count exceeds the budget.
     */
    public static <W> DistanceMatrix<W> computeAllPairs(Graph<W> graph, ComputationBudget budget) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(budget, "budget");
        int vertexCount = graph.vertexCount();
        budget.checkMatrixVertices(vertexCount);
        WeightType<W> weightType = graph.weightType();

        DistanceMatrix<W> matrix = new DistanceMatrix<>(weightType, vertexCount);
        for (int v = 0; v < vertexCount; v++) {
            matrix.set(v, v, weightType.zero());
        }
        for (int v = 0; v < vertexCount; v++) {
            for (Edge<W> edge : graph.edgesFrom(v)) {
                W current = matrix.get(edge.from(), edge.to());
                if (weightType.improves(edge.weight(), current)) {
                    matrix.set(edge.from(), edge.to(), edge.weight());
                }
            }
        }

        if (matrix.hasNegativeCycle()) {
            log.debug("warshall-floyd vertices={} arcs={} negative self-loop, closure skipped",
                    vertexCount, graph.arcCount());
            return matrix;
        }
        for (int pivot = 0; pivot < vertexCount; pivot++) {
            if (!matrix.closeThrough(pivot)) {
                log.debug("warshall-floyd vertices={} arcs={} negative diagonal at pivot {}, closure stopped",
                        vertexCount, graph.arcCount(), pivot);
                break;
            }
        }
        return matrix;
    }

    /**
     * Adds an undirected edge to an already computed matrix and re-closes it.
     *
     * @see DistanceMatrix#insertEdge(int, int, Object)
     */
    public static <W> DistanceMatrix<W> insertEdge(DistanceMatrix<W> matrix, int from, int to, W weight) {
        return Objects.requireNonNull(matrix, "matrix").insertEdge(from, to, weight);
    }

    /**
     * Adds an undirected edge with the weight type's unit weight.
     */
    public static <W> DistanceMatrix<W> insertEdge(DistanceMatrix<W> matrix, int from, int to) {
        Objects.requireNonNull(matrix, "matrix");
        return matrix.insertEdge(from, to, matrix.weightType().one());
    }
}
