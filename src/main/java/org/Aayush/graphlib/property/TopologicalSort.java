package org.Aayush.graphlib.property;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import lombok.experimental.UtilityClass;
import org.Aayush.graphlib.graph.Edge;
import org.Aayush.graphlib.graph.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Topological ordering of a directed graph.
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * Optional<IntList> ts = TopologicalSort.order(g);   // empty if g has a cycle
 * }</pre>
 * <p>
 * <strong>Complexity:</strong> O(V + E).
 * </p>
 * <p>
 * <strong>Caveats:</strong> arcs are read as directed; an undirected edge (two opposite arcs)
 * is itself a cycle. Traversal uses an explicit stack, so depth is not limited by the call stack.
 * </p>
 */
@UtilityClass
public final class TopologicalSort {
    private static final Logger log = LoggerFactory.getLogger(TopologicalSort.class);

    private static final byte UNVISITED = 0;
    private static final byte IN_PROGRESS = 1;
    private static final byte FINISHED = 2;

    /**
     * Computes a topological order.
     * <p>
     * Depth-first search from each unvisited vertex in ascending id order, following arcs in
     * adjacency order. A vertex is appended when finished; the reversed finish sequence is the
     * order. Meeting an in-progress vertex aborts with a cycle.
     * </p>
     *
     * @param graph directed graph.
     * @return vertices such that every arc {@code u -> v} has {@code u} before {@code v},
     * or empty when the graph has a cycle.
     */
    public static <W> Optional<IntList> order(Graph<W> graph) {
        Objects.requireNonNull(graph, "graph");
        int vertexCount = graph.vertexCount();
        byte[] color = new byte[vertexCount];
        IntArrayList finished = new IntArrayList(vertexCount);

        // Parallel stacks: vertex being expanded, its arcs, and index of its next arc to follow.
        IntArrayList stack = new IntArrayList();
        ObjectArrayList<List<Edge<W>>> arcStack = new ObjectArrayList<>();
        IntArrayList cursor = new IntArrayList();

        for (int root = 0; root < vertexCount; root++) {
            if (color[root] != UNVISITED) {
                continue;
            }
            color[root] = IN_PROGRESS;
            stack.push(root);
            arcStack.push(graph.edgesFrom(root));
            cursor.push(0);

            while (!stack.isEmpty()) {
                int top = stack.topInt();
                int next = cursor.topInt();
                List<Edge<W>> arcs = arcStack.top();
                if (next < arcs.size()) {
                    cursor.set(cursor.size() - 1, next + 1);
                    int target = arcs.get(next).to();
                    if (color[target] == FINISHED) {
                        continue;
                    }
                    if (color[target] == IN_PROGRESS) {
                        log.debug("topological sort aborted: cycle through arc {}->{}", top, target);
                        return Optional.empty();
                    }
                    color[target] = IN_PROGRESS;
                    stack.push(target);
                    arcStack.push(graph.edgesFrom(target));
                    cursor.push(0);
                } else {
                    stack.popInt();
                    arcStack.pop();
                    cursor.popInt();
                    color[top] = FINISHED;
                    finished.add(top);
                }
            }
        }

        Collections.reverse(finished);
        return Optional.of(IntLists.unmodifiable(finished));
    }

    /**
     * Returns whether the directed graph has no cycle.
     */
    public static <W> boolean isAcyclic(Graph<W> graph) {
        return order(graph).isPresent();
    }
}
