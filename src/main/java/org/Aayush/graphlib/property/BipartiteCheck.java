package org.Aayush.graphlib.property;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.experimental.UtilityClass;
import org.Aayush.graphlib.graph.Edge;
import org.Aayush.graphlib.graph.Graph;
import org.Aayush.graphlib.graph.VertexBounds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Bipartiteness test by depth-first two-coloring.
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * BipartiteCheck.isBipartite(g);                 // every component two-colorable
 * BipartiteCheck.isComponentBipartite(g, 0);     // only the component of vertex 0
 * BipartiteCheck.twoColoring(g)                  // sides, if bipartite
 *         .map(c -> c.sideSize(0));
 * }</pre>
 * <p>
 * <strong>Complexity:</strong> O(V + E).
 * </p>
 * <p>
 * <strong>Caveats:</strong> intended for undirected graphs (edges added with
 * {@code addEdge}). A conflict does not stop the traversal; every reachable vertex is
 * still colored before the result is returned.
 * </p>
 */
@UtilityClass
public final class BipartiteCheck {
    private static final Logger log = LoggerFactory.getLogger(BipartiteCheck.class);

    private static final int UNCOLORED = -1;

    /**
     * Returns whether every connected component is two-colorable. An empty graph is bipartite.
     */
    public static <W> boolean isBipartite(Graph<W> graph) {
        Objects.requireNonNull(graph, "graph");
        int[] colors = newColors(graph.vertexCount());
        return colorAll(graph, colors);
    }

    /**
     * Returns whether the component reachable from {@code root} is two-colorable.
     * Vertices outside that component are not examined.
     *
     * @throws IndexOutOfBoundsException if {@code root} is out of range.
     */
    public static <W> boolean isComponentBipartite(Graph<W> graph, int root) {
        Objects.requireNonNull(graph, "graph");
        VertexBounds.requireVertex(root, graph.vertexCount(), "root");
        int[] colors = newColors(graph.vertexCount());
        return colorComponent(graph, root, colors);
    }

    /**
     * Two-colors the whole graph.
     *
     * @return the coloring, or empty when some component has an odd cycle.
     */
    public static <W> Optional<TwoColoring> twoColoring(Graph<W> graph) {
        Objects.requireNonNull(graph, "graph");
        int[] colors = newColors(graph.vertexCount());
        if (!colorAll(graph, colors)) {
            return Optional.empty();
        }
        return Optional.of(new TwoColoring(colors));
    }

    private static <W> boolean colorAll(Graph<W> graph, int[] colors) {
        boolean bipartite = true;
        for (int root = 0; root < colors.length; root++) {
            if (colors[root] == UNCOLORED) {
                bipartite &= colorComponent(graph, root, colors);
            }
        }
        return bipartite;
    }

    /**
     * Colors every vertex reachable from {@code root}, {@code root} getting color 0.
     * A vertex is colored when first discovered, opposite to its discoverer.
     *
     * @return false if any scanned arc joins two vertices of the same color.
     */
    private static <W> boolean colorComponent(Graph<W> graph, int root, int[] colors) {
        boolean bipartite = true;
        IntArrayList stack = new IntArrayList();
        colors[root] = 0;
        stack.push(root);
        while (!stack.isEmpty()) {
            int vertex = stack.popInt();
            int color = colors[vertex];
            for (Edge<W> edge : graph.edgesFrom(vertex)) {
                int neighbor = edge.to();
                if (colors[neighbor] == UNCOLORED) {
                    colors[neighbor] = 1 - color;
                    stack.push(neighbor);
                } else if (colors[neighbor] == color && bipartite) {
                    log.debug("odd cycle: arc {}->{} joins two vertices of color {}", vertex, neighbor, color);
                    bipartite = false;
                }
            }
        }
        return bipartite;
    }

    private static int[] newColors(int vertexCount) {
        int[] colors = new int[vertexCount];
        Arrays.fill(colors, UNCOLORED);
        return colors;
    }
}
