package org.Aayush.graphlib.property;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.Aayush.graphlib.graph.VertexBounds;

import java.util.Arrays;

/**
 * Immutable proper two-coloring of a bipartite graph.
 * <p>
 * Colors are {@code 0} and {@code 1}; the first vertex of every connected component
 * (lowest id) has color {@code 0}.
 * </p>
 */
public final class TwoColoring {
    private final int[] colors;
    private final int[] sideSizes = new int[2];

    TwoColoring(int[] colors) {
        this.colors = Arrays.copyOf(colors, colors.length);
        for (int color : this.colors) {
            sideSizes[requireColor(color)]++;
        }
    }

    public int vertexCount() {
        return colors.length;
    }

    /**
     * Color ({@code 0} or {@code 1}) of {@code vertex}.
     */
    public int colorOf(int vertex) {
        VertexBounds.requireVertex(vertex, colors.length);
        return colors[vertex];
    }

    /**
     * Number of vertices with the given color.
     */
    public int sideSize(int color) {
        return sideSizes[requireColor(color)];
    }

    /**
     * Vertices with the given color, ascending.
     */
    public IntList side(int color) {
        requireColor(color);
        IntArrayList vertices = new IntArrayList(sideSizes[color]);
        for (int v = 0; v < colors.length; v++) {
            if (colors[v] == color) {
                vertices.add(v);
            }
        }
        return IntLists.unmodifiable(vertices);
    }

    private static int requireColor(int color) {
        if (color != 0 && color != 1) {
            throw new IllegalArgumentException("color must be 0 or 1, got " + color);
        }
        return color;
    }

    @Override
    public String toString() {
        return "TwoColoring{sides=" + sideSizes[0] + "/" + sideSizes[1] + ", colors=" + Arrays.toString(colors) + "}";
    }
}
