package org.Aayush.graphlib.graph;

import lombok.experimental.UtilityClass;

/**
 * Fail-fast vertex-id validation shared by graph containers and algorithms.
 */
@UtilityClass
public final class VertexBounds {

    /**
     * Validates that {@code vertex} lies in {@code [0, vertexCount)}.
     *
     * @param vertex vertex id to check.
     * @param vertexCount exclusive upper bound.
     * @param role name of the argument, used in the failure message.
     * @return the same vertex id.
     * @throws IndexOutOfBoundsException when the id is out of range.
     */
    public static int requireVertex(int vertex, int vertexCount, String role) {
        if (vertex < 0 || vertex >= vertexCount) {
            throw new IndexOutOfBoundsException(
                    role + " vertex " + vertex + " out of bounds [0, " + vertexCount + ")"
            );
        }
        return vertex;
    }

    /**
     * Same as {@link #requireVertex(int, int, String)} with the generic role name {@code "vertex"}.
     */
    public static int requireVertex(int vertex, int vertexCount) {
        return requireVertex(vertex, vertexCount, "vertex");
    }
}
