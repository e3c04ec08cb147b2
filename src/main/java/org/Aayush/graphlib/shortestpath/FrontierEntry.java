package org.Aayush.graphlib.shortestpath;

import org.Aayush.graphlib.weight.WeightType;

import java.util.Comparator;

/**
 * Immutable priority-queue entry for lazy-deletion Dijkstra.
 *
 * @param vertex vertex reached.
 * @param distance tentative distance at push time.
 */
record FrontierEntry<W>(int vertex, W distance) {

    /**
     * Orders by distance, then by vertex id for deterministic pops on equal distances.
     */
    static <W> Comparator<FrontierEntry<W>> ordering(WeightType<W> weightType) {
        return (left, right) -> {
            int byDistance = weightType.compare(left.distance, right.distance);
            if (byDistance != 0) {
                return byDistance;
            }
            return Integer.compare(left.vertex, right.vertex);
        };
    }
}
