package org.Aayush.graphlib.weight;

import java.util.Comparator;

/**
 * Arithmetic contract for a generic edge-weight type.
 * <p>
 * Algorithms only ever need a total order, addition, an additive identity and a
 * default unit weight. There is no "infinity" member: result containers represent
 * unreachable distances as absent values, and no algorithm adds to an absent value.
 * </p>
 *
 * @param <W> weight type.
 */
public interface WeightType<W> extends Comparator<W> {

    /**
     * Additive identity; distance from a vertex to itself.
     */
    W zero();

    /**
     * Default weight used by the unweighted insertion overloads.
     */
    W one();

    /**
     * Sums two weights.
     *
     * @throws ArithmeticException if the sum is not representable.
     */
    W add(W left, W right);

    /**
     * Human-readable type name, used in diagnostics.
     */
    String name();

    /**
     * Validates a weight before it is stored in a graph container.
     *
     * @param weight candidate weight.
     * @return the same weight.
     * @throws NullPointerException if {@code weight} is null.
     * @throws IllegalArgumentException if the type cannot order {@code weight}.
     */
    default W requireValid(W weight) {
        if (weight == null) {
            throw new NullPointerException("weight");
        }
        return weight;
    }

    default boolean isNegative(W weight) {
        return compare(weight, zero()) < 0;
    }

    default W min(W left, W right) {
        return compare(left, right) <= 0 ? left : right;
    }

    /**
     * Returns whether {@code candidate} is strictly better than {@code current},
     * treating a {@code null} current value as unreachable.
     */
    default boolean improves(W candidate, W current) {
        return current == null || compare(candidate, current) < 0;
    }
}
