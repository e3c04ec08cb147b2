package org.Aayush.graphlib.unionfind;

/**
 * Partition of the dense element range {@code [0, size())} into disjoint sets.
 * <p>
 * Each set has a representative root. Implementations are expected to offer
 * near-constant amortized {@link #find(int)} and {@link #unite(int, int)}.
 * </p>
 */
public interface DisjointSet {

    /**
     * Returns the representative root of the set containing {@code element}.
     *
     * @throws IndexOutOfBoundsException if {@code element} is out of range.
     */
    int find(int element);

    /**
     * Merges the sets containing {@code a} and {@code b}.
     *
     * @return {@code true} if two distinct sets were merged, {@code false} if they were already one set.
     * @throws IndexOutOfBoundsException if either element is out of range.
     */
    boolean unite(int a, int b);

    /**
     * Returns whether {@code a} and {@code b} belong to the same set.
     */
    default boolean connected(int a, int b) {
        return find(a) == find(b);
    }

    /**
     * Number of elements in the partition.
     */
    int size();

    /**
     * Number of disjoint sets currently in the partition.
     */
    int componentCount();

    /**
     * Number of elements in the set containing {@code element}.
     */
    int componentSize(int element);

    /**
     * Creates the default array-backed implementation with every element in its own set.
     *
     * @param size number of elements.
     */
    static DisjointSet create(int size) {
        return new ArrayDisjointSet(size);
    }
}
