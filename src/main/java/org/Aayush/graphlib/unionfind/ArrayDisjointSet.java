package org.Aayush.graphlib.unionfind;

import org.Aayush.graphlib.core.GraphAlgorithmException;
import org.Aayush.graphlib.graph.VertexBounds;

/**
 * Array-backed {@link DisjointSet} with path compression and union by size.
 * <p>
 * {@code parent[i] == i} marks a root; {@code setSize[root]} holds the size of its set
 * (entries of non-roots are stale and never read).
 * </p>
 * <p><strong>Thread Safety:</strong> NOT thread-safe; {@link #find(int)} mutates parent links.</p>
 */
public final class ArrayDisjointSet implements DisjointSet {

    private final int[] parent;
    private final int[] setSize;
    private int componentCount;

    public ArrayDisjointSet(int size) {
        GraphAlgorithmException.requireVertexCount(size);
        this.parent = new int[size];
        this.setSize = new int[size];
        for (int i = 0; i < size; i++) {
            parent[i] = i;
            setSize[i] = 1;
        }
        this.componentCount = size;
    }

    @Override
    public int find(int element) {
        VertexBounds.requireVertex(element, parent.length, "element");
        int root = element;
        while (parent[root] != root) {
            root = parent[root];
        }
        // Second pass: point every node on the walked path straight at the root.
        int current = element;
        while (parent[current] != root) {
            int next = parent[current];
            parent[current] = root;
            current = next;
        }
        return root;
    }

    @Override
    public boolean unite(int a, int b) {
        int rootA = find(a);
        int rootB = find(b);
        if (rootA == rootB) {
            return false;
        }
        if (setSize[rootA] < setSize[rootB]) {
            int swap = rootA;
            rootA = rootB;
            rootB = swap;
        }
        parent[rootB] = rootA;
        setSize[rootA] += setSize[rootB];
        componentCount--;
        return true;
    }

    @Override
    public int size() {
        return parent.length;
    }

    @Override
    public int componentCount() {
        return componentCount;
    }

    @Override
    public int componentSize(int element) {
        return setSize[find(element)];
    }
}
