package org.Aayush.graphlib.allpairs;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.graphlib.core.GraphAlgorithmException;
import org.Aayush.graphlib.graph.VertexBounds;
import org.Aayush.graphlib.weight.WeightType;

import java.util.Objects;
import java.util.Optional;

/**
 * Mutable square all-pairs distance matrix.
 * <p>
 * Cell {@code (i, j)} holds the shortest known distance from {@code i} to {@code j}, or is
 * unreachable. Produced by {@link WarshallFloyd#computeAllPairs} and maintained afterwards
 * through {@link #insertEdge(int, int, Object)} / {@link #insertArc(int, int, Object)} only.
 * </p>
 * <p>
 * Storage is one row-major list of {@code size * size} cells; {@code null} is unreachable.
 * </p>
 * <p><strong>Thread Safety:</strong> NOT thread-safe.</p>
 *
 * @param <W> weight type.
 */
public final class DistanceMatrix<W> {
    public static final String REASON_MATRIX_TOO_LARGE = "GL_MATRIX_TOO_LARGE";

    private static final long MAX_CELLS = Integer.MAX_VALUE - 8;

    @Getter
    @Accessors(fluent = true)
    private final WeightType<W> weightType;

    @Getter
    @Accessors(fluent = true)
    private final int size;

    private final ObjectArrayList<W> cells;

    DistanceMatrix(WeightType<W> weightType, int size) {
        this.weightType = Objects.requireNonNull(weightType, "weightType");
        this.size = GraphAlgorithmException.requireVertexCount(size);
        if ((long) size * size > MAX_CELLS) {
            throw new GraphAlgorithmException(
                    REASON_MATRIX_TOO_LARGE,
                    "distance matrix of " + size + " x " + size + " cells exceeds " + MAX_CELLS
            );
        }
        this.cells = new ObjectArrayList<>(size * size);
        this.cells.size(size * size);
    }

    private DistanceMatrix(DistanceMatrix<W> source) {
        this.weightType = source.weightType;
        this.size = source.size;
        this.cells = new ObjectArrayList<>(source.cells);
    }

    /**
     * Shortest known distance {@code from -> to}, or empty when unreachable.
     */
    public Optional<W> distance(int from, int to) {
        return Optional.ofNullable(cell(from, to));
    }

    public boolean isReachable(int from, int to) {
        return cell(from, to) != null;
    }

    /**
     * Returns whether some diagonal cell is negative, i.e. the graph has a negative cycle.
     */
    public boolean hasNegativeCycle() {
        for (int v = 0; v < size; v++) {
            W self = get(v, v);
            if (self != null && weightType.isNegative(self)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Inserts an undirected edge of {@code weight} and re-closes the matrix through its endpoints.
     * <p>
     * Sets {@code d[from][to] = d[to][from] = min(d[from][to], weight)}, then relaxes every pair
     * through pivot {@code from} and then pivot {@code to}. O(size^2).
     * </p>
     * <p>
     * If the edge closes a negative cycle, re-closing stops at the first negative diagonal cell;
     * {@link #hasNegativeCycle()} then reports it and the other cells are not meaningful. A matrix
     * that already has a negative cycle only records the new cell.
     * </p>
     * <p>
     * <strong>Caveats:</strong> correct only if the matrix is already transitively closed
     * (fresh from {@link WarshallFloyd#computeAllPairs} or maintained through these insert
     * methods). Edge removal and weight increases are not supported.
     * </p>
     *
     * @throws IndexOutOfBoundsException if an endpoint is out of range.
     */
    public DistanceMatrix<W> insertEdge(int from, int to, W weight) {
        VertexBounds.requireVertex(from, size, "from");
        VertexBounds.requireVertex(to, size, "to");
        W checked = weightType.requireValid(weight);
        W current = get(from, to);
        W updated = current == null ? checked : weightType.min(current, checked);
        set(from, to, updated);
        set(to, from, updated);
        reclose(from, to);
        return this;
    }

    /**
     * Directed counterpart of {@link #insertEdge(int, int, Object)}: only {@code d[from][to]} is
     * lowered before re-closing through {@code from} and {@code to}.
     */
    public DistanceMatrix<W> insertArc(int from, int to, W weight) {
        VertexBounds.requireVertex(from, size, "from");
        VertexBounds.requireVertex(to, size, "to");
        W checked = weightType.requireValid(weight);
        W current = get(from, to);
        set(from, to, current == null ? checked : weightType.min(current, checked));
        reclose(from, to);
        return this;
    }

    private void reclose(int from, int to) {
        if (hasNegativeCycle()) {
            return;
        }
        if (closeThrough(from)) {
            closeThrough(to);
        }
    }

    /**
     * Independent deep copy; later inserts on either matrix do not affect the other.
     */
    public DistanceMatrix<W> copy() {
        return new DistanceMatrix<>(this);
    }

    /**
     * Relaxes every pair {@code (i, j)} through {@code pivot}, skipping unreachable halves.
     * <p>
     * Stops as soon as a diagonal cell turns negative; no sum is formed past that cell.
     * </p>
     *
     * @return false when the pass stopped on a negative diagonal cell.
     */
    boolean closeThrough(int pivot) {
        for (int i = 0; i < size; i++) {
            W head = get(i, pivot);
            if (head == null) {
                continue;
            }
            for (int j = 0; j < size; j++) {
                W tail = get(pivot, j);
                if (tail == null) {
                    continue;
                }
                W candidate = weightType.add(head, tail);
                if (weightType.improves(candidate, get(i, j))) {
                    set(i, j, candidate);
                    if (i == j && weightType.isNegative(candidate)) {
                        return false;
                    }
                }
            }
        }
        return true;
    }

    W get(int from, int to) {
        return cells.get(from * size + to);
    }

    void set(int from, int to, W value) {
        cells.set(from * size + to, value);
    }

    private W cell(int from, int to) {
        VertexBounds.requireVertex(from, size, "from");
        VertexBounds.requireVertex(to, size, "to");
        return get(from, to);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DistanceMatrix)) {
            return false;
        }
        DistanceMatrix<?> other = (DistanceMatrix<?>) o;
        return size == other.size
                && weightType.equals(other.weightType)
                && cells.equals(other.cells);
    }

    @Override
    public int hashCode() {
        return Objects.hash(size, weightType, cells);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("DistanceMatrix{size=").append(size).append(", rows=[");
        for (int i = 0; i < size; i++) {
            sb.append(i == 0 ? "[" : ", [");
            for (int j = 0; j < size; j++) {
                W value = get(i, j);
                sb.append(j == 0 ? "" : ", ").append(value == null ? "INF" : value);
            }
            sb.append(']');
        }
        return sb.append("]}").toString();
    }
}
