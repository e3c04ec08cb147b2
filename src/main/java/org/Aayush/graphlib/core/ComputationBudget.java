package org.Aayush.graphlib.core;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Deterministic bounds for the two algorithms whose cost grows faster than the input.
 * <p>
 * Warshall-Floyd allocates a V x V matrix and runs V^3 relaxations; Bellman-Ford runs up to
 * V x E relaxations. A budget lets callers fail fast instead of stalling on an accidentally
 * huge input. Non-positive bounds mean "unbounded".
 * </p>
 * <p>
 * {@link #defaults()} reads:
 * <ul>
 * <li>{@value #PROP_MAX_MATRIX_VERTICES}: largest vertex count accepted by all-pairs computation.</li>
 * <li>{@value #PROP_MAX_RELAXATIONS}: largest {@code (vertexCount) * edgeCount} accepted by Bellman-Ford.</li>
 * </ul>
 * </p>
 */
@Getter
@Accessors(fluent = true)
public final class ComputationBudget {
    public static final long UNBOUNDED = Long.MAX_VALUE;

    public static final String REASON_MATRIX_VERTICES_EXCEEDED = "GL_BUDGET_MATRIX_VERTICES_EXCEEDED";
    public static final String REASON_RELAXATIONS_EXCEEDED = "GL_BUDGET_RELAXATIONS_EXCEEDED";

    public static final String PROP_MAX_MATRIX_VERTICES = "graphlib.allpairs.maxVertices";
    public static final String PROP_MAX_RELAXATIONS = "graphlib.bellmanford.maxRelaxations";

    private static final ComputationBudget UNBOUNDED_BUDGET = new ComputationBudget(UNBOUNDED, UNBOUNDED);

    private final long maxMatrixVertices;
    private final long maxRelaxations;

    private ComputationBudget(long maxMatrixVertices, long maxRelaxations) {
        this.maxMatrixVertices = normalizeBound(maxMatrixVertices);
        this.maxRelaxations = normalizeBound(maxRelaxations);
    }

    /**
     * Creates a budget with explicit bounds.
     *
     * @param maxMatrixVertices largest vertex count for all-pairs matrices; {@code <= 0} means unbounded.
     * @param maxRelaxations largest Bellman-Ford relaxation estimate; {@code <= 0} means unbounded.
     * @return immutable budget.
     */
    public static ComputationBudget of(long maxMatrixVertices, long maxRelaxations) {
        return new ComputationBudget(maxMatrixVertices, maxRelaxations);
    }

    /**
     * Budget that never rejects an input.
     */
    public static ComputationBudget unbounded() {
        return UNBOUNDED_BUDGET;
    }

    /**
     * Loads budget values from system properties. Missing, blank or malformed values are unbounded.
     */
    public static ComputationBudget defaults() {
        return ComputationBudget.of(
                readBound(PROP_MAX_MATRIX_VERTICES),
                readBound(PROP_MAX_RELAXATIONS)
        );
    }

    /**
     * Validates the vertex count of an all-pairs matrix against the configured bound.
     *
     * @throws BudgetExceededException when {@code vertexCount} exceeds the bound.
     */
    public void checkMatrixVertices(int vertexCount) {
        if (vertexCount > maxMatrixVertices) {
            throw new BudgetExceededException(
                    REASON_MATRIX_VERTICES_EXCEEDED,
                    "all-pairs vertex budget exceeded: " + vertexCount + " > " + maxMatrixVertices
            );
        }
    }

    /**
     * Validates the Bellman-Ford work estimate {@code vertexCount * edgeCount} against the configured bound.
     *
     * @throws BudgetExceededException when the estimate exceeds the bound.
     */
    public void checkRelaxations(int vertexCount, int edgeCount) {
        long relaxations = (long) vertexCount * (long) edgeCount;
        if (relaxations > maxRelaxations) {
            throw new BudgetExceededException(
                    REASON_RELAXATIONS_EXCEEDED,
                    "relaxation budget exceeded: " + relaxations + " > " + maxRelaxations
            );
        }
    }

    public boolean isUnbounded() {
        return maxMatrixVertices == UNBOUNDED && maxRelaxations == UNBOUNDED;
    }

    private static long normalizeBound(long bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static long readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return UNBOUNDED;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            return UNBOUNDED;
        }
    }

    /**
     * Deterministic exception for budget fail-fast paths.
     */
    public static final class BudgetExceededException extends GraphAlgorithmException {
        BudgetExceededException(String reasonCode, String message) {
            super(reasonCode, message);
        }
    }
}
