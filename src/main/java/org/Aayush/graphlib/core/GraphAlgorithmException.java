package org.Aayush.graphlib.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Graph-algorithm contract exception with deterministic reason codes.
 *
 * <p>Messages are prefixed with the reason code, e.g.
 * {@code [GL_NEGATIVE_VERTEX_COUNT] vertexCount must be >= 0, got -1}.</p>
 */
@Getter
@Accessors(fluent = true)
public class GraphAlgorithmException extends RuntimeException {
    public static final String REASON_NEGATIVE_VERTEX_COUNT = "GL_NEGATIVE_VERTEX_COUNT";

    private final String reasonCode;

    /**
     * Creates a reason-coded contract failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public GraphAlgorithmException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded contract failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public GraphAlgorithmException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Validates a caller-supplied vertex count.
     *
     * @param vertexCount vertex count to check.
     * @return the same count when valid.
     * @throws GraphAlgorithmException when the count is negative.
     */
    public static int requireVertexCount(int vertexCount) {
        if (vertexCount < 0) {
            throw new GraphAlgorithmException(
                    REASON_NEGATIVE_VERTEX_COUNT,
                    "vertexCount must be >= 0, got " + vertexCount
            );
        }
        return vertexCount;
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
