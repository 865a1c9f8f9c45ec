package org.Aayush.blt.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Base class for fatal structural-analysis failures with deterministic reason codes.
 *
 * <p>Only malformed input is raised. Structural singularity and algebraic loops are reported
 * as data on {@link BltResult}.</p>
 */
@Getter
public abstract class BltAnalysisException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded analysis failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    protected BltAnalysisException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded analysis failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    protected BltAnalysisException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
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
