package org.Aayush.blt.check;

import java.util.Objects;

/**
 * Reason-coded, human-readable finding of the well-posedness check.
 *
 * <p>Codes starting with {@code E_} make a model ill-posed; {@code W_} codes are warnings.</p>
 */
public record AnalysisDiagnostic(String reasonCode, String message) {

    public AnalysisDiagnostic {
        Objects.requireNonNull(reasonCode, "reasonCode");
        Objects.requireNonNull(message, "message");
    }

    public boolean isError() {
        return reasonCode.startsWith("E_");
    }

    @Override
    public String toString() {
        return "[" + reasonCode + "] " + message;
    }
}
