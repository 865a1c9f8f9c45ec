package org.Aayush.blt.model;

import org.Aayush.blt.core.BltAnalysisException;

/**
 * Raised when a classified model violates a construction invariant.
 *
 * <p>These failures describe a malformed model, not a property of its equation graph, so they
 * surface before any structural analysis runs.</p>
 */
public final class ModelInvariantException extends BltAnalysisException {

    public ModelInvariantException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public ModelInvariantException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
