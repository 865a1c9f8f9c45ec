package org.Aayush.blt.incidence;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.blt.core.BltAnalysisException;

/**
 * Raised when an equation references a variable the model never declared.
 */
@Getter
@Accessors(fluent = true)
public final class ModelReferenceException extends BltAnalysisException {
    private final String equation;
    private final String symbol;

    /**
     * Creates a reference failure naming the offending equation and symbol.
     *
     * @param reasonCode deterministic reason code.
     * @param equation id of the equation row holding the reference.
     * @param symbol undeclared name.
     */
    public ModelReferenceException(String reasonCode, String equation, String symbol) {
        super(reasonCode, "equation '" + equation + "' references undeclared variable '" + symbol + "'");
        this.equation = equation;
        this.symbol = symbol;
    }
}
