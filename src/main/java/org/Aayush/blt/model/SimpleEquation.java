package org.Aayush.blt.model;

import java.util.Objects;

/**
 * Scalar equation {@code lhs = rhs}.
 */
public record SimpleEquation(String label, Expression lhs, Expression rhs) implements Equation {

    public SimpleEquation {
        Objects.requireNonNull(lhs, "lhs");
        Objects.requireNonNull(rhs, "rhs");
    }

    public static SimpleEquation of(Expression lhs, Expression rhs) {
        return new SimpleEquation(null, lhs, rhs);
    }

    /**
     * Returns the variable name defined by a bare left-hand side ({@code x = ...} or
     * {@code der(x) = ...}), or {@code null} when the left-hand side is compound.
     */
    public String definedVariable() {
        if (lhs instanceof VariableRef) {
            return ((VariableRef) lhs).toString();
        }
        if (lhs instanceof Derivative) {
            return ((Derivative) lhs).argument().toString();
        }
        return null;
    }

    @Override
    public EquationKind kind() {
        return EquationKind.SIMPLE;
    }

    @Override
    public SimpleEquation withLabel(String label) {
        return new SimpleEquation(label, lhs, rhs);
    }

    @Override
    public String toString() {
        return lhs + " = " + rhs;
    }
}
