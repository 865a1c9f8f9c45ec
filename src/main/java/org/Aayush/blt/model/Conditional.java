package org.Aayush.blt.model;

import java.util.Objects;

/**
 * Expression-level {@code if cond then a else b}.
 */
public record Conditional(Expression condition, Expression whenTrue, Expression whenFalse) implements Expression {

    public Conditional {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(whenTrue, "whenTrue");
        Objects.requireNonNull(whenFalse, "whenFalse");
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.CONDITIONAL;
    }

    @Override
    public String toString() {
        return "(if " + condition + " then " + whenTrue + " else " + whenFalse + ")";
    }
}
