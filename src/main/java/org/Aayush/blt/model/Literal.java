package org.Aayush.blt.model;

/**
 * Numeric constant.
 */
public record Literal(double value) implements Expression {
    @Override
    public ExpressionKind kind() {
        return ExpressionKind.LITERAL;
    }

    @Override
    public String toString() {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
