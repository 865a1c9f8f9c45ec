package org.Aayush.blt.model;

import java.util.Objects;

/**
 * Boolean connective.
 */
public record Logical(Operator operator, Expression left, Expression right) implements Expression {

    public enum Operator {
        AND("and"),
        OR("or");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    public Logical {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.LOGICAL;
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
