package org.Aayush.blt.model;

import java.util.Objects;

/**
 * Relational operator producing a boolean.
 */
public record Comparison(Operator operator, Expression left, Expression right) implements Expression {

    public enum Operator {
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">="),
        EQ("=="),
        NE("<>");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    public Comparison {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.COMPARISON;
    }

    @Override
    public String toString() {
        return left + " " + operator.symbol() + " " + right;
    }
}
