package org.Aayush.blt.model;

import java.util.Objects;

/**
 * Unary arithmetic or logical operator.
 */
public record Unary(Operator operator, Expression operand) implements Expression {

    public enum Operator {
        NEG("-"),
        NOT("not ");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    public Unary {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.UNARY;
    }

    @Override
    public String toString() {
        return operator.symbol() + operand;
    }
}
