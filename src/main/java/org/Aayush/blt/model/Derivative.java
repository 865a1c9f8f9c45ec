package org.Aayush.blt.model;

import java.util.Objects;

/**
 * Time derivative {@code der(x)}.
 *
 * <p>The argument is always a variable reference. Whether it names a state is checked when
 * the {@link ClassifiedModel} is built.</p>
 */
public record Derivative(VariableRef argument) implements Expression {

    public Derivative {
        Objects.requireNonNull(argument, "argument");
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.DERIVATIVE;
    }

    @Override
    public String toString() {
        return "der(" + argument + ")";
    }
}
