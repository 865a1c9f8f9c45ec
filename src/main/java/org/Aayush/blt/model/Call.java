package org.Aayush.blt.model;

import java.util.List;
import java.util.Objects;

/**
 * Pure built-in function application such as {@code sin(x)} or {@code abs(x)}.
 */
public record Call(String function, List<Expression> arguments) implements Expression {

    public Call {
        Objects.requireNonNull(function, "function");
        if (function.isBlank()) {
            throw new IllegalArgumentException("function name must be non-blank");
        }
        arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments"));
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.CALL;
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder(function).append('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                text.append(", ");
            }
            text.append(arguments.get(i));
        }
        return text.append(')').toString();
    }
}
