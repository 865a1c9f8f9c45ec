package org.Aayush.blt.model;

import java.util.Objects;

/**
 * Reference to the loop index of an enclosing {@link ForEquation}.
 */
public record IteratorRef(String name) implements Expression {

    public IteratorRef {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.ITERATOR;
    }

    @Override
    public String toString() {
        return name;
    }
}
