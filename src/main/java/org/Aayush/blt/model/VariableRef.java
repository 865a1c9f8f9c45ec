package org.Aayush.blt.model;

import java.util.List;
import java.util.Objects;

/**
 * Reference to a declared variable, optionally subscripted.
 *
 * <p>Subscripts are integer-valued expressions (literals, iterators and arithmetic over them).
 * They are resolved while equations are flattened, turning {@code x[i]} into the scalar
 * name {@code x[3]}.</p>
 */
public record VariableRef(String name, List<Expression> subscripts) implements Expression {

    public VariableRef {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("variable reference name must be non-blank");
        }
        subscripts = List.copyOf(Objects.requireNonNull(subscripts, "subscripts"));
    }

    public VariableRef(String name) {
        this(name, List.of());
    }

    public boolean hasSubscripts() {
        return !subscripts.isEmpty();
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.VARIABLE;
    }

    @Override
    public String toString() {
        if (subscripts.isEmpty()) {
            return name;
        }
        StringBuilder text = new StringBuilder(name).append('[');
        for (int i = 0; i < subscripts.size(); i++) {
            if (i > 0) {
                text.append(',');
            }
            text.append(subscripts.get(i));
        }
        return text.append(']').toString();
    }
}
