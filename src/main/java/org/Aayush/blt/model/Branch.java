package org.Aayush.blt.model;

import java.util.List;
import java.util.Objects;

/**
 * Guarded branch of an {@link IfEquation} or {@link WhenEquation}.
 */
public record Branch(Expression condition, List<Equation> equations) {

    public Branch {
        Objects.requireNonNull(condition, "condition");
        equations = List.copyOf(Objects.requireNonNull(equations, "equations"));
    }

    public static Branch of(Expression condition, Equation... equations) {
        return new Branch(condition, List.of(equations));
    }
}
