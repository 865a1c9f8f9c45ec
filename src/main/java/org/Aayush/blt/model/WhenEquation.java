package org.Aayush.blt.model;

import java.util.List;
import java.util.Objects;

/**
 * Event-triggered equation: {@code when c1 then ... elsewhen c2 then ... end when}.
 *
 * <p>Only legal in the {@link EquationSection#EVENT} section. Every branch must assign the
 * same variable set.</p>
 */
public record WhenEquation(String label, List<Branch> branches) implements Equation {

    public WhenEquation {
        branches = List.copyOf(Objects.requireNonNull(branches, "branches"));
        if (branches.isEmpty()) {
            throw new IllegalArgumentException("when-equation needs at least one branch");
        }
    }

    public static WhenEquation of(Branch... branches) {
        return new WhenEquation(null, List.of(branches));
    }

    @Override
    public EquationKind kind() {
        return EquationKind.WHEN;
    }

    @Override
    public WhenEquation withLabel(String label) {
        return new WhenEquation(label, branches);
    }
}
