package org.Aayush.blt.model;

import java.util.List;
import java.util.Objects;

/**
 * Conditional equation with guarded branches and a mandatory else branch.
 *
 * <p>All branches must be balanced: the same equation count and the same set of
 * assigned variables.</p>
 */
public record IfEquation(String label, List<Branch> branches, List<Equation> elseEquations) implements Equation {

    public IfEquation {
        branches = List.copyOf(Objects.requireNonNull(branches, "branches"));
        elseEquations = List.copyOf(Objects.requireNonNull(elseEquations, "elseEquations"));
        if (branches.isEmpty()) {
            throw new IllegalArgumentException("if-equation needs at least one guarded branch");
        }
    }

    @Override
    public EquationKind kind() {
        return EquationKind.IF;
    }

    @Override
    public IfEquation withLabel(String label) {
        return new IfEquation(label, branches, elseEquations);
    }
}
