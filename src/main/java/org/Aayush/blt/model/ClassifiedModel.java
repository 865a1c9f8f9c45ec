package org.Aayush.blt.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.Aayush.blt.core.id.VariableIndex;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, validated in-memory form of a classified DAE model.
 *
 * <p>Built once by an external loader; every invariant listed on
 * {@link ModelInvariantValidator} is checked in the constructor. Structural analysis never
 * writes back onto a model instance.</p>
 *
 * <p>Top-level equations without a label are named {@code eq<k>}, where {@code k} is the
 * declaration position across all sections in {@link EquationSection} order.</p>
 */
@Getter
public final class ClassifiedModel {
    private final List<Variable> variables;
    private final List<Equation> continuousEquations;
    private final List<Equation> eventEquations;
    private final List<Equation> discreteEquations;
    private final List<Equation> initialEquations;

    @Getter(AccessLevel.NONE)
    private final Map<String, Variable> variablesByName;
    @Getter(AccessLevel.NONE)
    private final VariableIndex variableIndex;

    /**
     * Creates a model and validates all construction invariants.
     *
     * @throws ModelInvariantException when the model is malformed.
     */
    @Builder
    private ClassifiedModel(
            @Singular List<Variable> variables,
            @Singular List<Equation> continuousEquations,
            @Singular List<Equation> eventEquations,
            @Singular List<Equation> discreteEquations,
            @Singular List<Equation> initialEquations
    ) {
        this.variables = List.copyOf(Objects.requireNonNull(variables, "variables"));
        this.variablesByName = Map.copyOf(ModelInvariantValidator.indexVariables(this.variables));
        ModelInvariantValidator.validateStateIndices(this.variables);

        List<String> names = new ArrayList<>(this.variables.size());
        for (Variable variable : this.variables) {
            names.add(variable.getName());
        }
        this.variableIndex = VariableIndex.of(names);

        Set<String> labels = new HashSet<>();
        int[] position = {0};
        this.continuousEquations = label(continuousEquations, position, labels);
        this.eventEquations = label(eventEquations, position, labels);
        this.discreteEquations = label(discreteEquations, position, labels);
        this.initialEquations = label(initialEquations, position, labels);

        for (EquationSection section : EquationSection.values()) {
            for (Equation equation : equations(section)) {
                ModelInvariantValidator.validateEquation(equation, section, variablesByName);
            }
        }
    }

    /**
     * Returns the equations declared in one section, in declaration order.
     */
    public List<Equation> equations(EquationSection section) {
        return switch (section) {
            case CONTINUOUS -> continuousEquations;
            case EVENT -> eventEquations;
            case DISCRETE -> discreteEquations;
            case INITIAL -> initialEquations;
        };
    }

    /**
     * Returns a variable by name, or {@code null} when undeclared.
     */
    public Variable variable(String name) {
        if (name == null) {
            return null;
        }
        return variablesByName.get(name);
    }

    /**
     * Returns an immutable name lookup of all declared variables.
     */
    public Map<String, Variable> variablesByName() {
        return variablesByName;
    }

    /**
     * Returns the dense declaration-order index of variable names.
     */
    public VariableIndex variableIndex() {
        return variableIndex;
    }

    /**
     * Returns the number of top-level equations across all sections.
     */
    public int equationCount() {
        return continuousEquations.size() + eventEquations.size()
                + discreteEquations.size() + initialEquations.size();
    }

    private static List<Equation> label(List<Equation> equations, int[] position, Set<String> labels) {
        List<Equation> labeled = new ArrayList<>(equations.size());
        for (Equation equation : equations) {
            Objects.requireNonNull(equation, "equation");
            String label = equation.label() == null ? "eq" + position[0] : equation.label();
            position[0]++;
            if (label.isBlank()) {
                throw new ModelInvariantException(
                        ModelInvariantValidator.REASON_MALFORMED_EQUATION,
                        "equation at position " + (position[0] - 1) + " has a blank label"
                );
            }
            if (!labels.add(label)) {
                throw new ModelInvariantException(
                        ModelInvariantValidator.REASON_DUPLICATE_EQUATION,
                        "equation label '" + label + "' is used more than once"
                );
            }
            labeled.add(label.equals(equation.label()) ? equation : equation.withLabel(label));
        }
        return List.copyOf(labeled);
    }
}
