package org.Aayush.blt.model;

/**
 * Immutable classified equation.
 *
 * <p>Top-level equations carry a model-unique label. Equations nested inside {@code for},
 * {@code if} or {@code when} bodies may leave the label {@code null}.</p>
 */
public interface Equation {

    /**
     * Returns the equation label, or {@code null} for unlabeled nested equations.
     */
    String label();

    /**
     * Returns the structural form tag.
     */
    EquationKind kind();

    /**
     * Returns a copy of this equation with the given label.
     */
    Equation withLabel(String label);
}
