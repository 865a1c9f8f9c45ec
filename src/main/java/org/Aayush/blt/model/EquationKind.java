package org.Aayush.blt.model;

/**
 * Structural form of an equation.
 */
public enum EquationKind {
    SIMPLE,
    FOR,
    IF,
    WHEN
}
