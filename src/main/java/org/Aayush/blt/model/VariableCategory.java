package org.Aayush.blt.model;

/**
 * Closed classification of model variables.
 *
 * <p>Fixed categories ({@code PARAMETER}, {@code CONSTANT}, {@code INPUT}) are supplied from
 * outside the equation system and never become unknowns of the structural analysis.</p>
 */
public enum VariableCategory {
    STATE,
    ALGEBRAIC,
    DISCRETE_REAL,
    DISCRETE_VALUED,
    PARAMETER,
    CONSTANT,
    INPUT,
    OUTPUT;

    /**
     * Returns true when values of this category are known before the equation system is solved.
     */
    public boolean isFixed() {
        return switch (this) {
            case PARAMETER, CONSTANT, INPUT -> true;
            case STATE, ALGEBRAIC, DISCRETE_REAL, DISCRETE_VALUED, OUTPUT -> false;
        };
    }

    /**
     * Returns true for piecewise-constant categories that only change at events.
     */
    public boolean isDiscrete() {
        return this == DISCRETE_REAL || this == DISCRETE_VALUED;
    }
}
