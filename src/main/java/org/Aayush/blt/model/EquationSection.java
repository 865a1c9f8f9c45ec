package org.Aayush.blt.model;

/**
 * Section of the classified model an equation was declared in.
 *
 * <p>Declaration order of the whole model is the concatenation of sections in enum order.</p>
 */
public enum EquationSection {
    CONTINUOUS,
    EVENT,
    DISCRETE,
    INITIAL
}
