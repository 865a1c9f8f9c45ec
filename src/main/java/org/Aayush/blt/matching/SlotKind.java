package org.Aayush.blt.matching;

/**
 * What an unknown slot stands for.
 *
 * <p>{@code DERIVATIVE} is the time derivative of a state, matchable on its own.
 * {@code VALUE} is the variable itself.</p>
 */
public enum SlotKind {
    VALUE,
    DERIVATIVE
}
