package org.Aayush.blt.decomposition;

/**
 * Kind of a BLT block.
 *
 * <p>{@code SCALAR} is one equation solved for one unknown with no self-dependency.
 * {@code ALGEBRAIC_LOOP} is a strongly connected set (possibly a single self-dependent
 * equation) that must be solved simultaneously.</p>
 */
public enum BlockKind {
    SCALAR,
    ALGEBRAIC_LOOP
}
