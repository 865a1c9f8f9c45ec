package org.Aayush.blt.model;

/**
 * Node of an immutable, acyclic expression tree.
 *
 * <p>The node set is closed; every consumer switches exhaustively over {@link #kind()}.
 * Use {@link Expressions} to build trees.</p>
 */
public interface Expression {

    /**
     * Returns the operator tag of this node.
     */
    ExpressionKind kind();
}
