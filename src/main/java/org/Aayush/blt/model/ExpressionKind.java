package org.Aayush.blt.model;

/**
 * Operator vocabulary of the expression tree.
 */
public enum ExpressionKind {
    LITERAL,
    VARIABLE,
    ITERATOR,
    UNARY,
    BINARY,
    COMPARISON,
    LOGICAL,
    DERIVATIVE,
    CALL,
    CONDITIONAL
}
