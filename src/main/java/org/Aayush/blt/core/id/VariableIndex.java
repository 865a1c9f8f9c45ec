package org.Aayush.blt.core.id;

import lombok.experimental.StandardException;

import java.util.List;

/**
 * Bidirectional mapping between declared variable names and dense declaration indices.
 */
public interface VariableIndex {

    /**
     * Converts a variable name to its declaration index.
     * @param name the declared variable name.
     * @return the dense index.
     * @throws UnknownVariableException If the name is not declared.
     */
    int indexOf(String name) throws UnknownVariableException;

    /**
     * Converts a declaration index back to the variable name.
     * @param index the dense index.
     * @return the declared name.
     * @throws IndexOutOfBoundsException If the index is invalid.
     */
    String nameOf(int index);

    /**
     * Checks whether a name is declared.
     *
     * @param name variable name to test.
     * @return true when the name is present.
     */
    boolean contains(String name);

    /**
     * Returns number of declared variables.
     *
     * @return total mapping size.
     */
    int size();

    /**
     * Exception thrown when a variable name is not declared.
     */
    @StandardException
    class UnknownVariableException extends RuntimeException {
    }

    /**
     * Creates the default immutable implementation.
     *
     * @param names variable names in declaration order; position defines the index.
     * @return an immutable index.
     */
    static VariableIndex of(List<String> names) {
        return new FastUtilVariableIndex(names);
    }
}
