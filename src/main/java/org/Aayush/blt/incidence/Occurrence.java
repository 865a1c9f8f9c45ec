package org.Aayush.blt.incidence;

import java.util.Objects;

/**
 * One unknown referenced by an incidence row.
 *
 * @param variable declared variable name.
 * @param derivative true when referenced as {@code der(variable)}.
 * @param count number of appearances in the row (max over alternative branches, plus guards).
 */
public record Occurrence(String variable, boolean derivative, int count) {

    public Occurrence {
        Objects.requireNonNull(variable, "variable");
        if (count <= 0) {
            throw new IllegalArgumentException("occurrence count must be > 0");
        }
    }

    @Override
    public String toString() {
        String text = derivative ? "der(" + variable + ")" : variable;
        return count == 1 ? text : text + "x" + count;
    }
}
