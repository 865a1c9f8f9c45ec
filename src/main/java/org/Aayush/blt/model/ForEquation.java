package org.Aayush.blt.model;

import java.util.List;
import java.util.Objects;

/**
 * Template equation repeated for every integer {@code iterator} in {@code [from, to]}.
 */
public record ForEquation(
        String label,
        String iterator,
        int from,
        int to,
        List<Equation> body
) implements Equation {

    public ForEquation {
        Objects.requireNonNull(iterator, "iterator");
        if (iterator.isBlank()) {
            throw new IllegalArgumentException("iterator name must be non-blank");
        }
        body = List.copyOf(Objects.requireNonNull(body, "body"));
    }

    public static ForEquation of(String iterator, int from, int to, Equation... body) {
        return new ForEquation(null, iterator, from, to, List.of(body));
    }

    /**
     * Returns the number of iterations; zero when the range is empty.
     */
    public int iterationCount() {
        return to < from ? 0 : to - from + 1;
    }

    @Override
    public EquationKind kind() {
        return EquationKind.FOR;
    }

    @Override
    public ForEquation withLabel(String label) {
        return new ForEquation(label, iterator, from, to, body);
    }
}
