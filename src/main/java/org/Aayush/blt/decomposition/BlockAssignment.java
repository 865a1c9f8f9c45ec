package org.Aayush.blt.decomposition;

import java.util.Objects;

/**
 * One matched (equation, unknown) pair inside a block.
 *
 * @param equation incidence row id.
 * @param unknown slot label ({@code x} or {@code der(x)}).
 * @param row incidence row position.
 * @param slot unknown slot id.
 */
public record BlockAssignment(String equation, String unknown, int row, int slot) {

    public BlockAssignment {
        Objects.requireNonNull(equation, "equation");
        Objects.requireNonNull(unknown, "unknown");
    }

    @Override
    public String toString() {
        return equation + " -> " + unknown;
    }
}
