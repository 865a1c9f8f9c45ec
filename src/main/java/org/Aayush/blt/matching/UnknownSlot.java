package org.Aayush.blt.matching;

import java.util.Objects;

/**
 * Matchable unknown of the equation system.
 *
 * @param id dense slot id in slot-table order.
 * @param variable declared variable name.
 * @param kind value or derivative slot.
 */
public record UnknownSlot(int id, String variable, SlotKind kind) {

    public UnknownSlot {
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(kind, "kind");
    }

    public boolean isDerivative() {
        return kind == SlotKind.DERIVATIVE;
    }

    /**
     * Returns the display label: {@code x} or {@code der(x)}.
     */
    public String label() {
        return isDerivative() ? "der(" + variable + ")" : variable;
    }

    @Override
    public String toString() {
        return label();
    }
}
