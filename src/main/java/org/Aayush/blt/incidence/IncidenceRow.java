package org.Aayush.blt.incidence;

import org.Aayush.blt.model.EquationSection;

import java.util.List;
import java.util.Objects;

/**
 * Flattened scalar equation row and the unknowns it references.
 *
 * @param position declaration-order position among all analyzed rows.
 * @param id unique row id ({@code eq3}, {@code eq4[i=2]}, {@code eq5#1}).
 * @param sourceLabel label of the top-level equation the row came from.
 * @param section section of the source equation.
 * @param occurrences unknown occurrences in first-appearance order.
 */
public record IncidenceRow(
        int position,
        String id,
        String sourceLabel,
        EquationSection section,
        List<Occurrence> occurrences
) {

    public IncidenceRow {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourceLabel, "sourceLabel");
        Objects.requireNonNull(section, "section");
        occurrences = List.copyOf(Objects.requireNonNull(occurrences, "occurrences"));
    }

    /**
     * Returns the occurrence of {@code variable} with the given derivative tag, or {@code null}.
     */
    public Occurrence occurrence(String variable, boolean derivative) {
        for (Occurrence occurrence : occurrences) {
            if (occurrence.derivative() == derivative && occurrence.variable().equals(variable)) {
                return occurrence;
            }
        }
        return null;
    }

    /**
     * Returns true if the row references {@code der(variable)} at least once.
     */
    public boolean differentiates(String variable) {
        return occurrence(variable, true) != null;
    }

    /**
     * Returns the number of distinct unknown occurrences.
     */
    public int size() {
        return occurrences.size();
    }
}
