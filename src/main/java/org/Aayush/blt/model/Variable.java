package org.Aayush.blt.model;

import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * Immutable classified model variable.
 *
 * <p>Array elements are declared as individual scalars named {@code base[i]}.</p>
 */
@Value
@Builder
public class Variable {
    /** Unique dotted-path name. */
    String name;
    /** Classification tag. */
    VariableCategory category;
    /** Dense state slot index ({@code 0..nStates-1}); only set for states. */
    Integer stateIndex;
    /** Optional start value. */
    Double start;
    /** Optional physical unit. */
    String unit;
    /** Optional lower bound. */
    Double min;
    /** Optional upper bound. */
    Double max;

    private Variable(
            String name,
            VariableCategory category,
            Integer stateIndex,
            Double start,
            String unit,
            Double min,
            Double max
    ) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("variable name must be non-blank");
        }
        this.name = name;
        this.category = Objects.requireNonNull(category, "category");
        this.stateIndex = stateIndex;
        this.start = start;
        this.unit = unit;
        this.min = min;
        this.max = max;
    }

    public boolean isState() {
        return category == VariableCategory.STATE;
    }

    /**
     * Convenience factory for a variable with no metadata.
     */
    public static Variable of(String name, VariableCategory category) {
        return Variable.builder().name(name).category(category).build();
    }

    /**
     * Convenience factory for a state with its dense state index.
     */
    public static Variable state(String name, int stateIndex) {
        return Variable.builder().name(name).category(VariableCategory.STATE).stateIndex(stateIndex).build();
    }
}
