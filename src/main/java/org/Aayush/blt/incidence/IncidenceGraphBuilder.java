package org.Aayush.blt.incidence;

import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import lombok.experimental.UtilityClass;
import org.Aayush.blt.model.Binary;
import org.Aayush.blt.model.Call;
import org.Aayush.blt.model.ClassifiedModel;
import org.Aayush.blt.model.Comparison;
import org.Aayush.blt.model.Conditional;
import org.Aayush.blt.model.Derivative;
import org.Aayush.blt.model.Equation;
import org.Aayush.blt.model.EquationSection;
import org.Aayush.blt.model.Expression;
import org.Aayush.blt.model.Logical;
import org.Aayush.blt.model.Unary;
import org.Aayush.blt.model.Variable;
import org.Aayush.blt.model.VariableRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the equation-to-unknown incidence structure of a classified model.
 *
 * <p>Fixed variables (parameters, constants, inputs) and the independent variable
 * {@value #TIME} are not unknowns and are left out. {@code der(x)} is recorded as an
 * occurrence of {@code x} tagged as a derivative. Pure: the model is only read.</p>
 */
@UtilityClass
public final class IncidenceGraphBuilder {
    public static final String REASON_UNDECLARED_VARIABLE = "R_UNDECLARED_VARIABLE";

    /** Built-in independent variable; always known, never declared. */
    public static final String TIME = "time";

    private record OccurrenceKey(String variable, boolean derivative) {
    }

    /**
     * Builds incidence rows for the selected sections, in section then declaration order.
     *
     * @param model classified model.
     * @param sections sections whose equations must be solved.
     * @return fresh incidence graph.
     * @throws ModelReferenceException when an equation references an undeclared name.
     */
    public static IncidenceGraph build(ClassifiedModel model, Set<EquationSection> sections) {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(sections, "sections");

        EquationFlattener flattener = new EquationFlattener(model.variablesByName());
        List<IncidenceRow> rows = new ArrayList<>();
        for (EquationSection section : EquationSection.values()) {
            if (!sections.contains(section)) {
                continue;
            }
            for (Equation equation : model.equations(section)) {
                for (EquationFlattener.RowTemplate template : flattener.flatten(equation)) {
                    String rowId = equation.label() + template.suffix();
                    rows.add(new IncidenceRow(
                            rows.size(),
                            rowId,
                            equation.label(),
                            section,
                            collectOccurrences(model, rowId, template)
                    ));
                }
            }
        }
        return new IncidenceGraph(rows);
    }

    /**
     * Builds incidence rows for every section of the model.
     */
    public static IncidenceGraph build(ClassifiedModel model) {
        return build(model, Set.of(EquationSection.values()));
    }

    private static List<Occurrence> collectOccurrences(
            ClassifiedModel model,
            String rowId,
            EquationFlattener.RowTemplate template
    ) {
        // alternatives are exclusive branches: keep the largest count any branch reaches
        Object2IntLinkedOpenHashMap<OccurrenceKey> merged = new Object2IntLinkedOpenHashMap<>();
        for (List<Expression> alternative : template.alternatives()) {
            Object2IntLinkedOpenHashMap<OccurrenceKey> counts = new Object2IntLinkedOpenHashMap<>();
            for (Expression side : alternative) {
                count(model, rowId, side, false, counts);
            }
            for (Object2IntMap.Entry<OccurrenceKey> entry : counts.object2IntEntrySet()) {
                int previous = merged.getInt(entry.getKey());
                merged.put(entry.getKey(), Math.max(previous, entry.getIntValue()));
            }
        }
        // guards are evaluated on every path
        for (Expression guard : template.guards()) {
            count(model, rowId, guard, false, merged);
        }

        List<Occurrence> occurrences = new ArrayList<>(merged.size());
        for (Object2IntMap.Entry<OccurrenceKey> entry : merged.object2IntEntrySet()) {
            OccurrenceKey key = entry.getKey();
            occurrences.add(new Occurrence(key.variable(), key.derivative(), entry.getIntValue()));
        }
        return occurrences;
    }

    private static void count(
            ClassifiedModel model,
            String rowId,
            Expression expression,
            boolean derivative,
            Object2IntLinkedOpenHashMap<OccurrenceKey> counts
    ) {
        switch (expression.kind()) {
            case LITERAL, ITERATOR -> {
            }
            case VARIABLE -> {
                String name = ((VariableRef) expression).name();
                if (TIME.equals(name) && model.variable(name) == null) {
                    return;
                }
                Variable variable = model.variable(name);
                if (variable == null) {
                    throw new ModelReferenceException(REASON_UNDECLARED_VARIABLE, rowId, name);
                }
                if (variable.getCategory().isFixed()) {
                    return;
                }
                counts.addTo(new OccurrenceKey(name, derivative), 1);
            }
            case UNARY -> count(model, rowId, ((Unary) expression).operand(), derivative, counts);
            case BINARY -> {
                Binary binary = (Binary) expression;
                count(model, rowId, binary.left(), derivative, counts);
                count(model, rowId, binary.right(), derivative, counts);
            }
            case COMPARISON -> {
                Comparison comparison = (Comparison) expression;
                count(model, rowId, comparison.left(), derivative, counts);
                count(model, rowId, comparison.right(), derivative, counts);
            }
            case LOGICAL -> {
                Logical logical = (Logical) expression;
                count(model, rowId, logical.left(), derivative, counts);
                count(model, rowId, logical.right(), derivative, counts);
            }
            case DERIVATIVE -> count(model, rowId, ((Derivative) expression).argument(), true, counts);
            case CALL -> {
                for (Expression argument : ((Call) expression).arguments()) {
                    count(model, rowId, argument, derivative, counts);
                }
            }
            case CONDITIONAL -> {
                Conditional conditional = (Conditional) expression;
                count(model, rowId, conditional.condition(), derivative, counts);
                count(model, rowId, conditional.whenTrue(), derivative, counts);
                count(model, rowId, conditional.whenFalse(), derivative, counts);
            }
        }
    }
}
