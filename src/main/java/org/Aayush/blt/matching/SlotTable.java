package org.Aayush.blt.matching;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.Aayush.blt.core.id.VariableIndex;
import org.Aayush.blt.incidence.IncidenceGraph;
import org.Aayush.blt.incidence.IncidenceRow;
import org.Aayush.blt.incidence.Occurrence;
import org.Aayush.blt.model.ClassifiedModel;
import org.Aayush.blt.model.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable table of unknown slots, in variable declaration order.
 *
 * <p>Slot rules:</p>
 * <ul>
 * <li>a state contributes {@code der(x)} when some row differentiates it, and its value slot
 * only when otherwise constrained: never differentiated at all, or paired with an
 * initial-equation row that reaches it directly or through other unknowns
 * (see {@link InitialStateSelector});</li>
 * <li>algebraic and output variables contribute one value slot;</li>
 * <li>discrete variables contribute one value slot when event equations are analyzed and are
 * known otherwise;</li>
 * <li>parameters, constants and inputs contribute nothing.</li>
 * </ul>
 */
public final class SlotTable {
    private final List<UnknownSlot> slots;
    private final Object2IntOpenHashMap<String> valueSlots;
    private final Object2IntOpenHashMap<String> derivativeSlots;

    private SlotTable(List<UnknownSlot> slots) {
        this.slots = List.copyOf(slots);
        this.valueSlots = new Object2IntOpenHashMap<>();
        this.derivativeSlots = new Object2IntOpenHashMap<>();
        this.valueSlots.defaultReturnValue(-1);
        this.derivativeSlots.defaultReturnValue(-1);
        for (UnknownSlot slot : this.slots) {
            Object2IntOpenHashMap<String> target = slot.isDerivative() ? derivativeSlots : valueSlots;
            // first slot wins; duplicates stay visible through slots() for the well-posedness check
            if (!target.containsKey(slot.variable())) {
                target.put(slot.variable(), slot.id());
            }
        }
        this.valueSlots.trim();
        this.derivativeSlots.trim();
    }

    /**
     * Creates a table from explicit slots. Slot ids must equal list positions.
     */
    public static SlotTable of(List<UnknownSlot> slots) {
        Objects.requireNonNull(slots, "slots");
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i).id() != i) {
                throw new IllegalArgumentException("slot id " + slots.get(i).id() + " at position " + i);
            }
        }
        return new SlotTable(slots);
    }

    /**
     * Derives the unknown slots of an incidence graph.
     *
     * @param model classified model the graph was built from.
     * @param graph incidence rows being solved.
     * @param discreteUnknowns whether discrete variables are solved for by the analyzed rows.
     * @return slot table in variable declaration order.
     */
    public static SlotTable build(ClassifiedModel model, IncidenceGraph graph, boolean discreteUnknowns) {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(graph, "graph");

        VariableIndex index = model.variableIndex();
        List<Variable> variables = model.getVariables();
        boolean[] differentiated = new boolean[index.size()];
        for (IncidenceRow row : graph.rows()) {
            for (Occurrence occurrence : row.occurrences()) {
                if (occurrence.derivative()) {
                    differentiated[index.indexOf(occurrence.variable())] = true;
                }
            }
        }
        boolean[] passThrough = new boolean[index.size()];
        for (int id = 0; id < variables.size(); id++) {
            passThrough[id] = switch (variables.get(id).getCategory()) {
                case STATE -> !differentiated[id];
                case ALGEBRAIC, OUTPUT -> true;
                case DISCRETE_REAL, DISCRETE_VALUED -> discreteUnknowns;
                case PARAMETER, CONSTANT, INPUT -> false;
            };
        }
        boolean[] initialValue = InitialStateSelector.select(index, graph, differentiated, passThrough);

        List<UnknownSlot> slots = new ArrayList<>();
        for (int id = 0; id < variables.size(); id++) {
            Variable variable = variables.get(id);
            String name = variable.getName();
            switch (variable.getCategory()) {
                case STATE -> {
                    if (differentiated[id]) {
                        slots.add(new UnknownSlot(slots.size(), name, SlotKind.DERIVATIVE));
                    }
                    if (!differentiated[id] || initialValue[id]) {
                        slots.add(new UnknownSlot(slots.size(), name, SlotKind.VALUE));
                    }
                }
                case ALGEBRAIC, OUTPUT -> slots.add(new UnknownSlot(slots.size(), name, SlotKind.VALUE));
                case DISCRETE_REAL, DISCRETE_VALUED -> {
                    if (discreteUnknowns) {
                        slots.add(new UnknownSlot(slots.size(), name, SlotKind.VALUE));
                    }
                }
                case PARAMETER, CONSTANT, INPUT -> {
                }
            }
        }
        return new SlotTable(slots);
    }

    public List<UnknownSlot> slots() {
        return slots;
    }

    public UnknownSlot slot(int id) {
        return slots.get(id);
    }

    public int size() {
        return slots.size();
    }

    /**
     * Resolves an occurrence to its slot id, or {@code -1} when it refers to a known quantity.
     */
    public int resolve(Occurrence occurrence) {
        return find(occurrence.variable(), occurrence.derivative());
    }

    /**
     * Returns the slot id of {@code variable} (or its derivative), or {@code -1}.
     */
    public int find(String variable, boolean derivative) {
        return derivative ? derivativeSlots.getInt(variable) : valueSlots.getInt(variable);
    }
}
