package org.Aayush.blt.check;

import lombok.experimental.UtilityClass;
import org.Aayush.blt.decomposition.Block;
import org.Aayush.blt.decomposition.BlockAssignment;
import org.Aayush.blt.incidence.IncidenceGraph;
import org.Aayush.blt.matching.MatchingResult;
import org.Aayush.blt.matching.SlotTable;
import org.Aayush.blt.matching.UnknownSlot;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Advisory global checks over a decomposed system.
 *
 * <p>Never throws on an ill-posed system; every violated check adds a diagnostic so callers
 * can inspect the partial plan. Diagnostics are emitted in a fixed order.</p>
 */
@UtilityClass
public final class WellPosednessChecker {
    public static final String REASON_EQUATION_COUNT_MISMATCH = "E_EQUATION_COUNT_MISMATCH";
    public static final String REASON_SURPLUS_EQUATION = "E_SURPLUS_EQUATION";
    public static final String REASON_UNDETERMINED_UNKNOWN = "E_UNDETERMINED_UNKNOWN";
    public static final String REASON_STRUCTURALLY_SINGULAR = "E_STRUCTURALLY_SINGULAR";
    public static final String REASON_DUPLICATE_UNKNOWN = "E_DUPLICATE_UNKNOWN";
    public static final String REASON_DUPLICATE_ASSIGNMENT = "E_DUPLICATE_ASSIGNMENT";
    public static final String REASON_BLOCK_ASSIGNMENT_MISMATCH = "E_BLOCK_ASSIGNMENT_MISMATCH";
    public static final String REASON_MATCHING_BUDGET_EXHAUSTED = "W_MATCHING_BUDGET_EXHAUSTED";

    /**
     * Outcome of the check.
     *
     * @param wellPosed true when no error diagnostic was produced and matching ran to completion.
     * @param diagnostics ordered findings.
     */
    public record Report(boolean wellPosed, List<AnalysisDiagnostic> diagnostics) {
        public Report {
            diagnostics = List.copyOf(diagnostics);
        }
    }

    /**
     * Runs all checks.
     *
     * @param graph analyzed incidence rows.
     * @param slots unknown slots.
     * @param matching matching of rows to slots.
     * @param blocks ordered blocks built from {@code matching}.
     * @return well-posedness verdict and diagnostics.
     */
    public static Report check(IncidenceGraph graph, SlotTable slots, MatchingResult matching, List<Block> blocks) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(slots, "slots");
        Objects.requireNonNull(matching, "matching");
        Objects.requireNonNull(blocks, "blocks");

        List<AnalysisDiagnostic> diagnostics = new ArrayList<>();
        checkMatching(graph, slots, matching, diagnostics);
        checkUniqueSlots(slots, diagnostics);
        checkBlocks(matching, blocks, diagnostics);
        if (matching.budgetExhausted()) {
            diagnostics.add(new AnalysisDiagnostic(
                    REASON_MATCHING_BUDGET_EXHAUSTED,
                    "matching stopped after " + matching.searches() + " augmenting searches; result may be incomplete"
            ));
        }

        boolean wellPosed = !matching.budgetExhausted();
        for (AnalysisDiagnostic diagnostic : diagnostics) {
            if (diagnostic.isError()) {
                wellPosed = false;
                break;
            }
        }
        return new Report(wellPosed, diagnostics);
    }

    private static void checkMatching(
            IncidenceGraph graph,
            SlotTable slots,
            MatchingResult matching,
            List<AnalysisDiagnostic> diagnostics
    ) {
        int equations = graph.size();
        int unknowns = slots.size();
        if (equations > unknowns) {
            diagnostics.add(new AnalysisDiagnostic(
                    REASON_EQUATION_COUNT_MISMATCH,
                    "over-determined system: " + equations + " equations for " + unknowns + " unknowns"
            ));
        } else if (equations < unknowns) {
            diagnostics.add(new AnalysisDiagnostic(
                    REASON_EQUATION_COUNT_MISMATCH,
                    "under-determined system: " + equations + " equations for " + unknowns + " unknowns"
            ));
        }

        for (int row : matching.unmatchedRows()) {
            diagnostics.add(new AnalysisDiagnostic(
                    REASON_SURPLUS_EQUATION,
                    "equation '" + graph.row(row).id() + "' has no unknown left to determine"
            ));
        }
        for (int slot : matching.unmatchedSlots()) {
            diagnostics.add(new AnalysisDiagnostic(
                    REASON_UNDETERMINED_UNKNOWN,
                    "unknown '" + slots.slot(slot).label() + "' is not determined by any equation"
            ));
        }
        if (equations == unknowns && !matching.isTotal()) {
            diagnostics.add(new AnalysisDiagnostic(
                    REASON_STRUCTURALLY_SINGULAR,
                    "structurally singular system: matching covers " + matching.matchedCount()
                            + " of " + equations + " equations"
            ));
        }
    }

    private static void checkUniqueSlots(SlotTable slots, List<AnalysisDiagnostic> diagnostics) {
        Set<String> seen = new HashSet<>();
        for (UnknownSlot slot : slots.slots()) {
            if (!seen.add(slot.label())) {
                diagnostics.add(new AnalysisDiagnostic(
                        REASON_DUPLICATE_UNKNOWN,
                        "unknown '" + slot.label() + "' appears more than once in the unknown set"
                ));
            }
        }
    }

    private static void checkBlocks(MatchingResult matching, List<Block> blocks, List<AnalysisDiagnostic> diagnostics) {
        BitSet rowsSeen = new BitSet(matching.rowCount());
        BitSet slotsSeen = new BitSet(matching.slotCount());
        int assigned = 0;
        for (int b = 0; b < blocks.size(); b++) {
            for (BlockAssignment assignment : blocks.get(b).getAssignments()) {
                assigned++;
                if (rowsSeen.get(assignment.row()) || slotsSeen.get(assignment.slot())) {
                    diagnostics.add(new AnalysisDiagnostic(
                            REASON_DUPLICATE_ASSIGNMENT,
                            "block " + b + " repeats assignment " + assignment
                    ));
                }
                rowsSeen.set(assignment.row());
                slotsSeen.set(assignment.slot());
                if (matching.slotOfRow(assignment.row()) != assignment.slot()) {
                    diagnostics.add(new AnalysisDiagnostic(
                            REASON_BLOCK_ASSIGNMENT_MISMATCH,
                            "block " + b + " assigns " + assignment + " but the matching disagrees"
                    ));
                }
            }
        }
        if (assigned != matching.matchedCount()) {
            diagnostics.add(new AnalysisDiagnostic(
                    REASON_BLOCK_ASSIGNMENT_MISMATCH,
                    "blocks account for " + assigned + " assignments, matching has " + matching.matchedCount()
            ));
        }
    }
}
