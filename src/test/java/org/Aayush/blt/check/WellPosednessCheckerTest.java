package org.Aayush.blt.check;

import org.Aayush.blt.decomposition.Block;
import org.Aayush.blt.decomposition.BlockAssignment;
import org.Aayush.blt.decomposition.BlockKind;
import org.Aayush.blt.decomposition.BltDecomposer;
import org.Aayush.blt.incidence.IncidenceGraph;
import org.Aayush.blt.incidence.IncidenceGraphBuilder;
import org.Aayush.blt.matching.HopcroftKarpMatcher;
import org.Aayush.blt.matching.MatchingResult;
import org.Aayush.blt.matching.SlotKind;
import org.Aayush.blt.matching.SlotTable;
import org.Aayush.blt.matching.UnknownSlot;
import org.Aayush.blt.model.ClassifiedModel;
import org.Aayush.blt.testutil.ModelFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.Aayush.blt.model.Expressions.literal;
import static org.Aayush.blt.testutil.ModelFixtures.algebraic;
import static org.Aayush.blt.testutil.ModelFixtures.equation;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("WellPosednessChecker Tests")
class WellPosednessCheckerTest {

    private static WellPosednessChecker.Report check(ClassifiedModel model) {
        IncidenceGraph graph = IncidenceGraphBuilder.build(model);
        SlotTable slots = SlotTable.build(model, graph, true);
        MatchingResult matching = new HopcroftKarpMatcher().match(graph, slots);
        List<Block> blocks = new BltDecomposer().decompose(graph, slots, matching).blocks();
        return WellPosednessChecker.check(graph, slots, matching, blocks);
    }

    private static List<String> codes(WellPosednessChecker.Report report) {
        List<String> codes = new ArrayList<>();
        for (AnalysisDiagnostic diagnostic : report.diagnostics()) {
            codes.add(diagnostic.reasonCode());
        }
        return codes;
    }

    @Nested
    @DisplayName("1. Matching Checks")
    class MatchingCheckTests {

        @Test
        @DisplayName("Square, fully matched system is well-posed")
        void testWellPosed() {
            WellPosednessChecker.Report report = check(ModelFixtures.circuit());

            assertTrue(report.wellPosed());
            assertTrue(report.diagnostics().isEmpty());
        }

        @Test
        @DisplayName("Algebraic loops do not make a system ill-posed")
        void testLoopStillWellPosed() {
            assertTrue(check(ModelFixtures.mutualLoop()).wellPosed());
            assertTrue(check(ModelFixtures.selfLoop()).wellPosed());
        }

        @Test
        @DisplayName("Over-determined system names the surplus equation")
        void testOverDetermined() {
            WellPosednessChecker.Report report = check(ModelFixtures.overDetermined());

            assertFalse(report.wellPosed());
            assertEquals(List.of(
                    WellPosednessChecker.REASON_EQUATION_COUNT_MISMATCH,
                    WellPosednessChecker.REASON_SURPLUS_EQUATION
            ), codes(report));
            assertEquals("over-determined system: 2 equations for 1 unknowns", report.diagnostics().get(0).message());
            assertEquals("equation 'eq1' has no unknown left to determine", report.diagnostics().get(1).message());
        }

        @Test
        @DisplayName("Under-determined system names the open unknown")
        void testUnderDetermined() {
            WellPosednessChecker.Report report = check(ModelFixtures.underDetermined());

            assertFalse(report.wellPosed());
            assertEquals(List.of(
                    WellPosednessChecker.REASON_EQUATION_COUNT_MISMATCH,
                    WellPosednessChecker.REASON_UNDETERMINED_UNKNOWN
            ), codes(report));
            assertTrue(report.diagnostics().get(1).message().contains("'y'"));
        }

        @Test
        @DisplayName("Square but deficient system is structurally singular")
        void testStructurallySingular() {
            WellPosednessChecker.Report report = check(ModelFixtures.structurallySingular());

            assertFalse(report.wellPosed());
            assertEquals(List.of(
                    WellPosednessChecker.REASON_SURPLUS_EQUATION,
                    WellPosednessChecker.REASON_UNDETERMINED_UNKNOWN,
                    WellPosednessChecker.REASON_STRUCTURALLY_SINGULAR
            ), codes(report));
            assertEquals("[E_STRUCTURALLY_SINGULAR] structurally singular system: matching covers 1 of 2 equations",
                    report.diagnostics().get(2).toString());
        }
    }

    @Nested
    @DisplayName("2. Consistency Checks")
    class ConsistencyTests {

        @Test
        @DisplayName("Duplicate unknowns are reported")
        void testDuplicateUnknown() {
            ClassifiedModel model = ClassifiedModel.builder()
                    .variable(algebraic("x"))
                    .continuousEquation(equation("x", literal(1)))
                    .build();
            IncidenceGraph graph = IncidenceGraphBuilder.build(model);
            SlotTable slots = SlotTable.of(List.of(
                    new UnknownSlot(0, "x", SlotKind.VALUE),
                    new UnknownSlot(1, "x", SlotKind.VALUE)
            ));
            MatchingResult matching = new HopcroftKarpMatcher().match(graph, slots);
            List<Block> blocks = new BltDecomposer().decompose(graph, slots, matching).blocks();

            WellPosednessChecker.Report report = WellPosednessChecker.check(graph, slots, matching, blocks);

            assertFalse(report.wellPosed());
            assertTrue(codes(report).contains(WellPosednessChecker.REASON_DUPLICATE_UNKNOWN));
        }

        @Test
        @DisplayName("Blocks repeating an assignment are reported")
        void testDuplicateAssignment() {
            ClassifiedModel model = ModelFixtures.bouncingBall();
            IncidenceGraph graph = IncidenceGraphBuilder.build(model);
            SlotTable slots = SlotTable.build(model, graph, true);
            MatchingResult matching = new HopcroftKarpMatcher().match(graph, slots);
            List<Block> blocks = new ArrayList<>(new BltDecomposer().decompose(graph, slots, matching).blocks());
            blocks.add(blocks.get(0));

            WellPosednessChecker.Report report = WellPosednessChecker.check(graph, slots, matching, blocks);

            assertFalse(report.wellPosed());
            assertEquals(List.of(
                    WellPosednessChecker.REASON_DUPLICATE_ASSIGNMENT,
                    WellPosednessChecker.REASON_BLOCK_ASSIGNMENT_MISMATCH
            ), codes(report));
        }

        @Test
        @DisplayName("Blocks disagreeing with the matching are reported")
        void testBlockMismatch() {
            ClassifiedModel model = ModelFixtures.bouncingBall();
            IncidenceGraph graph = IncidenceGraphBuilder.build(model);
            SlotTable slots = SlotTable.build(model, graph, true);
            MatchingResult matching = new HopcroftKarpMatcher().match(graph, slots);
            List<Block> forged = List.of(
                    Block.builder().kind(BlockKind.SCALAR).assignment(new BlockAssignment("eq0", "der(v)", 0, 1)).build(),
                    Block.builder().kind(BlockKind.SCALAR).assignment(new BlockAssignment("eq1", "der(h)", 1, 0)).build()
            );

            WellPosednessChecker.Report report = WellPosednessChecker.check(graph, slots, matching, forged);

            assertFalse(report.wellPosed());
            assertEquals(List.of(
                    WellPosednessChecker.REASON_BLOCK_ASSIGNMENT_MISMATCH,
                    WellPosednessChecker.REASON_BLOCK_ASSIGNMENT_MISMATCH
            ), codes(report));
        }

        @Test
        @DisplayName("Missing blocks are reported")
        void testMissingBlocks() {
            ClassifiedModel model = ModelFixtures.circuit();
            IncidenceGraph graph = IncidenceGraphBuilder.build(model);
            SlotTable slots = SlotTable.build(model, graph, true);
            MatchingResult matching = new HopcroftKarpMatcher().match(graph, slots);

            WellPosednessChecker.Report report = WellPosednessChecker.check(graph, slots, matching, List.of());

            assertEquals(List.of(WellPosednessChecker.REASON_BLOCK_ASSIGNMENT_MISMATCH), codes(report));
            assertEquals("blocks account for 0 assignments, matching has 5", report.diagnostics().get(0).message());
        }

        @Test
        @DisplayName("Only E_ codes are errors")
        void testDiagnosticSeverity() {
            assertTrue(new AnalysisDiagnostic("E_X", "m").isError());
            assertFalse(new AnalysisDiagnostic(WellPosednessChecker.REASON_MATCHING_BUDGET_EXHAUSTED, "m").isError());
        }
    }
}
