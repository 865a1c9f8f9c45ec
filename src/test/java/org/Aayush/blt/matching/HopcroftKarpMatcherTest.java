package org.Aayush.blt.matching;

import org.Aayush.blt.incidence.IncidenceGraph;
import org.Aayush.blt.incidence.IncidenceGraphBuilder;
import org.Aayush.blt.model.ClassifiedModel;
import org.Aayush.blt.model.SimpleEquation;
import org.Aayush.blt.model.Variable;
import org.Aayush.blt.testutil.ModelFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.Aayush.blt.model.Expressions.add;
import static org.Aayush.blt.model.Expressions.der;
import static org.Aayush.blt.model.Expressions.literal;
import static org.Aayush.blt.model.Expressions.ref;
import static org.Aayush.blt.testutil.ModelFixtures.algebraic;
import static org.Aayush.blt.testutil.ModelFixtures.equation;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("HopcroftKarpMatcher Tests")
class HopcroftKarpMatcherTest {

    private static MatchingResult match(ClassifiedModel model, MatchingBudget budget) {
        IncidenceGraph graph = IncidenceGraphBuilder.build(model);
        return new HopcroftKarpMatcher(budget).match(graph, SlotTable.build(model, graph, true));
    }

    private static MatchingResult match(ClassifiedModel model) {
        return match(model, MatchingBudget.unbounded());
    }

    private static SimpleEquation sumIsZero(String left, String right) {
        return SimpleEquation.of(literal(0), add(ref(left), ref(right)));
    }

    /**
     * Two independent groups; in each, the third equation finds both of its unknowns taken
     * after greedy seeding and needs one augmenting path.
     */
    private static ClassifiedModel twoSwapGroups() {
        ClassifiedModel.ClassifiedModelBuilder builder = ClassifiedModel.builder();
        for (String name : new String[]{"a", "b", "c", "d", "e", "f", "g", "h"}) {
            builder.variable(algebraic(name));
        }
        return builder
                .continuousEquation(sumIsZero("a", "c"))
                .continuousEquation(sumIsZero("b", "d"))
                .continuousEquation(sumIsZero("a", "b"))
                .continuousEquation(sumIsZero("e", "g"))
                .continuousEquation(sumIsZero("f", "h"))
                .continuousEquation(sumIsZero("e", "f"))
                .build();
    }

    @Nested
    @DisplayName("1. Candidate Order")
    class CandidateTests {

        @Test
        @DisplayName("Derivative slots are tried before value slots")
        void testDerivativeFirst() {
            ClassifiedModel model = ClassifiedModel.builder()
                    .variable(Variable.state("x", 0))
                    .continuousEquation(SimpleEquation.of(ref("x"), der("x")))
                    .initialEquation(equation("x", literal(1)))
                    .build();
            IncidenceGraph graph = IncidenceGraphBuilder.build(model);
            SlotTable slots = SlotTable.build(model, graph, true);

            HopcroftKarpMatcher.Candidates candidates = HopcroftKarpMatcher.Candidates.build(graph, slots);

            assertEquals(2, candidates.degree(0));
            assertEquals(slots.find("x", true), candidates.slotAt(candidates.start(0)));
            assertEquals(slots.find("x", false), candidates.slotAt(candidates.start(0) + 1));
            assertEquals(1, candidates.degree(1));
        }

        @Test
        @DisplayName("Occurrences of known quantities are not candidates")
        void testKnownOccurrencesSkipped() {
            ClassifiedModel model = ModelFixtures.bouncingBall();
            IncidenceGraph graph = IncidenceGraphBuilder.build(model);

            HopcroftKarpMatcher.Candidates candidates =
                    HopcroftKarpMatcher.Candidates.build(graph, SlotTable.build(model, graph, true));

            assertEquals(1, candidates.degree(0), "v is a known state value in der(h) = v");
            assertEquals(1, candidates.degree(1));
        }
    }

    @Nested
    @DisplayName("2. Matching")
    class MatchingTests {

        @Test
        @DisplayName("Bouncing ball: each ODE determines its own derivative")
        void testBouncingBall() {
            MatchingResult result = match(ModelFixtures.bouncingBall());

            assertTrue(result.isTotal());
            assertEquals(0, result.slotOfRow(0));
            assertEquals(1, result.slotOfRow(1));
            assertEquals(0, result.phases());
        }

        @Test
        @DisplayName("Most constrained equations are seeded first")
        void testSmallestIncidenceFirst() {
            ClassifiedModel model = ClassifiedModel.builder()
                    .variable(algebraic("x"))
                    .variable(algebraic("y"))
                    .continuousEquation(sumIsZero("x", "y"))
                    .continuousEquation(equation("x", literal(2)))
                    .build();

            MatchingResult result = match(model);

            assertTrue(result.isTotal());
            assertEquals(1, result.slotOfRow(0), "x + y = 0 is left with y");
            assertEquals(0, result.slotOfRow(1));
            assertEquals(0, result.searches(), "greedy seeding alone is maximum");
        }

        @Test
        @DisplayName("Augmenting path repairs a greedy dead end")
        void testAugmentingPath() {
            ClassifiedModel model = ClassifiedModel.builder()
                    .variable(algebraic("a"))
                    .variable(algebraic("b"))
                    .variable(algebraic("c"))
                    .variable(algebraic("d"))
                    .continuousEquation(sumIsZero("a", "c"))
                    .continuousEquation(sumIsZero("b", "d"))
                    .continuousEquation(sumIsZero("a", "b"))
                    .build();

            MatchingResult result = match(model);

            assertEquals(3, result.matchedCount());
            assertEquals(2, result.slotOfRow(0));
            assertEquals(1, result.slotOfRow(1));
            assertEquals(0, result.slotOfRow(2));
            assertArrayEquals(new int[0], result.unmatchedRows());
            assertArrayEquals(new int[]{3}, result.unmatchedSlots());
            assertEquals(MatchingResult.UNMATCHED, result.rowOfSlot(3));
            assertFalse(result.isTotal());
            assertEquals(1, result.phases());
            assertEquals(1, result.searches());
        }

        @Test
        @DisplayName("Over-determined system leaves the later equation unmatched")
        void testOverDetermined() {
            MatchingResult result = match(ModelFixtures.overDetermined());

            assertArrayEquals(new int[]{1}, result.unmatchedRows());
            assertArrayEquals(new int[0], result.unmatchedSlots());
            assertFalse(result.isTotal());
            assertFalse(result.budgetExhausted());
        }

        @Test
        @DisplayName("Matching is reproducible across runs")
        void testDeterministic() {
            ClassifiedModel model = ModelFixtures.circuit();

            MatchingResult first = match(model);
            MatchingResult second = match(model);

            for (int row = 0; row < first.rowCount(); row++) {
                assertEquals(first.slotOfRow(row), second.slotOfRow(row));
            }
        }

        @Test
        @DisplayName("Long alternating paths are followed without recursion")
        void testDeepAugmentingPath() {
            int n = 50_000;
            ClassifiedModel.ClassifiedModelBuilder builder = ClassifiedModel.builder();
            for (int k = 0; k <= n; k++) {
                builder.variable(algebraic("s" + k));
            }
            builder.variable(algebraic("t"));
            for (int k = 0; k < n; k++) {
                builder.continuousEquation(sumIsZero("s" + k, "s" + (k + 1)));
            }
            builder.continuousEquation(sumIsZero("s0", "t"));
            builder.continuousEquation(equation("t", literal(1)));

            MatchingResult result = match(builder.build());

            assertTrue(result.isTotal());
            assertEquals(0, result.slotOfRow(n), "closing equation takes s0 after the path flips");
            assertEquals(n, result.slotOfRow(n - 1));
            assertEquals(1, result.searches());
        }
    }

    @Nested
    @DisplayName("3. Budget")
    class BudgetTests {

        @Test
        @DisplayName("Unbounded budget completes every augmentation")
        void testUnbounded() {
            MatchingResult result = match(twoSwapGroups());

            assertEquals(6, result.matchedCount());
            assertEquals(2, result.searches());
            assertFalse(result.budgetExhausted());
        }

        @Test
        @DisplayName("Exhausted budget returns the partial matching")
        void testExhausted() {
            MatchingResult result = match(twoSwapGroups(), MatchingBudget.of(1));

            assertTrue(result.budgetExhausted());
            assertEquals(1, result.searches());
            assertEquals(5, result.matchedCount());
            assertArrayEquals(new int[]{5}, result.unmatchedRows());
        }

        @Test
        @DisplayName("Non-positive bounds mean unbounded")
        void testNonPositiveBound() {
            assertEquals(MatchingBudget.UNBOUNDED, MatchingBudget.of(0).maxSearches());
            assertEquals(MatchingBudget.UNBOUNDED, MatchingBudget.of(-5).maxSearches());
            assertEquals(3, MatchingBudget.of(3).maxSearches());
        }
    }
}
