package org.Aayush.blt.decomposition;

import org.Aayush.blt.incidence.IncidenceGraph;
import org.Aayush.blt.incidence.IncidenceGraphBuilder;
import org.Aayush.blt.matching.HopcroftKarpMatcher;
import org.Aayush.blt.matching.SlotTable;
import org.Aayush.blt.model.ClassifiedModel;
import org.Aayush.blt.testutil.ModelFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("DependencyGraph and TarjanSccFinder Tests")
class DependencyGraphTest {

    static DependencyGraph dependencyGraph(ClassifiedModel model) {
        IncidenceGraph graph = IncidenceGraphBuilder.build(model);
        SlotTable slots = SlotTable.build(model, graph, true);
        return DependencyGraph.build(graph, slots, new HopcroftKarpMatcher().match(graph, slots));
    }

    private static List<Integer> successors(DependencyGraph graph, int node) {
        List<Integer> targets = new ArrayList<>();
        for (int e = graph.edgeStart(node); e < graph.edgeEnd(node); e++) {
            targets.add(graph.edgeTargetAt(e));
        }
        return targets;
    }

    @Nested
    @DisplayName("1. Graph Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Edges point from the solving equation to the equations that use its unknown")
        void testCircuitEdges() {
            DependencyGraph graph = dependencyGraph(ModelFixtures.circuit());

            assertEquals(5, graph.nodeCount());
            assertEquals(6, graph.edgeCount());
            assertEquals(List.of(), successors(graph, 0));
            assertEquals(List.of(0), successors(graph, 1));
            assertEquals(List.of(1, 3), successors(graph, 2));
            assertEquals(List.of(1, 2), successors(graph, 3));
            assertEquals(List.of(2), successors(graph, 4));
            for (int node = 0; node < graph.nodeCount(); node++) {
                assertFalse(graph.isSelfDependent(node));
            }
        }

        @Test
        @DisplayName("An unknown repeated in its own equation marks a self-dependency, not an edge")
        void testSelfDependency() {
            DependencyGraph graph = dependencyGraph(ModelFixtures.selfLoop());

            assertEquals(1, graph.nodeCount());
            assertEquals(0, graph.edgeCount());
            assertTrue(graph.isSelfDependent(0));
        }

        @Test
        @DisplayName("Unmatched rows get no node")
        void testUnmatchedRowsExcluded() {
            DependencyGraph graph = dependencyGraph(ModelFixtures.overDetermined());

            assertEquals(1, graph.nodeCount());
            assertEquals(0, graph.nodeOfRow(0));
            assertEquals(-1, graph.nodeOfRow(1));
            assertEquals(0, graph.rowOf(0));
        }

        @Test
        @DisplayName("Node accessors validate bounds")
        void testNodeBounds() {
            DependencyGraph graph = dependencyGraph(ModelFixtures.bouncingBall());

            assertThrows(IndexOutOfBoundsException.class, () -> graph.edgeStart(2));
            assertThrows(IndexOutOfBoundsException.class, () -> graph.isSelfDependent(-1));
        }
    }

    @Nested
    @DisplayName("2. Strongly Connected Components")
    class ComponentTests {

        @Test
        @DisplayName("Loop members share one component, sorted ascending")
        void testCircuitComponents() {
            TarjanSccFinder.Components components = TarjanSccFinder.find(dependencyGraph(ModelFixtures.circuit()));

            assertEquals(4, components.count());
            int loop = components.componentOfNode()[2];
            assertEquals(loop, components.componentOfNode()[3]);
            assertArrayEquals(new int[]{2, 3}, components.components().get(loop));
        }

        @Test
        @DisplayName("Mutual dependency forms a single component")
        void testMutualLoop() {
            TarjanSccFinder.Components components = TarjanSccFinder.find(dependencyGraph(ModelFixtures.mutualLoop()));

            assertEquals(1, components.count());
            assertArrayEquals(new int[]{0, 1}, components.components().get(0));
        }

        @Test
        @DisplayName("Deep chains are handled without recursion")
        void testDeepChain() {
            int length = 100_000;
            TarjanSccFinder.Components components =
                    TarjanSccFinder.find(dependencyGraph(ModelFixtures.longChain(length)));

            assertEquals(length, components.count());
            for (int[] component : components.components()) {
                assertEquals(1, component.length);
            }
        }
    }
}
