package org.Aayush.blt.decomposition;

import it.unimi.dsi.fastutil.ints.IntHeapPriorityQueue;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import org.Aayush.blt.incidence.IncidenceGraph;
import org.Aayush.blt.matching.MatchingResult;
import org.Aayush.blt.matching.SlotTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Block-lower-triangular decomposition of a matched equation system.
 *
 * <p>Flow:</p>
 * <ul>
 * <li>build the matched-node {@link DependencyGraph};</li>
 * <li>find strongly connected components ({@link TarjanSccFinder});</li>
 * <li>order the condensation with Kahn's algorithm, always releasing the ready component
 * whose first member was declared earliest;</li>
 * <li>emit one {@link Block} per component.</li>
 * </ul>
 *
 * <p>Because the ready set is ordered by declaration position, decomposing an equation list
 * that is already in block order reproduces the same block sequence.</p>
 */
public final class BltDecomposer {
    private static final Logger logger = LoggerFactory.getLogger(BltDecomposer.class);

    /**
     * Ordered blocks and the graph they were derived from.
     */
    public record Decomposition(List<Block> blocks, DependencyGraph dependencyGraph) {
    }

    /**
     * Decomposes the matched part of the system. Unmatched rows are not placed in any block.
     */
    public Decomposition decompose(IncidenceGraph graph, SlotTable slots, MatchingResult matching) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(slots, "slots");
        Objects.requireNonNull(matching, "matching");

        DependencyGraph dependencyGraph = DependencyGraph.build(graph, slots, matching);
        TarjanSccFinder.Components components = TarjanSccFinder.find(dependencyGraph);
        int[] order = topologicalOrder(dependencyGraph, components);

        List<Block> blocks = new ArrayList<>(order.length);
        for (int component : order) {
            blocks.add(toBlock(components.components().get(component), dependencyGraph, graph, slots, matching));
        }
        logger.debug("Decomposed {} matched equations into {} blocks ({} edges)",
                dependencyGraph.nodeCount(), blocks.size(), dependencyGraph.edgeCount());
        return new Decomposition(List.copyOf(blocks), dependencyGraph);
    }

    /**
     * Kahn's algorithm over the condensation, ready set keyed by smallest member node.
     */
    private static int[] topologicalOrder(DependencyGraph graph, TarjanSccFinder.Components components) {
        int componentCount = components.count();
        int[] componentOfNode = components.componentOfNode();
        int[] firstMember = new int[componentCount];
        for (int c = 0; c < componentCount; c++) {
            firstMember[c] = components.components().get(c)[0];
        }

        List<IntOpenHashSet> successors = new ArrayList<>(componentCount);
        int[] inDegree = new int[componentCount];
        for (int c = 0; c < componentCount; c++) {
            successors.add(new IntOpenHashSet());
        }
        for (int u = 0; u < graph.nodeCount(); u++) {
            int from = componentOfNode[u];
            for (int e = graph.edgeStart(u); e < graph.edgeEnd(u); e++) {
                int to = componentOfNode[graph.edgeTargetAt(e)];
                if (from != to && successors.get(from).add(to)) {
                    inDegree[to]++;
                }
            }
        }

        IntHeapPriorityQueue ready = new IntHeapPriorityQueue(
                (a, b) -> Integer.compare(firstMember[a], firstMember[b])
        );
        for (int c = 0; c < componentCount; c++) {
            if (inDegree[c] == 0) {
                ready.enqueue(c);
            }
        }

        int[] order = new int[componentCount];
        int emitted = 0;
        while (!ready.isEmpty()) {
            int component = ready.dequeueInt();
            order[emitted++] = component;
            for (int next : successors.get(component)) {
                if (--inDegree[next] == 0) {
                    ready.enqueue(next);
                }
            }
        }
        if (emitted != componentCount) {
            throw new IllegalStateException("condensation is not acyclic: ordered "
                    + emitted + " of " + componentCount + " components");
        }
        return order;
    }

    private static Block toBlock(
            int[] members,
            DependencyGraph dependencyGraph,
            IncidenceGraph graph,
            SlotTable slots,
            MatchingResult matching
    ) {
        boolean scalar = members.length == 1 && !dependencyGraph.isSelfDependent(members[0]);
        Block.BlockBuilder builder = Block.builder()
                .kind(scalar ? BlockKind.SCALAR : BlockKind.ALGEBRAIC_LOOP);
        for (int node : members) {
            int row = dependencyGraph.rowOf(node);
            int slot = matching.slotOfRow(row);
            builder.assignment(new BlockAssignment(graph.row(row).id(), slots.slot(slot).label(), row, slot));
        }
        return builder.build();
    }
}
