package org.Aayush.blt.decomposition;

import org.Aayush.blt.incidence.IncidenceGraph;
import org.Aayush.blt.incidence.IncidenceRow;
import org.Aayush.blt.incidence.Occurrence;
import org.Aayush.blt.matching.MatchingResult;
import org.Aayush.blt.matching.SlotTable;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable directed graph over matched (row, slot) pairs.
 *
 * <p>Nodes are matched rows in declaration order. Edge {@code u -> v} exists when the slot
 * matched to {@code u} occurs in row {@code v} and {@code u != v}. A node is
 * self-dependent when its own slot occurs in its row more than once; the single defining
 * occurrence is not a dependency.</p>
 *
 * <p>Backed by CSR arrays; successors of each node are sorted by node id.</p>
 */
public final class DependencyGraph {
    private final int[] rowByNode;
    private final int[] nodeByRow;
    private final int[] firstEdge;
    private final int[] edgeTarget;
    private final boolean[] selfDependent;

    private DependencyGraph(
            int[] rowByNode,
            int[] nodeByRow,
            int[] firstEdge,
            int[] edgeTarget,
            boolean[] selfDependent
    ) {
        this.rowByNode = rowByNode;
        this.nodeByRow = nodeByRow;
        this.firstEdge = firstEdge;
        this.edgeTarget = edgeTarget;
        this.selfDependent = selfDependent;
    }

    /**
     * Builds the matched-node graph. Unmatched rows get no node.
     */
    public static DependencyGraph build(IncidenceGraph graph, SlotTable slots, MatchingResult matching) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(slots, "slots");
        Objects.requireNonNull(matching, "matching");

        int rowCount = graph.size();
        int[] nodeByRow = new int[rowCount];
        Arrays.fill(nodeByRow, -1);
        int[] rowByNode = new int[matching.matchedCount()];
        int nodeCount = 0;
        for (int row = 0; row < rowCount; row++) {
            if (matching.slotOfRow(row) != MatchingResult.UNMATCHED) {
                nodeByRow[row] = nodeCount;
                rowByNode[nodeCount++] = row;
            }
        }

        // pass 1: out-degree per source node and self-dependency
        int[] outDegree = new int[nodeCount];
        boolean[] selfDependent = new boolean[nodeCount];
        for (int v = 0; v < nodeCount; v++) {
            IncidenceRow row = graph.row(rowByNode[v]);
            int ownSlot = matching.slotOfRow(row.position());
            for (Occurrence occurrence : row.occurrences()) {
                int slot = slots.resolve(occurrence);
                if (slot < 0) {
                    continue;
                }
                if (slot == ownSlot) {
                    selfDependent[v] = occurrence.count() > 1;
                    continue;
                }
                int sourceRow = matching.rowOfSlot(slot);
                if (sourceRow != MatchingResult.UNMATCHED) {
                    outDegree[nodeByRow[sourceRow]]++;
                }
            }
        }

        int[] firstEdge = new int[nodeCount + 1];
        int cursor = 0;
        for (int u = 0; u < nodeCount; u++) {
            firstEdge[u] = cursor;
            cursor += outDegree[u];
        }
        firstEdge[nodeCount] = cursor;

        // pass 2: fill targets; visiting v ascending keeps each successor list sorted
        int[] fillCursor = Arrays.copyOf(firstEdge, firstEdge.length);
        int[] edgeTarget = new int[cursor];
        for (int v = 0; v < nodeCount; v++) {
            IncidenceRow row = graph.row(rowByNode[v]);
            int ownSlot = matching.slotOfRow(row.position());
            for (Occurrence occurrence : row.occurrences()) {
                int slot = slots.resolve(occurrence);
                if (slot < 0 || slot == ownSlot) {
                    continue;
                }
                int sourceRow = matching.rowOfSlot(slot);
                if (sourceRow != MatchingResult.UNMATCHED) {
                    edgeTarget[fillCursor[nodeByRow[sourceRow]]++] = v;
                }
            }
        }
        return new DependencyGraph(rowByNode, nodeByRow, firstEdge, edgeTarget, selfDependent);
    }

    public int nodeCount() {
        return rowByNode.length;
    }

    public int edgeCount() {
        return edgeTarget.length;
    }

    /**
     * Returns the incidence row position of a node.
     */
    public int rowOf(int node) {
        validateNode(node);
        return rowByNode[node];
    }

    /**
     * Returns the node of an incidence row, or {@code -1} when the row is unmatched.
     */
    public int nodeOfRow(int row) {
        return nodeByRow[row];
    }

    /**
     * Returns start index (inclusive) of the successors of {@code node}.
     */
    public int edgeStart(int node) {
        validateNode(node);
        return firstEdge[node];
    }

    /**
     * Returns end index (exclusive) of the successors of {@code node}.
     */
    public int edgeEnd(int node) {
        validateNode(node);
        return firstEdge[node + 1];
    }

    public int edgeTargetAt(int edgeIndex) {
        return edgeTarget[edgeIndex];
    }

    public boolean isSelfDependent(int node) {
        validateNode(node);
        return selfDependent[node];
    }

    private void validateNode(int node) {
        if (node < 0 || node >= rowByNode.length) {
            throw new IndexOutOfBoundsException("node out of bounds: " + node);
        }
    }
}
