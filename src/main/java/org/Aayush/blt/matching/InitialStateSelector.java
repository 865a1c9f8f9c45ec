package org.Aayush.blt.matching;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.blt.core.id.VariableIndex;
import org.Aayush.blt.incidence.IncidenceGraph;
import org.Aayush.blt.incidence.IncidenceRow;
import org.Aayush.blt.incidence.Occurrence;
import org.Aayush.blt.model.EquationSection;

import java.util.Arrays;
import java.util.List;

/**
 * Chooses the differentiated states whose values initial-equation rows determine.
 *
 * <p>An initial row reaches a state when it references the state (value or derivative) or
 * references an unknown that some non-initial row ties to the state, transitively. Each initial
 * row is then paired with at most one reachable state by a maximum matching, so every selected
 * value slot is paid for by exactly one initial row.</p>
 */
final class InitialStateSelector {
    private static final int NONE = -1;

    private InitialStateSelector() {
    }

    /**
     * Returns, per dense variable id, whether that differentiated state gets a value slot.
     *
     * @param index dense variable ids of the model.
     * @param graph analyzed incidence rows.
     * @param differentiated per variable id, true for states some row differentiates.
     * @param passThrough per variable id, true for unknown values other than differentiated states.
     */
    static boolean[] select(VariableIndex index, IncidenceGraph graph, boolean[] differentiated, boolean[] passThrough) {
        int variableCount = index.size();
        List<IncidenceRow> rows = graph.rows();

        IntArrayList initialRows = new IntArrayList();
        IntArrayList[] rowsByVariable = new IntArrayList[variableCount];
        for (IncidenceRow row : rows) {
            if (row.section() == EquationSection.INITIAL) {
                initialRows.add(row.position());
                continue;
            }
            for (Occurrence occurrence : row.occurrences()) {
                int variable = index.indexOf(occurrence.variable());
                if (!passThrough[variable] || occurrence.derivative()) {
                    continue;
                }
                if (rowsByVariable[variable] == null) {
                    rowsByVariable[variable] = new IntArrayList();
                }
                rowsByVariable[variable].add(row.position());
            }
        }

        boolean[] selected = new boolean[variableCount];
        if (initialRows.isEmpty()) {
            return selected;
        }

        IntArrayList[] reach = new IntArrayList[initialRows.size()];
        int[] variableStamp = new int[variableCount];
        int[] rowStamp = new int[rows.size()];
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        for (int k = 0; k < initialRows.size(); k++) {
            int stamp = k + 1;
            reach[k] = new IntArrayList();
            int start = initialRows.getInt(k);
            rowStamp[start] = stamp;
            enqueueRow(index, rows.get(start), stamp, variableStamp, queue);
            while (!queue.isEmpty()) {
                int variable = queue.dequeueInt();
                if (differentiated[variable]) {
                    reach[k].add(variable);
                } else if (passThrough[variable] && rowsByVariable[variable] != null) {
                    IntArrayList linked = rowsByVariable[variable];
                    for (int i = 0; i < linked.size(); i++) {
                        int next = linked.getInt(i);
                        if (rowStamp[next] != stamp) {
                            rowStamp[next] = stamp;
                            enqueueRow(index, rows.get(next), stamp, variableStamp, queue);
                        }
                    }
                }
            }
        }

        int[] rowByState = pair(reach, variableCount);
        for (int variable = 0; variable < variableCount; variable++) {
            selected[variable] = rowByState[variable] != NONE;
        }
        return selected;
    }

    private static void enqueueRow(
            VariableIndex index,
            IncidenceRow row,
            int stamp,
            int[] variableStamp,
            IntArrayFIFOQueue queue
    ) {
        for (Occurrence occurrence : row.occurrences()) {
            int variable = index.indexOf(occurrence.variable());
            if (variableStamp[variable] != stamp) {
                variableStamp[variable] = stamp;
                queue.enqueue(variable);
            }
        }
    }

    /**
     * Iterative augmenting-path matching of initial rows to reachable states.
     */
    private static int[] pair(IntArrayList[] reach, int variableCount) {
        int[] rowByState = new int[variableCount];
        Arrays.fill(rowByState, NONE);
        int[] cursor = new int[reach.length];
        int[] seen = new int[variableCount];
        IntArrayList stack = new IntArrayList();

        for (int root = 0; root < reach.length; root++) {
            int attempt = root + 1;
            stack.clear();
            stack.add(root);
            cursor[root] = 0;
            while (!stack.isEmpty()) {
                int row = stack.getInt(stack.size() - 1);
                if (cursor[row] >= reach[row].size()) {
                    stack.removeInt(stack.size() - 1);
                    continue;
                }
                int state = reach[row].getInt(cursor[row]);
                if (seen[state] == attempt) {
                    cursor[row]++;
                    continue;
                }
                seen[state] = attempt;
                int owner = rowByState[state];
                if (owner == NONE) {
                    // each stacked row takes the state its cursor points at
                    for (int i = stack.size() - 1; i >= 0; i--) {
                        int pathRow = stack.getInt(i);
                        rowByState[reach[pathRow].getInt(cursor[pathRow])] = pathRow;
                    }
                    break;
                }
                cursor[owner] = 0;
                stack.add(owner);
            }
        }
        return rowByState;
    }
}
