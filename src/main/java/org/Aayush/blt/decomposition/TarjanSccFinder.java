package org.Aayush.blt.decomposition;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Strongly connected components of a {@link DependencyGraph} (Tarjan, iterative).
 *
 * <p>Roots are tried in ascending node order and successors in CSR order, so the output is
 * reproducible. Members of each component are returned sorted ascending.</p>
 */
@UtilityClass
public final class TarjanSccFinder {

    /**
     * Component membership of every node.
     *
     * @param components member node ids per component, each sorted ascending.
     * @param componentOfNode component id per node.
     */
    public record Components(List<int[]> components, int[] componentOfNode) {
        public int count() {
            return components.size();
        }
    }

    /**
     * Computes strongly connected components in reverse topological order of discovery.
     */
    public static Components find(DependencyGraph graph) {
        Objects.requireNonNull(graph, "graph");
        int nodeCount = graph.nodeCount();

        int[] index = new int[nodeCount];
        int[] lowLink = new int[nodeCount];
        int[] edgeCursor = new int[nodeCount];
        int[] componentOfNode = new int[nodeCount];
        boolean[] onStack = new boolean[nodeCount];
        Arrays.fill(index, -1);

        IntArrayList sccStack = new IntArrayList();
        IntArrayList callStack = new IntArrayList();
        List<int[]> components = new ArrayList<>();
        int counter = 0;

        for (int start = 0; start < nodeCount; start++) {
            if (index[start] != -1) {
                continue;
            }
            index[start] = counter;
            lowLink[start] = counter++;
            edgeCursor[start] = graph.edgeStart(start);
            sccStack.add(start);
            onStack[start] = true;
            callStack.add(start);

            while (!callStack.isEmpty()) {
                int v = callStack.getInt(callStack.size() - 1);
                if (edgeCursor[v] < graph.edgeEnd(v)) {
                    int w = graph.edgeTargetAt(edgeCursor[v]++);
                    if (index[w] == -1) {
                        index[w] = counter;
                        lowLink[w] = counter++;
                        edgeCursor[w] = graph.edgeStart(w);
                        sccStack.add(w);
                        onStack[w] = true;
                        callStack.add(w);
                    } else if (onStack[w]) {
                        lowLink[v] = Math.min(lowLink[v], index[w]);
                    }
                    continue;
                }

                callStack.removeInt(callStack.size() - 1);
                if (lowLink[v] == index[v]) {
                    IntArrayList members = new IntArrayList();
                    int w;
                    do {
                        w = sccStack.removeInt(sccStack.size() - 1);
                        onStack[w] = false;
                        componentOfNode[w] = components.size();
                        members.add(w);
                    } while (w != v);
                    int[] sorted = members.toIntArray();
                    Arrays.sort(sorted);
                    components.add(sorted);
                }
                if (!callStack.isEmpty()) {
                    int parent = callStack.getInt(callStack.size() - 1);
                    lowLink[parent] = Math.min(lowLink[parent], lowLink[v]);
                }
            }
        }
        return new Components(List.copyOf(components), componentOfNode);
    }
}
