package org.Aayush.blt.matching;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import org.Aayush.blt.incidence.IncidenceGraph;
import org.Aayush.blt.incidence.IncidenceRow;
import org.Aayush.blt.incidence.Occurrence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Maximum bipartite matching of incidence rows to unknown slots (Hopcroft-Karp).
 *
 * <p>Candidate order and tie-break are fixed so the result is reproducible:</p>
 * <ul>
 * <li>each row tries its derivative slots first, then value slots, both in occurrence order;</li>
 * <li>rows are visited by ascending candidate count, then declaration position. Solving the
 * most constrained equations first tends to keep algebraic loops small. This is a heuristic,
 * not a correctness requirement: any maximum matching yields the same block partition.</li>
 * </ul>
 *
 * <p>Augmentation uses an explicit stack, so deep alternating paths do not grow the call stack.
 * Instances are immutable and thread-safe; working arrays are allocated per call.</p>
 */
public final class HopcroftKarpMatcher {
    private static final Logger logger = LoggerFactory.getLogger(HopcroftKarpMatcher.class);

    private static final int INF = Integer.MAX_VALUE;

    private final MatchingBudget budget;

    public HopcroftKarpMatcher(MatchingBudget budget) {
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    public HopcroftKarpMatcher() {
        this(MatchingBudget.unbounded());
    }

    /**
     * Computes a maximum matching between the rows of {@code graph} and {@code slots}.
     *
     * @param graph incidence rows.
     * @param slots unknown slots the rows may determine.
     * @return total or partial matching.
     */
    public MatchingResult match(IncidenceGraph graph, SlotTable slots) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(slots, "slots");
        Candidates candidates = Candidates.build(graph, slots);
        int rowCount = graph.size();

        int[] slotByRow = new int[rowCount];
        int[] rowBySlot = new int[slots.size()];
        Arrays.fill(slotByRow, MatchingResult.UNMATCHED);
        Arrays.fill(rowBySlot, MatchingResult.UNMATCHED);

        int[] order = visitOrder(candidates, rowCount);
        seedGreedy(candidates, order, slotByRow, rowBySlot);

        int[] dist = new int[rowCount];
        int[] cursor = new int[rowCount];
        IntArrayList stack = new IntArrayList();
        int phases = 0;
        int searches = 0;
        boolean exhausted = false;
        while (!exhausted && layer(candidates, order, slotByRow, rowBySlot, dist)) {
            phases++;
            for (int row = 0; row < rowCount; row++) {
                cursor[row] = candidates.start(row);
            }
            for (int root : order) {
                if (slotByRow[root] != MatchingResult.UNMATCHED) {
                    continue;
                }
                if (!budget.allowsSearch(searches + 1)) {
                    exhausted = true;
                    logger.warn("Matching stopped after {} augmenting searches (budget {})",
                            searches, budget.maxSearches());
                    break;
                }
                searches++;
                augment(root, candidates, slotByRow, rowBySlot, dist, cursor, stack);
            }
        }

        MatchingResult result = new MatchingResult(slotByRow, rowBySlot, phases, searches, exhausted);
        logger.debug("Matched {}/{} rows against {} slots ({} phases, {} searches)",
                result.matchedCount(), rowCount, slots.size(), phases, searches);
        return result;
    }

    /**
     * Returns rows sorted by candidate count, then declaration position.
     */
    private static int[] visitOrder(Candidates candidates, int rowCount) {
        int[] order = new int[rowCount];
        for (int i = 0; i < rowCount; i++) {
            order[i] = i;
        }
        IntArrays.mergeSort(order, (a, b) -> {
            int bySize = Integer.compare(candidates.degree(a), candidates.degree(b));
            return bySize != 0 ? bySize : Integer.compare(a, b);
        });
        return order;
    }

    private static void seedGreedy(Candidates candidates, int[] order, int[] slotByRow, int[] rowBySlot) {
        for (int row : order) {
            for (int i = candidates.start(row); i < candidates.end(row); i++) {
                int slot = candidates.slotAt(i);
                if (rowBySlot[slot] == MatchingResult.UNMATCHED) {
                    slotByRow[row] = slot;
                    rowBySlot[slot] = row;
                    break;
                }
            }
        }
    }

    /**
     * BFS from all free rows. Returns true if some free slot is reachable.
     */
    private static boolean layer(
            Candidates candidates,
            int[] order,
            int[] slotByRow,
            int[] rowBySlot,
            int[] dist
    ) {
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        for (int row : order) {
            if (slotByRow[row] == MatchingResult.UNMATCHED) {
                dist[row] = 0;
                queue.enqueue(row);
            } else {
                dist[row] = INF;
            }
        }

        boolean reachable = false;
        while (!queue.isEmpty()) {
            int row = queue.dequeueInt();
            for (int i = candidates.start(row); i < candidates.end(row); i++) {
                int next = rowBySlot[candidates.slotAt(i)];
                if (next == MatchingResult.UNMATCHED) {
                    reachable = true;
                } else if (dist[next] == INF) {
                    dist[next] = dist[row] + 1;
                    queue.enqueue(next);
                }
            }
        }
        return reachable;
    }

    /**
     * Iterative layered DFS from {@code root}; flips the path when a free slot is reached.
     */
    private static boolean augment(
            int root,
            Candidates candidates,
            int[] slotByRow,
            int[] rowBySlot,
            int[] dist,
            int[] cursor,
            IntArrayList stack
    ) {
        stack.clear();
        stack.add(root);
        while (!stack.isEmpty()) {
            int row = stack.getInt(stack.size() - 1);
            if (cursor[row] >= candidates.end(row)) {
                dist[row] = INF;
                stack.removeInt(stack.size() - 1);
                continue;
            }
            int slot = candidates.slotAt(cursor[row]);
            int next = rowBySlot[slot];
            if (next == MatchingResult.UNMATCHED) {
                // every stacked row takes the slot its cursor points at
                for (int i = stack.size() - 1; i >= 0; i--) {
                    int pathRow = stack.getInt(i);
                    int pathSlot = candidates.slotAt(cursor[pathRow]);
                    slotByRow[pathRow] = pathSlot;
                    rowBySlot[pathSlot] = pathRow;
                }
                return true;
            }
            if (dist[next] != INF && dist[next] == dist[row] + 1) {
                stack.add(next);
            } else {
                cursor[row]++;
            }
        }
        return false;
    }

    /**
     * CSR candidate lists: row to slot ids, derivative slots first.
     */
    static final class Candidates {
        private final int[] firstCandidate;
        private final int[] slotIds;

        private Candidates(int[] firstCandidate, int[] slotIds) {
            this.firstCandidate = firstCandidate;
            this.slotIds = slotIds;
        }

        static Candidates build(IncidenceGraph graph, SlotTable slots) {
            int rowCount = graph.size();
            int[] first = new int[rowCount + 1];
            IntArrayList ids = new IntArrayList();
            for (int row = 0; row < rowCount; row++) {
                first[row] = ids.size();
                IncidenceRow incidenceRow = graph.row(row);
                appendResolved(incidenceRow, slots, true, ids);
                appendResolved(incidenceRow, slots, false, ids);
            }
            first[rowCount] = ids.size();
            return new Candidates(first, ids.toIntArray());
        }

        private static void appendResolved(IncidenceRow row, SlotTable slots, boolean derivative, IntArrayList ids) {
            for (Occurrence occurrence : row.occurrences()) {
                if (occurrence.derivative() != derivative) {
                    continue;
                }
                int slot = slots.resolve(occurrence);
                if (slot >= 0) {
                    ids.add(slot);
                }
            }
        }

        int start(int row) {
            return firstCandidate[row];
        }

        int end(int row) {
            return firstCandidate[row + 1];
        }

        int degree(int row) {
            return firstCandidate[row + 1] - firstCandidate[row];
        }

        int slotAt(int position) {
            return slotIds[position];
        }
    }
}
