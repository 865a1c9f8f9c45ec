package org.Aayush.blt.matching;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Immutable assignment of incidence rows to unknown slots.
 *
 * <p>A total matching is a bijection. Otherwise the unmatched rows and slots describe the
 * structurally deficient part of the system.</p>
 */
public final class MatchingResult {
    public static final int UNMATCHED = -1;

    private final int[] slotByRow;
    private final int[] rowBySlot;
    private final int[] unmatchedRows;
    private final int[] unmatchedSlots;
    private final int phases;
    private final int searches;
    private final boolean budgetExhausted;

    MatchingResult(int[] slotByRow, int[] rowBySlot, int phases, int searches, boolean budgetExhausted) {
        this.slotByRow = slotByRow.clone();
        this.rowBySlot = rowBySlot.clone();
        this.unmatchedRows = collectUnmatched(this.slotByRow);
        this.unmatchedSlots = collectUnmatched(this.rowBySlot);
        this.phases = phases;
        this.searches = searches;
        this.budgetExhausted = budgetExhausted;
    }

    /**
     * Returns the slot matched to {@code row}, or {@link #UNMATCHED}.
     */
    public int slotOfRow(int row) {
        return slotByRow[row];
    }

    /**
     * Returns the row matched to {@code slot}, or {@link #UNMATCHED}.
     */
    public int rowOfSlot(int slot) {
        return rowBySlot[slot];
    }

    public int rowCount() {
        return slotByRow.length;
    }

    public int slotCount() {
        return rowBySlot.length;
    }

    public int matchedCount() {
        return slotByRow.length - unmatchedRows.length;
    }

    /**
     * Returns true when every row and every slot is matched.
     */
    public boolean isTotal() {
        return unmatchedRows.length == 0 && unmatchedSlots.length == 0;
    }

    /**
     * Returns unmatched row positions in ascending order.
     */
    public int[] unmatchedRows() {
        return unmatchedRows.clone();
    }

    /**
     * Returns unmatched slot ids in ascending order.
     */
    public int[] unmatchedSlots() {
        return unmatchedSlots.clone();
    }

    /**
     * Returns number of augmenting phases run after greedy seeding.
     */
    public int phases() {
        return phases;
    }

    /**
     * Returns number of augmenting-path searches started.
     */
    public int searches() {
        return searches;
    }

    public boolean budgetExhausted() {
        return budgetExhausted;
    }

    private static int[] collectUnmatched(int[] assignment) {
        IntArrayList unmatched = new IntArrayList();
        for (int i = 0; i < assignment.length; i++) {
            if (assignment[i] == UNMATCHED) {
                unmatched.add(i);
            }
        }
        return unmatched.toIntArray();
    }
}
