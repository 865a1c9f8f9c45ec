package org.Aayush.blt.matching;

/**
 * Deterministic bound on augmenting-path searches for pathological inputs.
 *
 * <p>Exhausting the budget does not fail the run: the matcher stops and reports the partial
 * matching it has.</p>
 */
public final class MatchingBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private final int maxSearches;

    private MatchingBudget(int maxSearches) {
        this.maxSearches = normalizeBound(maxSearches);
    }

    /**
     * Creates a budget; non-positive values mean unbounded.
     */
    public static MatchingBudget of(int maxSearches) {
        return new MatchingBudget(maxSearches);
    }

    public static MatchingBudget unbounded() {
        return new MatchingBudget(UNBOUNDED);
    }

    /**
     * Returns true while the 1-based {@code search} is within the bound.
     */
    boolean allowsSearch(int search) {
        return search <= maxSearches;
    }

    public int maxSearches() {
        return maxSearches;
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }
}
