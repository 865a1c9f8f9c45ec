package org.Aayush.blt.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.blt.matching.MatchingBudget;
import org.Aayush.blt.model.EquationSection;

import java.util.EnumSet;
import java.util.Set;

/**
 * Configuration of one {@link BltAnalyzer}.
 */
@Value
@Builder
public class AnalysisConfig {
    public static final String PROP_INCLUDE_INITIAL = "blt.analysis.includeInitialEquations";
    public static final String PROP_INCLUDE_EVENT = "blt.analysis.includeEventEquations";
    public static final String PROP_MAX_SEARCHES = "blt.matching.maxAugmentingSearches";

    /**
     * Solve initial equations together with the model; states they constrain become value unknowns.
     */
    @Builder.Default
    boolean includeInitialEquations = true;

    /**
     * Solve event (when) and discrete equations; discrete variables become unknowns.
     */
    @Builder.Default
    boolean includeEventEquations = true;

    /**
     * Maximum augmenting-path searches of the matcher. Non-positive or {@link MatchingBudget#UNBOUNDED}
     * means unbounded.
     */
    @Builder.Default
    int maxAugmentingSearches = MatchingBudget.UNBOUNDED;

    /**
     * Loads configuration from system properties, falling back to builder defaults for
     * missing or unparsable values.
     */
    public static AnalysisConfig defaults() {
        AnalysisConfig fallback = AnalysisConfig.builder().build();
        return AnalysisConfig.builder()
                .includeInitialEquations(readFlag(PROP_INCLUDE_INITIAL, fallback.isIncludeInitialEquations()))
                .includeEventEquations(readFlag(PROP_INCLUDE_EVENT, fallback.isIncludeEventEquations()))
                .maxAugmentingSearches(readBound(PROP_MAX_SEARCHES, fallback.getMaxAugmentingSearches()))
                .build();
    }

    /**
     * Returns the equation sections whose equations are solved.
     */
    public Set<EquationSection> analyzedSections() {
        Set<EquationSection> sections = EnumSet.of(EquationSection.CONTINUOUS);
        if (includeEventEquations) {
            sections.add(EquationSection.EVENT);
            sections.add(EquationSection.DISCRETE);
        }
        if (includeInitialEquations) {
            sections.add(EquationSection.INITIAL);
        }
        return sections;
    }

    public MatchingBudget matchingBudget() {
        return MatchingBudget.of(maxAugmentingSearches);
    }

    private static boolean readFlag(String property, boolean fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String normalized = raw.trim();
        if (normalized.equalsIgnoreCase("true")) {
            return true;
        }
        if (normalized.equalsIgnoreCase("false")) {
            return false;
        }
        return fallback;
    }

    private static int readBound(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
