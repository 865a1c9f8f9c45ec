package org.Aayush.blt.core;

import org.Aayush.blt.matching.MatchingBudget;
import org.Aayush.blt.model.EquationSection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("AnalysisConfig Tests")
class AnalysisConfigTest {

    @AfterEach
    void restoreProperties() {
        System.clearProperty(AnalysisConfig.PROP_INCLUDE_INITIAL);
        System.clearProperty(AnalysisConfig.PROP_INCLUDE_EVENT);
        System.clearProperty(AnalysisConfig.PROP_MAX_SEARCHES);
    }

    @Test
    @DisplayName("Builder defaults analyze every section without a matching bound")
    void testBuilderDefaults() {
        AnalysisConfig config = AnalysisConfig.builder().build();

        assertTrue(config.isIncludeInitialEquations());
        assertTrue(config.isIncludeEventEquations());
        assertEquals(MatchingBudget.UNBOUNDED, config.getMaxAugmentingSearches());
        assertEquals(EnumSet.allOf(EquationSection.class), config.analyzedSections());
    }

    @Test
    @DisplayName("System properties override defaults")
    void testDefaultsFromProperties() {
        System.setProperty(AnalysisConfig.PROP_INCLUDE_INITIAL, "false");
        System.setProperty(AnalysisConfig.PROP_INCLUDE_EVENT, " FALSE ");
        System.setProperty(AnalysisConfig.PROP_MAX_SEARCHES, "25");

        AnalysisConfig config = AnalysisConfig.defaults();

        assertFalse(config.isIncludeInitialEquations());
        assertFalse(config.isIncludeEventEquations());
        assertEquals(25, config.matchingBudget().maxSearches());
        assertEquals(EnumSet.of(EquationSection.CONTINUOUS), config.analyzedSections());
    }

    @Test
    @DisplayName("Invalid or blank property values fall back to defaults")
    void testInvalidPropertiesFallBack() {
        System.setProperty(AnalysisConfig.PROP_INCLUDE_INITIAL, "maybe");
        System.setProperty(AnalysisConfig.PROP_INCLUDE_EVENT, " ");
        System.setProperty(AnalysisConfig.PROP_MAX_SEARCHES, "many");

        AnalysisConfig config = AnalysisConfig.defaults();

        assertTrue(config.isIncludeInitialEquations());
        assertTrue(config.isIncludeEventEquations());
        assertEquals(MatchingBudget.UNBOUNDED, config.getMaxAugmentingSearches());
    }

    @Test
    @DisplayName("Event flag covers event and discrete sections together")
    void testEventSections() {
        AnalysisConfig config = AnalysisConfig.builder().includeInitialEquations(false).build();

        assertEquals(EnumSet.of(EquationSection.CONTINUOUS, EquationSection.EVENT, EquationSection.DISCRETE),
                config.analyzedSections());
    }

    @Test
    @DisplayName("Non-positive search bounds are unbounded")
    void testNonPositiveBound() {
        AnalysisConfig config = AnalysisConfig.builder().maxAugmentingSearches(0).build();

        assertEquals(MatchingBudget.UNBOUNDED, config.matchingBudget().maxSearches());
    }
}
