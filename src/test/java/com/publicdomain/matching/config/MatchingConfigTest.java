package com.publicdomain.matching.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MatchingConfigTest {

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Should populate every scenario and enable all detectors")
        void defaults() {
            MatchingConfig config = MatchingConfig.defaults();

            for (ScoringScenario scenario : ScoringScenario.values()) {
                assertNotNull(config.scoringWeights(scenario));
            }
            assertEquals(20.0, config.getLccnScoreBoost());
            assertEquals(0.8, config.getGenericTitlePenalty());
            assertTrue(config.isLccnMatchingEnabled());
            assertTrue(config.isGenericTitleDetectionEnabled());
            assertTrue(config.isDerivedWorkDetectionEnabled());
            assertTrue(config.isStemmingEnabled());
            assertEquals("eng", config.getDefaultLanguage());
            assertEquals(ValidationThresholds.defaults(), config.getValidationThresholds());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Should reject out-of-range values")
        void outOfRange() {
            assertThrows(ConfigurationException.class, () -> MatchingConfig.builder().lccnScoreBoost(120));
            assertThrows(ConfigurationException.class, () -> MatchingConfig.builder().genericTitlePenalty(1.5));
            assertThrows(ConfigurationException.class, () -> MatchingConfig.builder().authorNoiseFloor(-1));
            assertThrows(ConfigurationException.class, () -> MatchingConfig.builder().genericFrequencyThreshold(0));
            assertThrows(ConfigurationException.class, () -> MatchingConfig.builder().defaultLanguage(" "));
            assertThrows(ConfigurationException.class, () -> MatchingConfig.builder().normalizationCacheSize(0));
        }

        @Test
        @DisplayName("Validation thresholds should reject bad factors and ranges")
        void validationThresholds() {
            assertThrows(ConfigurationException.class, () -> new ValidationThresholds(
                    80, 20, 20, 1.3, 80, 20, 20, 0.5, 30, 50, 10, 25));
            assertThrows(ConfigurationException.class, () -> new ValidationThresholds(
                    80, 20, 20, 0.3, 80, 20, 20, 0.5, 60, 50, 10, 25));
            assertThrows(ConfigurationException.class, () -> new ValidationThresholds(
                    80, 20, 20, 0.3, 80, 20, 20, 0.5, 30, 50, 10, 101));
        }
    }

    @Test
    @DisplayName("Should override scenario weights")
    void overrideWeights() {
        ScoringWeights custom = new ScoringWeights(0.5, 0.5, 0.0);

        MatchingConfig config = MatchingConfig.builder()
                .scoringWeights(ScoringScenario.NORMAL_NO_PUBLISHER, custom)
                .build();

        assertEquals(custom, config.scoringWeights(ScoringScenario.NORMAL_NO_PUBLISHER));
        assertEquals(ScoringWeights.defaultsFor(ScoringScenario.NORMAL_WITH_PUBLISHER),
                config.scoringWeights(ScoringScenario.NORMAL_WITH_PUBLISHER));
    }
}
