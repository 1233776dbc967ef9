package com.publicdomain.matching.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MatchingConfigLoaderTest {

    private final MatchingConfigLoader loader = new MatchingConfigLoader();

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should load overrides and keep defaults for absent keys")
    void loadFixture() throws Exception {
        MatchingConfig config;
        try (InputStream in = getClass().getResourceAsStream("/config/matching-config.json")) {
            assertNotNull(in);
            config = loader.load(in);
        }

        assertEquals(new ScoringWeights(0.5, 0.3, 0.2), config.scoringWeights(ScoringScenario.NORMAL_WITH_PUBLISHER));
        assertEquals(ScoringWeights.defaultsFor(ScoringScenario.NORMAL_NO_PUBLISHER),
                config.scoringWeights(ScoringScenario.NORMAL_NO_PUBLISHER));
        assertEquals(20.0, config.getValidationThresholds().weakTitleCap());
        assertEquals(0.25, config.getValidationThresholds().authorOnlyFactor());
        assertEquals(ValidationThresholds.defaults().publisherOnlyFactor(),
                config.getValidationThresholds().publisherOnlyFactor());
        assertEquals(15.0, config.getLccnScoreBoost());
        assertEquals(0.75, config.getGenericTitlePenalty());
        assertEquals(25, config.getGenericFrequencyThreshold());
        assertFalse(config.isDerivedWorkDetectionEnabled());
        assertFalse(config.isStemmingEnabled());
        assertTrue(config.isLccnMatchingEnabled());
        assertEquals("fre", config.getDefaultLanguage());
    }

    @Test
    @DisplayName("An empty object yields the defaults")
    void emptyObject() {
        MatchingConfig config = loader.load(json("{}"));

        assertEquals(MatchingConfig.defaults().getLccnScoreBoost(), config.getLccnScoreBoost());
        assertEquals(ValidationThresholds.defaults(), config.getValidationThresholds());
    }

    @Test
    @DisplayName("Should reject weights that do not sum to one")
    void badWeights() {
        assertThrows(ConfigurationException.class, () -> loader.load(json(
                "{\"weights\":{\"NORMAL_WITH_PUBLISHER\":{\"title\":0.9,\"author\":0.3,\"publisher\":0.2}}}")));
    }

    @Test
    @DisplayName("Should reject incomplete weight triples")
    void incompleteWeights() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.load(json(
                "{\"weights\":{\"NORMAL_NO_PUBLISHER\":{\"title\":0.7,\"author\":0.3}}}")));

        assertTrue(e.getMessage().contains("NORMAL_NO_PUBLISHER"));
    }

    @Test
    @DisplayName("Should reject unknown keys, unknown scenarios and malformed JSON")
    void malformed() {
        assertThrows(ConfigurationException.class, () -> loader.load(json("{\"lccnBoost\":20}")));
        assertThrows(ConfigurationException.class, () -> loader.load(json(
                "{\"weights\":{\"SOMETIMES\":{\"title\":1,\"author\":0,\"publisher\":0}}}")));
        assertThrows(ConfigurationException.class, () -> loader.load(json("{\"lccnScoreBoost\":")));
        assertThrows(ConfigurationException.class, () -> loader.load(json("")));
    }

    @Test
    @DisplayName("Should reject out-of-range values")
    void outOfRange() {
        assertThrows(ConfigurationException.class, () -> loader.load(json("{\"genericTitlePenalty\":2.0}")));
        assertThrows(ConfigurationException.class, () -> loader.load(json("{\"validation\":{\"weakTitleCap\":150}}")));
    }

    @Test
    @DisplayName("Should wrap a missing file")
    void missingFile(@TempDir Path dir) {
        assertThrows(ConfigurationException.class, () -> loader.load(dir.resolve("missing.json")));
    }
}
