package com.publicdomain.matching.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads a {@link MatchingConfig} from JSON. Every key is optional; absent keys keep their
 * defaults. Unknown keys, incomplete weight triples and out-of-range values are rejected
 * with a {@link ConfigurationException}.
 *
 * <pre>
 * {
 *   "weights": {"NORMAL_WITH_PUBLISHER": {"title": 0.6, "author": 0.25, "publisher": 0.15}},
 *   "validation": {"weakTitleCap": 25},
 *   "lccnScoreBoost": 20,
 *   "stemmingEnabled": true
 * }
 * </pre>
 */
public class MatchingConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(MatchingConfigLoader.class);

    private final ObjectMapper objectMapper;

    public MatchingConfigLoader() {
        this(new ObjectMapper());
    }

    public MatchingConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public MatchingConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            MatchingConfig config = load(in);
            log.info("config.loaded path={}", path);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read matching configuration " + path, e);
        }
    }

    public MatchingConfig load(InputStream in) {
        ConfigFile file;
        try {
            file = objectMapper.readValue(in, ConfigFile.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed matching configuration: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read matching configuration", e);
        }
        if (file == null) {
            throw new ConfigurationException("Matching configuration is empty");
        }
        return toConfig(file);
    }

    private MatchingConfig toConfig(ConfigFile file) {
        MatchingConfig.Builder builder = MatchingConfig.builder();

        if (file.weights() != null) {
            for (Map.Entry<ScoringScenario, WeightsEntry> entry : file.weights().entrySet()) {
                WeightsEntry w = entry.getValue();
                if (w == null || w.title() == null || w.author() == null || w.publisher() == null) {
                    throw new ConfigurationException("Weights for " + entry.getKey()
                            + " must define title, author and publisher");
                }
                builder.scoringWeights(entry.getKey(), new ScoringWeights(w.title(), w.author(), w.publisher()));
            }
        }
        if (file.validation() != null) {
            builder.validationThresholds(file.validation().applyTo(ValidationThresholds.defaults()));
        }
        if (file.lccnScoreBoost() != null) builder.lccnScoreBoost(file.lccnScoreBoost());
        if (file.genericTitlePenalty() != null) builder.genericTitlePenalty(file.genericTitlePenalty());
        if (file.redistributionTitleFloor() != null) builder.redistributionTitleFloor(file.redistributionTitleFloor());
        if (file.authorNoiseFloor() != null) builder.authorNoiseFloor(file.authorNoiseFloor());
        if (file.lccnMatchingEnabled() != null) builder.lccnMatchingEnabled(file.lccnMatchingEnabled());
        if (file.genericTitleDetectionEnabled() != null) {
            builder.genericTitleDetectionEnabled(file.genericTitleDetectionEnabled());
        }
        if (file.genericFrequencyThreshold() != null) {
            builder.genericFrequencyThreshold(file.genericFrequencyThreshold());
        }
        if (file.derivedWorkDetectionEnabled() != null) {
            builder.derivedWorkDetectionEnabled(file.derivedWorkDetectionEnabled());
        }
        if (file.derivedWorkConfidenceFloor() != null) {
            builder.derivedWorkConfidenceFloor(file.derivedWorkConfidenceFloor());
        }
        if (file.stemmingEnabled() != null) builder.stemmingEnabled(file.stemmingEnabled());
        if (file.abbreviationExpansionEnabled() != null) {
            builder.abbreviationExpansionEnabled(file.abbreviationExpansionEnabled());
        }
        if (file.defaultLanguage() != null) builder.defaultLanguage(file.defaultLanguage());
        if (file.normalizationCacheSize() != null) builder.normalizationCacheSize(file.normalizationCacheSize());

        return builder.build();
    }

    record ConfigFile(
            Map<ScoringScenario, WeightsEntry> weights,
            ValidationEntry validation,
            Double lccnScoreBoost,
            Double genericTitlePenalty,
            Double redistributionTitleFloor,
            Double authorNoiseFloor,
            Boolean lccnMatchingEnabled,
            Boolean genericTitleDetectionEnabled,
            Integer genericFrequencyThreshold,
            Boolean derivedWorkDetectionEnabled,
            Double derivedWorkConfidenceFloor,
            Boolean stemmingEnabled,
            Boolean abbreviationExpansionEnabled,
            String defaultLanguage,
            Long normalizationCacheSize
    ) {
    }

    record WeightsEntry(Double title, Double author, Double publisher) {
    }

    record ValidationEntry(
            Double authorOnlyAuthorMin,
            Double authorOnlyTitleMax,
            Double authorOnlyPublisherMax,
            Double authorOnlyFactor,
            Double publisherOnlyPublisherMin,
            Double publisherOnlyTitleMax,
            Double publisherOnlyAuthorMax,
            Double publisherOnlyFactor,
            Double weakTitleMin,
            Double weakTitleMax,
            Double weakTitleSupportMax,
            Double weakTitleCap
    ) {
        ValidationThresholds applyTo(ValidationThresholds base) {
            return new ValidationThresholds(
                    or(authorOnlyAuthorMin, base.authorOnlyAuthorMin()),
                    or(authorOnlyTitleMax, base.authorOnlyTitleMax()),
                    or(authorOnlyPublisherMax, base.authorOnlyPublisherMax()),
                    or(authorOnlyFactor, base.authorOnlyFactor()),
                    or(publisherOnlyPublisherMin, base.publisherOnlyPublisherMin()),
                    or(publisherOnlyTitleMax, base.publisherOnlyTitleMax()),
                    or(publisherOnlyAuthorMax, base.publisherOnlyAuthorMax()),
                    or(publisherOnlyFactor, base.publisherOnlyFactor()),
                    or(weakTitleMin, base.weakTitleMin()),
                    or(weakTitleMax, base.weakTitleMax()),
                    or(weakTitleSupportMax, base.weakTitleSupportMax()),
                    or(weakTitleCap, base.weakTitleCap()));
        }

        private static double or(Double value, double fallback) {
            return value != null ? value : fallback;
        }
    }
}
