package com.publicdomain.matching.config;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Typed matching configuration: scenario weights, false-positive guards, boosts,
 * penalties and text-processing switches. Loaded once and shared read-only by all workers.
 */
public class MatchingConfig {

    private static final double DEFAULT_LCCN_SCORE_BOOST = 20.0;
    private static final double DEFAULT_GENERIC_TITLE_PENALTY = 0.8;
    private static final double DEFAULT_REDISTRIBUTION_TITLE_FLOOR = 70.0;
    private static final double DEFAULT_AUTHOR_NOISE_FLOOR = 60.0;
    private static final double DEFAULT_DERIVED_WORK_CONFIDENCE = 0.9;
    private static final int DEFAULT_GENERIC_FREQUENCY_THRESHOLD = 10;
    private static final long DEFAULT_NORMALIZATION_CACHE_SIZE = 50_000;
    private static final String DEFAULT_LANGUAGE = "eng";

    private final Map<ScoringScenario, ScoringWeights> scenarioWeights;
    private final ValidationThresholds validationThresholds;
    private final double lccnScoreBoost;
    private final double genericTitlePenalty;
    private final double redistributionTitleFloor;
    private final double authorNoiseFloor;
    private final boolean lccnMatchingEnabled;
    private final boolean genericTitleDetectionEnabled;
    private final int genericFrequencyThreshold;
    private final boolean derivedWorkDetectionEnabled;
    private final double derivedWorkConfidenceFloor;
    private final boolean stemmingEnabled;
    private final boolean abbreviationExpansionEnabled;
    private final String defaultLanguage;
    private final long normalizationCacheSize;

    private MatchingConfig(Builder builder) {
        this.scenarioWeights = new EnumMap<>(builder.scenarioWeights);
        this.validationThresholds = builder.validationThresholds;
        this.lccnScoreBoost = builder.lccnScoreBoost;
        this.genericTitlePenalty = builder.genericTitlePenalty;
        this.redistributionTitleFloor = builder.redistributionTitleFloor;
        this.authorNoiseFloor = builder.authorNoiseFloor;
        this.lccnMatchingEnabled = builder.lccnMatchingEnabled;
        this.genericTitleDetectionEnabled = builder.genericTitleDetectionEnabled;
        this.genericFrequencyThreshold = builder.genericFrequencyThreshold;
        this.derivedWorkDetectionEnabled = builder.derivedWorkDetectionEnabled;
        this.derivedWorkConfidenceFloor = builder.derivedWorkConfidenceFloor;
        this.stemmingEnabled = builder.stemmingEnabled;
        this.abbreviationExpansionEnabled = builder.abbreviationExpansionEnabled;
        this.defaultLanguage = builder.defaultLanguage;
        this.normalizationCacheSize = builder.normalizationCacheSize;
    }

    /**
     * Weights for the given scenario. Every scenario is always populated.
     */
    public ScoringWeights scoringWeights(ScoringScenario scenario) {
        return scenarioWeights.get(scenario);
    }

    public ValidationThresholds getValidationThresholds() {
        return validationThresholds;
    }

    public double getLccnScoreBoost() {
        return lccnScoreBoost;
    }

    public double getGenericTitlePenalty() {
        return genericTitlePenalty;
    }

    public double getRedistributionTitleFloor() {
        return redistributionTitleFloor;
    }

    public double getAuthorNoiseFloor() {
        return authorNoiseFloor;
    }

    public boolean isLccnMatchingEnabled() {
        return lccnMatchingEnabled;
    }

    public boolean isGenericTitleDetectionEnabled() {
        return genericTitleDetectionEnabled;
    }

    public int getGenericFrequencyThreshold() {
        return genericFrequencyThreshold;
    }

    public boolean isDerivedWorkDetectionEnabled() {
        return derivedWorkDetectionEnabled;
    }

    public double getDerivedWorkConfidenceFloor() {
        return derivedWorkConfidenceFloor;
    }

    public boolean isStemmingEnabled() {
        return stemmingEnabled;
    }

    public boolean isAbbreviationExpansionEnabled() {
        return abbreviationExpansionEnabled;
    }

    public String getDefaultLanguage() {
        return defaultLanguage;
    }

    public long getNormalizationCacheSize() {
        return normalizationCacheSize;
    }

    public static MatchingConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<ScoringScenario, ScoringWeights> scenarioWeights = new EnumMap<>(ScoringScenario.class);
        private ValidationThresholds validationThresholds = ValidationThresholds.defaults();
        private double lccnScoreBoost = DEFAULT_LCCN_SCORE_BOOST;
        private double genericTitlePenalty = DEFAULT_GENERIC_TITLE_PENALTY;
        private double redistributionTitleFloor = DEFAULT_REDISTRIBUTION_TITLE_FLOOR;
        private double authorNoiseFloor = DEFAULT_AUTHOR_NOISE_FLOOR;
        private boolean lccnMatchingEnabled = true;
        private boolean genericTitleDetectionEnabled = true;
        private int genericFrequencyThreshold = DEFAULT_GENERIC_FREQUENCY_THRESHOLD;
        private boolean derivedWorkDetectionEnabled = true;
        private double derivedWorkConfidenceFloor = DEFAULT_DERIVED_WORK_CONFIDENCE;
        private boolean stemmingEnabled = true;
        private boolean abbreviationExpansionEnabled = true;
        private String defaultLanguage = DEFAULT_LANGUAGE;
        private long normalizationCacheSize = DEFAULT_NORMALIZATION_CACHE_SIZE;

        private Builder() {
            for (ScoringScenario scenario : ScoringScenario.values()) {
                scenarioWeights.put(scenario, ScoringWeights.defaultsFor(scenario));
            }
        }

        public Builder scoringWeights(ScoringScenario scenario, ScoringWeights weights) {
            scenarioWeights.put(Objects.requireNonNull(scenario, "scenario"),
                    Objects.requireNonNull(weights, "weights"));
            return this;
        }

        public Builder validationThresholds(ValidationThresholds validationThresholds) {
            this.validationThresholds = Objects.requireNonNull(validationThresholds, "validationThresholds");
            return this;
        }

        public Builder lccnScoreBoost(double lccnScoreBoost) {
            if (lccnScoreBoost < 0 || lccnScoreBoost > 100) {
                throw new ConfigurationException("lccnScoreBoost must be between 0 and 100");
            }
            this.lccnScoreBoost = lccnScoreBoost;
            return this;
        }

        public Builder genericTitlePenalty(double genericTitlePenalty) {
            validateFactor(genericTitlePenalty, "genericTitlePenalty");
            this.genericTitlePenalty = genericTitlePenalty;
            return this;
        }

        public Builder redistributionTitleFloor(double redistributionTitleFloor) {
            validateScore(redistributionTitleFloor, "redistributionTitleFloor");
            this.redistributionTitleFloor = redistributionTitleFloor;
            return this;
        }

        public Builder authorNoiseFloor(double authorNoiseFloor) {
            validateScore(authorNoiseFloor, "authorNoiseFloor");
            this.authorNoiseFloor = authorNoiseFloor;
            return this;
        }

        public Builder lccnMatchingEnabled(boolean lccnMatchingEnabled) {
            this.lccnMatchingEnabled = lccnMatchingEnabled;
            return this;
        }

        public Builder genericTitleDetectionEnabled(boolean genericTitleDetectionEnabled) {
            this.genericTitleDetectionEnabled = genericTitleDetectionEnabled;
            return this;
        }

        public Builder genericFrequencyThreshold(int genericFrequencyThreshold) {
            if (genericFrequencyThreshold <= 0) {
                throw new ConfigurationException("genericFrequencyThreshold must be positive");
            }
            this.genericFrequencyThreshold = genericFrequencyThreshold;
            return this;
        }

        public Builder derivedWorkDetectionEnabled(boolean derivedWorkDetectionEnabled) {
            this.derivedWorkDetectionEnabled = derivedWorkDetectionEnabled;
            return this;
        }

        public Builder derivedWorkConfidenceFloor(double derivedWorkConfidenceFloor) {
            validateFactor(derivedWorkConfidenceFloor, "derivedWorkConfidenceFloor");
            this.derivedWorkConfidenceFloor = derivedWorkConfidenceFloor;
            return this;
        }

        public Builder stemmingEnabled(boolean stemmingEnabled) {
            this.stemmingEnabled = stemmingEnabled;
            return this;
        }

        public Builder abbreviationExpansionEnabled(boolean abbreviationExpansionEnabled) {
            this.abbreviationExpansionEnabled = abbreviationExpansionEnabled;
            return this;
        }

        public Builder defaultLanguage(String defaultLanguage) {
            if (defaultLanguage == null || defaultLanguage.isBlank()) {
                throw new ConfigurationException("defaultLanguage must not be blank");
            }
            this.defaultLanguage = defaultLanguage;
            return this;
        }

        public Builder normalizationCacheSize(long normalizationCacheSize) {
            if (normalizationCacheSize <= 0) {
                throw new ConfigurationException("normalizationCacheSize must be positive");
            }
            this.normalizationCacheSize = normalizationCacheSize;
            return this;
        }

        public MatchingConfig build() {
            return new MatchingConfig(this);
        }

        private void validateFactor(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new ConfigurationException(name + " must be between 0.0 and 1.0");
            }
        }

        private void validateScore(double value, String name) {
            if (value < 0.0 || value > 100.0) {
                throw new ConfigurationException(name + " must be between 0 and 100");
            }
        }
    }
}
