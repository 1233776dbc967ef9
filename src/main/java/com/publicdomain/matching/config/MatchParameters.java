package com.publicdomain.matching.config;

import java.util.Objects;

/**
 * Per-run matching parameters carried by every batch job: thresholds, mode and record filters.
 */
public class MatchParameters {

    private final MatchThresholds thresholds;
    private final boolean scoreEverything;
    private final Double minimumCombinedScore;
    private final boolean bruteForceMissingYear;
    private final Integer minYear;
    private final Integer maxYear;
    private final boolean usOnly;

    private MatchParameters(Builder builder) {
        this.thresholds = builder.thresholds;
        this.scoreEverything = builder.scoreEverything;
        this.minimumCombinedScore = builder.minimumCombinedScore;
        this.bruteForceMissingYear = builder.bruteForceMissingYear;
        this.minYear = builder.minYear;
        this.maxYear = builder.maxYear;
        this.usOnly = builder.usOnly;
    }

    public MatchThresholds getThresholds() {
        return thresholds;
    }

    public boolean isScoreEverything() {
        return scoreEverything;
    }

    public Double getMinimumCombinedScore() {
        return minimumCombinedScore;
    }

    public boolean isBruteForceMissingYear() {
        return bruteForceMissingYear;
    }

    public Integer getMinYear() {
        return minYear;
    }

    public Integer getMaxYear() {
        return maxYear;
    }

    public boolean isUsOnly() {
        return usOnly;
    }

    /**
     * True when the year falls inside the configured [minYear, maxYear] range.
     * Open bounds always pass.
     */
    public boolean isYearInRange(int year) {
        return (minYear == null || year >= minYear) && (maxYear == null || year <= maxYear);
    }

    public static MatchParameters defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "MatchParameters{" +
                "thresholds=" + thresholds +
                ", scoreEverything=" + scoreEverything +
                ", bruteForceMissingYear=" + bruteForceMissingYear +
                ", minYear=" + minYear +
                ", maxYear=" + maxYear +
                ", usOnly=" + usOnly +
                '}';
    }

    public static class Builder {
        private MatchThresholds thresholds = MatchThresholds.defaults();
        private boolean scoreEverything = false;
        private Double minimumCombinedScore;
        private boolean bruteForceMissingYear = false;
        private Integer minYear;
        private Integer maxYear;
        private boolean usOnly = false;

        public Builder thresholds(MatchThresholds thresholds) {
            this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
            return this;
        }

        public Builder scoreEverything(boolean scoreEverything) {
            this.scoreEverything = scoreEverything;
            return this;
        }

        public Builder minimumCombinedScore(Double minimumCombinedScore) {
            if (minimumCombinedScore != null && (minimumCombinedScore < 0 || minimumCombinedScore > 100)) {
                throw new IllegalArgumentException("minimumCombinedScore must be between 0 and 100");
            }
            this.minimumCombinedScore = minimumCombinedScore;
            return this;
        }

        public Builder bruteForceMissingYear(boolean bruteForceMissingYear) {
            this.bruteForceMissingYear = bruteForceMissingYear;
            return this;
        }

        public Builder minYear(Integer minYear) {
            this.minYear = minYear;
            return this;
        }

        public Builder maxYear(Integer maxYear) {
            this.maxYear = maxYear;
            return this;
        }

        public Builder usOnly(boolean usOnly) {
            this.usOnly = usOnly;
            return this;
        }

        public MatchParameters build() {
            if (minYear != null && maxYear != null && minYear > maxYear) {
                throw new IllegalArgumentException("minYear must be <= maxYear");
            }
            return new MatchParameters(this);
        }
    }
}
