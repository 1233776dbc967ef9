package com.publicdomain.matching.config;

/**
 * Title, author and publisher weights for one scoring scenario.
 * Weights must be non-negative and sum to 1.0 within a tolerance of 0.01.
 */
public record ScoringWeights(
        double title,
        double author,
        double publisher
) {
    private static final double SUM_TOLERANCE = 0.01;

    public ScoringWeights {
        if (title < 0 || author < 0 || publisher < 0) {
            throw new ConfigurationException("Weights must be non-negative, got "
                    + title + "/" + author + "/" + publisher);
        }
        double sum = title + author + publisher;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new ConfigurationException("Weights must sum to 1.0, got " + sum);
        }
    }

    public static ScoringWeights defaultsFor(ScoringScenario scenario) {
        return switch (scenario) {
            case NORMAL_WITH_PUBLISHER -> new ScoringWeights(0.6, 0.25, 0.15);
            case GENERIC_WITH_PUBLISHER -> new ScoringWeights(0.3, 0.45, 0.25);
            case NORMAL_NO_PUBLISHER -> new ScoringWeights(0.7, 0.3, 0.0);
            case GENERIC_NO_PUBLISHER -> new ScoringWeights(0.4, 0.6, 0.0);
        };
    }
}
