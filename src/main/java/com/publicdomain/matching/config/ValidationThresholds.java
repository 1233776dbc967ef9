package com.publicdomain.matching.config;

/**
 * Bounds for the multi-field false-positive guards applied after weighting.
 *
 * <p>The defaults were tuned against a curated ground-truth set and are expected to be
 * recalibrated rather than treated as fixed.</p>
 *
 * @param authorOnlyAuthorMin       author score above which an author-only match is suspicious
 * @param authorOnlyTitleMax        title score below which the author-only guard applies
 * @param authorOnlyPublisherMax    publisher score below which the author-only guard applies
 * @param authorOnlyFactor          multiplier applied by the author-only guard
 * @param publisherOnlyPublisherMin publisher score above which a publisher-only match is suspicious
 * @param publisherOnlyTitleMax     title score below which the publisher-only guard applies
 * @param publisherOnlyAuthorMax    author score below which the publisher-only guard applies
 * @param publisherOnlyFactor       multiplier applied by the publisher-only guard
 * @param weakTitleMin              lower bound (inclusive) of a weak title score
 * @param weakTitleMax              upper bound (exclusive) of a weak title score
 * @param weakTitleSupportMax       author and publisher scores below which a weak title is unsupported
 * @param weakTitleCap              ceiling for an unsupported weak title match
 */
public record ValidationThresholds(
        double authorOnlyAuthorMin,
        double authorOnlyTitleMax,
        double authorOnlyPublisherMax,
        double authorOnlyFactor,
        double publisherOnlyPublisherMin,
        double publisherOnlyTitleMax,
        double publisherOnlyAuthorMax,
        double publisherOnlyFactor,
        double weakTitleMin,
        double weakTitleMax,
        double weakTitleSupportMax,
        double weakTitleCap
) {
    public ValidationThresholds {
        requireFactor(authorOnlyFactor, "authorOnlyFactor");
        requireFactor(publisherOnlyFactor, "publisherOnlyFactor");
        if (weakTitleMin > weakTitleMax) {
            throw new ConfigurationException("weakTitleMin must be <= weakTitleMax");
        }
        if (weakTitleCap < 0 || weakTitleCap > 100) {
            throw new ConfigurationException("weakTitleCap must be between 0 and 100");
        }
    }

    public static ValidationThresholds defaults() {
        return new ValidationThresholds(
                80, 20, 20, 0.3,
                80, 20, 20, 0.5,
                30, 50, 10, 25);
    }

    private static void requireFactor(double value, String name) {
        if (value < 0.0 || value > 1.0) {
            throw new ConfigurationException(name + " must be between 0.0 and 1.0, got " + value);
        }
    }
}
