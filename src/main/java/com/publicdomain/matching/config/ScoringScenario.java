package com.publicdomain.matching.config;

/**
 * The four weighting scenarios: generic or distinctive title, with or without a comparable publisher.
 */
public enum ScoringScenario {
    NORMAL_WITH_PUBLISHER,
    GENERIC_WITH_PUBLISHER,
    NORMAL_NO_PUBLISHER,
    GENERIC_NO_PUBLISHER;

    public static ScoringScenario of(boolean genericTitle, boolean publisherPresent) {
        if (genericTitle) {
            return publisherPresent ? GENERIC_WITH_PUBLISHER : GENERIC_NO_PUBLISHER;
        }
        return publisherPresent ? NORMAL_WITH_PUBLISHER : NORMAL_NO_PUBLISHER;
    }
}
