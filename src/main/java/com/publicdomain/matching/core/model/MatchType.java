package com.publicdomain.matching.core.model;

/**
 * How a match was established.
 */
public enum MatchType {
    /** Normalized LCCNs are equal on both sides. */
    LCCN,
    /** Fuzzy field similarity within the year tolerance. */
    SIMILARITY,
    /** Fuzzy field similarity for an input record without a year (lower confidence). */
    BRUTE_FORCE_WITHOUT_YEAR
}
