package com.publicdomain.matching.core.model;

import java.util.Objects;

/**
 * The best candidate found for one input record, with the scores that selected it.
 *
 * @param candidate        the matched registration or renewal
 * @param scores           field and combined scores
 * @param lccnMatch        whether the match came from the LCCN fast path
 * @param genericTitleInfo generic-title detection for the pair, or {@code null} when detection was off
 * @param matchType        how the match was obtained
 * @param yearDifference   absolute year difference, or {@code null} when either year is missing
 */
public record MatchResult(
        CandidateRecord candidate,
        ScoreBreakdown scores,
        boolean lccnMatch,
        GenericTitleInfo genericTitleInfo,
        MatchType matchType,
        Integer yearDifference
) {
    public MatchResult {
        Objects.requireNonNull(candidate, "candidate is required");
        Objects.requireNonNull(scores, "scores is required");
        Objects.requireNonNull(matchType, "matchType is required");
        if (lccnMatch && matchType != MatchType.LCCN) {
            throw new IllegalArgumentException("LCCN matches must carry match type LCCN");
        }
    }

    public double combinedScore() {
        return scores.combined();
    }

    public SourceType sourceType() {
        return candidate.getSourceType();
    }
}
