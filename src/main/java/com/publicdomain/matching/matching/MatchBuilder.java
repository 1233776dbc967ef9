package com.publicdomain.matching.matching;

import com.publicdomain.matching.core.model.CandidateRecord;
import com.publicdomain.matching.core.model.GenericTitleInfo;
import com.publicdomain.matching.core.model.InputRecord;
import com.publicdomain.matching.core.model.MatchResult;
import com.publicdomain.matching.core.model.MatchType;
import com.publicdomain.matching.core.model.ScoreBreakdown;

/**
 * Builds immutable {@link MatchResult}s, deriving the match type and year difference
 * from the compared pair.
 */
public final class MatchBuilder {

    private MatchBuilder() {
    }

    public static MatchResult lccnMatch(InputRecord input, CandidateRecord candidate,
                                        double title, double author, double publisher,
                                        GenericTitleInfo genericTitleInfo) {
        return new MatchResult(candidate, ScoreBreakdown.forLccnMatch(title, author, publisher),
                true, genericTitleInfo, MatchType.LCCN, yearDifference(input, candidate));
    }

    public static MatchResult similarityMatch(InputRecord input, CandidateRecord candidate,
                                              ScoreBreakdown scores, GenericTitleInfo genericTitleInfo) {
        MatchType type = input.hasYear() ? MatchType.SIMILARITY : MatchType.BRUTE_FORCE_WITHOUT_YEAR;
        return new MatchResult(candidate, scores, false, genericTitleInfo, type,
                yearDifference(input, candidate));
    }

    static Integer yearDifference(InputRecord input, CandidateRecord candidate) {
        if (input.getYear() == null || candidate.getYear() == null) {
            return null;
        }
        return Math.abs(input.getYear() - candidate.getYear());
    }
}
