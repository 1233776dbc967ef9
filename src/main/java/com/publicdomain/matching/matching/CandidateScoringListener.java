package com.publicdomain.matching.matching;

import com.publicdomain.matching.core.model.CandidateRecord;
import com.publicdomain.matching.core.model.InputRecord;
import com.publicdomain.matching.core.model.ScoreBreakdown;

/**
 * Observer notified for every candidate the matcher scores, whether or not it was kept.
 * Candidates removed by the year filter are never scored and never reported.
 */
@FunctionalInterface
public interface CandidateScoringListener {

    CandidateScoringListener NO_OP = (input, candidate, scores, accepted) -> { };

    /**
     * @param scores   field scores computed so far; fields skipped after a threshold cut are 0
     * @param accepted whether the candidate passed every threshold
     */
    void candidateScored(InputRecord input, CandidateRecord candidate, ScoreBreakdown scores, boolean accepted);
}
