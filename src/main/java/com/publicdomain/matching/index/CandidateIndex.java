package com.publicdomain.matching.index;

import com.publicdomain.matching.core.model.CandidateRecord;
import com.publicdomain.matching.core.model.InputRecord;

import java.util.List;

/**
 * Read-only lookup of registration or renewal candidates for an input record.
 * Implementations must be safe for concurrent reads and return candidates in a
 * deterministic order; the matcher breaks ties by that order.
 */
public interface CandidateIndex {

    /**
     * Candidates plausibly matching {@code record}. When both the record and a candidate
     * carry a year, the candidate is returned only if the years differ by at most
     * {@code yearTolerance}.
     */
    List<CandidateRecord> lookup(InputRecord record, int yearTolerance);

    int size();
}
