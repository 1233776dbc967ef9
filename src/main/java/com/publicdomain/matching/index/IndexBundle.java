package com.publicdomain.matching.index;

import com.publicdomain.matching.matching.GenericTitleDetector;

import java.util.Objects;

/**
 * Everything a worker needs to match records: the registration and renewal indexes and
 * the generic-title detector built from the same corpus. Read-only once loaded.
 */
public record IndexBundle(
        CandidateIndex registrations,
        CandidateIndex renewals,
        GenericTitleDetector genericTitleDetector
) {
    public IndexBundle {
        Objects.requireNonNull(registrations, "registrations index is required");
        Objects.requireNonNull(renewals, "renewals index is required");
    }
}
