package com.publicdomain.matching.core.model;

import java.util.Objects;

/**
 * An input record annotated with its match outcome. This is the per-record payload
 * of a batch result file.
 *
 * @param record                the input record
 * @param registrationMatch     best registration match, or {@code null}
 * @param renewalMatch          best renewal match, or {@code null}
 * @param genericTitle          whether the input title was judged generic
 * @param genericDetectionReason detector reason for the input title
 */
public record MatchedRecord(
        InputRecord record,
        MatchResult registrationMatch,
        MatchResult renewalMatch,
        boolean genericTitle,
        String genericDetectionReason
) {
    public MatchedRecord {
        Objects.requireNonNull(record, "record is required");
    }

    public static MatchedRecord unmatched(InputRecord record) {
        return new MatchedRecord(record, null, null, false, null);
    }

    public boolean hasRegistrationMatch() {
        return registrationMatch != null;
    }

    public boolean hasRenewalMatch() {
        return renewalMatch != null;
    }

    public boolean hasAnyMatch() {
        return registrationMatch != null || renewalMatch != null;
    }
}
