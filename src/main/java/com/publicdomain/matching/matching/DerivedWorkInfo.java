package com.publicdomain.matching.matching;

/**
 * Result of derived-work detection for one title.
 *
 * @param derived    whether a derived-work pattern matched
 * @param kind       name of the matched pattern (e.g. {@code index}, {@code supplement_eng})
 * @param confidence detection confidence between 0 and 1
 */
public record DerivedWorkInfo(boolean derived, String kind, double confidence) {

    public static final DerivedWorkInfo NONE = new DerivedWorkInfo(false, "", 0.0);

    public DerivedWorkInfo {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0 and 1");
        }
        kind = kind == null ? "" : kind;
    }
}
