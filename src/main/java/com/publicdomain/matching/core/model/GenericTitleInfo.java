package com.publicdomain.matching.core.model;

/**
 * Records which side of a comparison carried a generic title, and why the detector flagged it.
 * Reasons are {@code null} for a side that was not generic.
 */
public record GenericTitleInfo(
        boolean inputTitleGeneric,
        String inputDetectionReason,
        boolean candidateTitleGeneric,
        String candidateDetectionReason
) {
    public boolean hasGenericTitle() {
        return inputTitleGeneric || candidateTitleGeneric;
    }

    /**
     * The reason to report for the pair: the input side wins when both are generic.
     */
    public String primaryReason() {
        if (inputTitleGeneric) {
            return inputDetectionReason;
        }
        return candidateTitleGeneric ? candidateDetectionReason : null;
    }
}
