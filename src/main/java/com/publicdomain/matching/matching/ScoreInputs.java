package com.publicdomain.matching.matching;

/**
 * Field scores and context for one combination.
 *
 * @param title            title score
 * @param author           author score
 * @param publisher        publisher score
 * @param authorPresent    whether author data existed to compare on both sides
 * @param publisherPresent whether publisher data existed to compare on both sides
 * @param genericTitle     whether either title was judged generic
 * @param lccnMatch        whether the pair shares an LCCN
 * @param inputDerived     derived-work detection for the input title, or {@code null}
 * @param candidateDerived derived-work detection for the candidate title, or {@code null}
 */
public record ScoreInputs(
        double title,
        double author,
        double publisher,
        boolean authorPresent,
        boolean publisherPresent,
        boolean genericTitle,
        boolean lccnMatch,
        DerivedWorkInfo inputDerived,
        DerivedWorkInfo candidateDerived
) {
    /**
     * Inputs where a zero author or publisher score means the field was absent.
     */
    public static ScoreInputs of(double title, double author, double publisher,
                                 boolean genericTitle, boolean lccnMatch) {
        return new ScoreInputs(title, author, publisher, author > 0, publisher > 0,
                genericTitle, lccnMatch, null, null);
    }

    public ScoreInputs withDerivedWorks(DerivedWorkInfo input, DerivedWorkInfo candidate) {
        return new ScoreInputs(title, author, publisher, authorPresent, publisherPresent,
                genericTitle, lccnMatch, input, candidate);
    }
}
