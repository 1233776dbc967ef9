package com.publicdomain.matching.core.model;

/**
 * Field-level similarity scores and the combined score for one candidate comparison.
 * All values are on a 0-100 scale.
 */
public record ScoreBreakdown(
        double title,
        double author,
        double publisher,
        double combined
) {
    public ScoreBreakdown {
        requireInRange(title, "title");
        requireInRange(author, "author");
        requireInRange(publisher, "publisher");
        requireInRange(combined, "combined");
    }

    /**
     * Breakdown for an authoritative LCCN match: field scores are kept for diagnostics,
     * the combined score is pinned to 100.
     */
    public static ScoreBreakdown forLccnMatch(double title, double author, double publisher) {
        return new ScoreBreakdown(title, author, publisher, 100.0);
    }

    private static void requireInRange(double value, String name) {
        if (Double.isNaN(value) || value < 0.0 || value > 100.0) {
            throw new IllegalArgumentException(name + " score must be between 0 and 100, got " + value);
        }
    }

    @Override
    public String toString() {
        return String.format("ScoreBreakdown{title=%.2f, author=%.2f, publisher=%.2f, combined=%.2f}",
                title, author, publisher, combined);
    }
}
