package com.publicdomain.matching.config;

/**
 * Per-field thresholds for threshold-mode matching.
 * A {@code null} publisher threshold disables the publisher cut; a {@code null}
 * early-exit publisher threshold ignores publisher for early exit.
 */
public record MatchThresholds(
        double title,
        double author,
        Double publisher,
        int yearTolerance,
        double earlyExitTitle,
        double earlyExitAuthor,
        Double earlyExitPublisher
) {
    public MatchThresholds {
        requireScore(title, "title");
        requireScore(author, "author");
        if (publisher != null) {
            requireScore(publisher, "publisher");
        }
        requireScore(earlyExitTitle, "earlyExitTitle");
        requireScore(earlyExitAuthor, "earlyExitAuthor");
        if (earlyExitPublisher != null) {
            requireScore(earlyExitPublisher, "earlyExitPublisher");
        }
        if (yearTolerance < 0) {
            throw new IllegalArgumentException("yearTolerance must be non-negative");
        }
    }

    public static MatchThresholds defaults() {
        return new MatchThresholds(40, 30, 60.0, 1, 95, 90, 85.0);
    }

    public MatchThresholds withYearTolerance(int tolerance) {
        return new MatchThresholds(title, author, publisher, tolerance,
                earlyExitTitle, earlyExitAuthor, earlyExitPublisher);
    }

    private static void requireScore(double value, String name) {
        if (value < 0.0 || value > 100.0) {
            throw new IllegalArgumentException(name + " threshold must be between 0 and 100");
        }
    }
}
