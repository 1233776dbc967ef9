package com.publicdomain.matching.matching;

/**
 * Judges whether a title is too common to be distinctive (e.g. "Annual report", "Poems").
 * Implementations are read-only during a run and safe to share across threads.
 */
public interface GenericTitleDetector {

    boolean isGeneric(String title, String language);

    /**
     * Why the title was or was not judged generic, e.g. {@code pattern}, {@code frequency},
     * {@code linguistic} or {@code none}.
     */
    String detectionReason(String title, String language);
}
