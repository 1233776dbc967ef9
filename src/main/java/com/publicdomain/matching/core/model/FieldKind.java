package com.publicdomain.matching.core.model;

/**
 * Which bibliographic field a string belongs to. Drives field-specific normalization
 * and the choice of fuzzy comparison.
 */
public enum FieldKind {
    TITLE,
    AUTHOR,
    PUBLISHER,
    /** Full renewal entry text, compared by partial ratio against a processed publisher. */
    FULL_TEXT
}
