package com.publicdomain.matching.index;

import java.util.Set;

/**
 * Strategy interface for generating blocking keys from a record's identifying fields.
 * Blocking keys narrow the candidate set for fuzzy matching, avoiding a full scan of
 * the registration and renewal corpora.
 *
 * <p>Records that share at least one blocking key are potential candidates for each other.
 * Keys should be coarse enough to keep likely matches and fine enough to drop obvious
 * non-matches.</p>
 */
public interface BlockingKeyStrategy {

    /**
     * Generates blocking keys for one record.
     *
     * @param title          raw title, may be blank
     * @param author         raw author (or main author), may be blank
     * @param normalizedLccn normalized LCCN, or {@code null}
     * @return set of blocking keys (never null, may be empty)
     */
    Set<String> generateKeys(String title, String author, String normalizedLccn);
}
