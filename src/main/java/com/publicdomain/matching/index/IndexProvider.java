package com.publicdomain.matching.index;

/**
 * Source of ready-built indexes, typically backed by a persistent cache.
 */
@FunctionalInterface
public interface IndexProvider {

    /**
     * @throws IndexLoadException if the indexes cannot be loaded
     */
    IndexBundle load();
}
