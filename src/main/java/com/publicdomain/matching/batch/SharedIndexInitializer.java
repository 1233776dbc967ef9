package com.publicdomain.matching.batch;

import com.publicdomain.matching.config.MatchingConfig;
import com.publicdomain.matching.index.IndexBundle;
import com.publicdomain.matching.matching.CoreMatcher;

import java.util.Objects;

/**
 * Hands every worker the same pre-loaded {@link IndexBundle}. Each worker still gets its
 * own matcher.
 */
public class SharedIndexInitializer implements WorkerInitializer {

    private final IndexBundle indexes;
    private final MatchingConfig config;

    public SharedIndexInitializer(IndexBundle indexes, MatchingConfig config) {
        this.indexes = Objects.requireNonNull(indexes, "indexes is required");
        this.config = Objects.requireNonNull(config, "config is required");
    }

    @Override
    public WorkerContext initialize(String workerId) {
        try {
            return new WorkerContext(workerId, indexes, new CoreMatcher(config, indexes.genericTitleDetector()));
        } catch (RuntimeException e) {
            throw new WorkerInitializationException("Failed to initialize worker " + workerId, e);
        }
    }
}
