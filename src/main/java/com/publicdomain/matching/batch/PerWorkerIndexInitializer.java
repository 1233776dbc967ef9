package com.publicdomain.matching.batch;

import com.publicdomain.matching.config.MatchingConfig;
import com.publicdomain.matching.index.IndexBundle;
import com.publicdomain.matching.index.IndexProvider;
import com.publicdomain.matching.matching.CoreMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Loads a private {@link IndexBundle} for each worker from the index provider.
 */
public class PerWorkerIndexInitializer implements WorkerInitializer {
    private static final Logger log = LoggerFactory.getLogger(PerWorkerIndexInitializer.class);

    private final IndexProvider indexProvider;
    private final MatchingConfig config;

    public PerWorkerIndexInitializer(IndexProvider indexProvider, MatchingConfig config) {
        this.indexProvider = Objects.requireNonNull(indexProvider, "indexProvider is required");
        this.config = Objects.requireNonNull(config, "config is required");
    }

    @Override
    public WorkerContext initialize(String workerId) {
        long start = System.currentTimeMillis();
        IndexBundle indexes;
        try {
            indexes = indexProvider.load();
        } catch (RuntimeException e) {
            throw new WorkerInitializationException("Worker " + workerId + " could not load indexes", e);
        }
        if (indexes == null) {
            throw new WorkerInitializationException("Index provider returned no indexes for worker " + workerId);
        }
        log.info("worker.indexesLoaded workerId={} registrations={} renewals={} durationMs={}",
                workerId, indexes.registrations().size(), indexes.renewals().size(),
                System.currentTimeMillis() - start);
        return new WorkerContext(workerId, indexes, new CoreMatcher(config, indexes.genericTitleDetector()));
    }
}
