package com.publicdomain.matching.metrics;

import com.publicdomain.matching.batch.BatchOutcome;
import com.publicdomain.matching.core.model.SourceType;

import java.time.Duration;

/**
 * Interface for recording matching pipeline metrics.
 * The default {@link NoOpMatchingMetrics} does nothing, so the engine runs without a
 * metrics registry.
 */
public interface MatchingMetrics {

    void recordBatchDuration(BatchOutcome.Status status, Duration duration);

    void incrementBatchOutcome(BatchOutcome.Status status);

    void incrementRecordsProcessed(int count);

    void incrementMatch(SourceType sourceType, boolean lccnMatch);

    void recordCombinedScore(double score);
}
