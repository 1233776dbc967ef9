package com.publicdomain.matching.metrics;

import com.publicdomain.matching.batch.BatchOutcome;
import com.publicdomain.matching.core.model.SourceType;

import java.time.Duration;

/**
 * No-op implementation of {@link MatchingMetrics}.
 */
public final class NoOpMatchingMetrics implements MatchingMetrics {

    public static final NoOpMatchingMetrics INSTANCE = new NoOpMatchingMetrics();

    private NoOpMatchingMetrics() {
    }

    @Override
    public void recordBatchDuration(BatchOutcome.Status status, Duration duration) {
    }

    @Override
    public void incrementBatchOutcome(BatchOutcome.Status status) {
    }

    @Override
    public void incrementRecordsProcessed(int count) {
    }

    @Override
    public void incrementMatch(SourceType sourceType, boolean lccnMatch) {
    }

    @Override
    public void recordCombinedScore(double score) {
    }
}
