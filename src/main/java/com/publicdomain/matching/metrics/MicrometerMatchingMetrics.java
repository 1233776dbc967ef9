package com.publicdomain.matching.metrics;

import com.publicdomain.matching.batch.BatchOutcome;
import com.publicdomain.matching.core.model.SourceType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MatchingMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code matching.batch.duration}: Timer (tag: status)</li>
 *   <li>{@code matching.batch.outcome}: Counter (tag: status)</li>
 *   <li>{@code matching.records.processed}: Counter</li>
 *   <li>{@code matching.matches}: Counter (tags: source, lccn)</li>
 *   <li>{@code matching.combined.score}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMatchingMetrics implements MatchingMetrics {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter recordsProcessedCounter;
    private final DistributionSummary combinedScoreSummary;

    public MicrometerMatchingMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.recordsProcessedCounter = Counter.builder("matching.records.processed")
                .description("Number of input records handled by batch workers")
                .register(registry);
        this.combinedScoreSummary = DistributionSummary.builder("matching.combined.score")
                .description("Distribution of combined scores of accepted matches")
                .register(registry);
    }

    @Override
    public void recordBatchDuration(BatchOutcome.Status status, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(status.name(), k ->
                Timer.builder("matching.batch.duration")
                        .description("Wall-clock duration of batch processing")
                        .tag("status", status.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementBatchOutcome(BatchOutcome.Status status) {
        String key = "outcome:" + status.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("matching.batch.outcome")
                        .description("Number of batches by final status")
                        .tag("status", status.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementRecordsProcessed(int count) {
        recordsProcessedCounter.increment(count);
    }

    @Override
    public void incrementMatch(SourceType sourceType, boolean lccnMatch) {
        String key = "match:" + sourceType.name() + ":" + lccnMatch;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("matching.matches")
                        .description("Number of accepted matches")
                        .tag("source", sourceType.name())
                        .tag("lccn", Boolean.toString(lccnMatch))
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordCombinedScore(double score) {
        combinedScoreSummary.record(score);
    }
}
