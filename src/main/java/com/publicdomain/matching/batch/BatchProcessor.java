package com.publicdomain.matching.batch;

import com.publicdomain.matching.config.MatchParameters;
import com.publicdomain.matching.config.MatchingConfig;
import com.publicdomain.matching.core.model.CandidateRecord;
import com.publicdomain.matching.core.model.CountryClassification;
import com.publicdomain.matching.core.model.InputRecord;
import com.publicdomain.matching.core.model.MatchResult;
import com.publicdomain.matching.core.model.MatchedRecord;
import com.publicdomain.matching.logging.LogContext;
import com.publicdomain.matching.matching.CoreMatcher;
import com.publicdomain.matching.matching.GenericTitleDetector;
import com.publicdomain.matching.metrics.MatchingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Runs one batch inside a worker: reads the spooled records, filters and matches each one
 * against registrations and renewals, and writes the result and stats files.
 *
 * <p>Every input record appears in the result file. Skipped records carry no match.
 * A record that throws is counted in {@code recordsWithErrors} and the batch carries on.
 * Anything that breaks the batch as a whole yields a FAILED outcome.</p>
 */
public class BatchProcessor {
    private static final Logger log = LoggerFactory.getLogger(BatchProcessor.class);

    private final BatchSpool spool;
    private final MatchingMetrics metrics;
    private final String runId;

    public BatchProcessor(BatchSpool spool, MatchingMetrics metrics, String runId) {
        this.spool = spool;
        this.metrics = metrics;
        this.runId = runId;
    }

    public BatchOutcome process(WorkerContext context, BatchJob job) {
        try (LogContext ignored = LogContext.forBatch(runId, job.batchId())) {
            try {
                return run(context, job);
            } catch (CancellationException e) {
                log.warn("batch.cancelled batchId={} workerId={}", job.batchId(), context.getWorkerId());
                return BatchOutcome.failed(job.batchId(), job.size());
            } catch (RuntimeException e) {
                log.warn("batch.failed batchId={} workerId={} error={}",
                        job.batchId(), context.getWorkerId(), e.toString(), e);
                return BatchOutcome.failed(job.batchId(), job.size());
            } finally {
                context.batchHandled();
            }
        }
    }

    private BatchOutcome run(WorkerContext context, BatchJob job) {
        long start = System.currentTimeMillis();
        List<InputRecord> records = spool.readBatch(job.handle());
        MatchParameters params = job.parameters();
        BatchStats.Builder stats = BatchStats.builder();
        List<MatchedRecord> results = new ArrayList<>(records.size());

        for (InputRecord record : records) {
            checkInterrupted(job);
            results.add(processRecord(context, record, params, stats));
        }
        stats.processingTimeMillis(System.currentTimeMillis() - start);
        BatchStats batchStats = stats.build();
        // an abandoned worker must not write files for a batch already reported as timed out
        checkInterrupted(job);
        Path resultFile = spool.writeResults(job.batchId(), results);
        checkInterrupted(job);
        Path statsFile = spool.writeStats(job.batchId(), batchStats);
        metrics.incrementRecordsProcessed(batchStats.marcCount());

        log.info("batch.completed batchId={} workerId={} records={} registrationMatches={} renewalMatches={} durationMs={}",
                job.batchId(), context.getWorkerId(), batchStats.marcCount(), batchStats.registrationMatches(),
                batchStats.renewalMatches(), batchStats.processingTimeMillis());
        return BatchOutcome.completed(job.batchId(), resultFile, statsFile, batchStats, records.size());
    }

    private static void checkInterrupted(BatchJob job) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Batch " + job.batchId() + " interrupted");
        }
    }

    private MatchedRecord processRecord(WorkerContext context, InputRecord record, MatchParameters params,
                                        BatchStats.Builder stats) {
        stats.recordHandled();
        CountryClassification country = record.countryClassification();
        switch (country) {
            case US -> stats.usRecord();
            case NON_US -> stats.nonUsRecord();
            case UNKNOWN -> stats.unknownCountryRecord();
        }

        if (!record.hasYear() && !params.isBruteForceMissingYear()) {
            stats.skippedNoYear();
            return MatchedRecord.unmatched(record);
        }
        if (record.hasYear() && !params.isYearInRange(record.getYear())) {
            stats.skippedOutOfRange();
            return MatchedRecord.unmatched(record);
        }
        if (params.isUsOnly() && country != CountryClassification.US) {
            stats.skippedNonUs();
            return MatchedRecord.unmatched(record);
        }

        try {
            int tolerance = params.getThresholds().yearTolerance();
            List<CandidateRecord> registrations = context.getIndexes().registrations().lookup(record, tolerance);
            List<CandidateRecord> renewals = context.getIndexes().renewals().lookup(record, tolerance);
            stats.comparisons(registrations.size() + renewals.size());

            CoreMatcher matcher = context.getMatcher();
            MatchResult registration = match(matcher, record, registrations, params).orElse(null);
            MatchResult renewal = match(matcher, record, renewals, params).orElse(null);
            count(registration, stats);
            count(renewal, stats);

            GenericTitleDetector detector = context.getIndexes().genericTitleDetector();
            MatchingConfig config = matcher.getConfig();
            boolean generic = false;
            String reason = null;
            if (detector != null && config.isGenericTitleDetectionEnabled()) {
                String language = record.languageOr(config.getDefaultLanguage());
                generic = detector.isGeneric(record.getTitle(), language);
                reason = detector.detectionReason(record.getTitle(), language);
            }
            return new MatchedRecord(record, registration, renewal, generic, reason);
        } catch (RuntimeException e) {
            stats.recordWithError();
            log.warn("record.failed sourceId={} error={}", record.getSourceId(), e.toString());
            return MatchedRecord.unmatched(record);
        }
    }

    private static Optional<MatchResult> match(CoreMatcher matcher, InputRecord record,
                                               List<CandidateRecord> candidates, MatchParameters params) {
        if (params.isScoreEverything()) {
            return matcher.findBestMatchIgnoringThresholds(record, candidates,
                    params.getThresholds().yearTolerance(), params.getMinimumCombinedScore());
        }
        return matcher.findBestMatch(record, candidates, params.getThresholds());
    }

    private void count(MatchResult result, BatchStats.Builder stats) {
        if (result == null) {
            return;
        }
        switch (result.sourceType()) {
            case REGISTRATION -> stats.registrationMatch();
            case RENEWAL -> stats.renewalMatch();
        }
        if (result.lccnMatch()) {
            stats.lccnMatch();
        }
        metrics.incrementMatch(result.sourceType(), result.lccnMatch());
        metrics.recordCombinedScore(result.combinedScore());
    }
}
