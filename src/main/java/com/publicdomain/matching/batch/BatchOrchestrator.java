package com.publicdomain.matching.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.publicdomain.matching.config.MatchParameters;
import com.publicdomain.matching.config.MatchingConfig;
import com.publicdomain.matching.core.model.InputRecord;
import com.publicdomain.matching.index.IndexBundle;
import com.publicdomain.matching.index.IndexLoadException;
import com.publicdomain.matching.index.IndexProvider;
import com.publicdomain.matching.logging.LogContext;
import com.publicdomain.matching.metrics.MatchingMetrics;
import com.publicdomain.matching.metrics.NoOpMatchingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Drives a matching run: partition the input into spooled batches, dispatch them to
 * workers, collect outcomes, aggregate statistics and clean up.
 *
 * <p>Small runs (a single batch, or a single worker) are processed inline on the calling
 * thread. Larger runs use a {@link WorkerPool}. A batch that fails or times out is
 * recorded and the run carries on; a worker or index that cannot be initialized aborts
 * the run.</p>
 *
 * <p>Interrupting the calling thread cancels the run: pending batch files are deleted,
 * workers are stopped, finished result files are left in place and
 * {@link InterruptedException} is rethrown.</p>
 */
public class BatchOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final IndexProvider indexProvider;
    private final MatchingConfig config;
    private final OrchestratorOptions options;
    private final MatchingMetrics metrics;
    private final ObjectMapper objectMapper;

    public BatchOrchestrator(IndexProvider indexProvider, MatchingConfig config, OrchestratorOptions options) {
        this(indexProvider, config, options, NoOpMatchingMetrics.INSTANCE, new ObjectMapper());
    }

    public BatchOrchestrator(IndexProvider indexProvider, MatchingConfig config, OrchestratorOptions options,
                             MatchingMetrics metrics, ObjectMapper objectMapper) {
        this.indexProvider = Objects.requireNonNull(indexProvider, "indexProvider is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.options = Objects.requireNonNull(options, "options is required");
        this.metrics = metrics != null ? metrics : NoOpMatchingMetrics.INSTANCE;
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
    }

    /**
     * Matches every record and returns run statistics plus references to the result files.
     *
     * @throws InterruptedException          if the calling thread is interrupted
     * @throws IndexLoadException            if shared indexes cannot be loaded
     * @throws WorkerInitializationException if a worker cannot be initialized
     */
    public RunResult run(Iterable<InputRecord> records, MatchParameters parameters) throws InterruptedException {
        Objects.requireNonNull(records, "records is required");
        Objects.requireNonNull(parameters, "parameters is required");
        if (Thread.interrupted()) {
            throw new InterruptedException("Interrupted before the run started");
        }
        String runId = LogContext.generateRunId();

        try (LogContext ignored = LogContext.forRun(runId)) {
            long start = System.currentTimeMillis();
            BatchSpool spool = new BatchSpool(options.getSpoolDirectory().resolve(runId), objectMapper);
            try {
                List<BatchJob> jobs = new ArrayList<>();
                int totalRecords = partition(records, parameters, spool, jobs);
                log.info("run.partitioned runId={} records={} batches={} batchSize={}",
                        runId, totalRecords, jobs.size(), options.getBatchSize());

                List<BatchOutcome> outcomes = jobs.isEmpty()
                        ? List.of()
                        : dispatch(jobs, runId, spool);

                List<BatchOutcome> sorted = new ArrayList<>(outcomes);
                sorted.sort(Comparator.comparingInt(BatchOutcome::batchId));
                RunStatistics statistics = RunStatistics.from(totalRecords, sorted);
                log.info("run.completed runId={} processed={} total={} failedBatches={} timedOutBatches={} durationMs={}",
                        runId, statistics.recordsProcessed(), totalRecords, statistics.failedBatches(),
                        statistics.timedOutBatches(), System.currentTimeMillis() - start);
                return new RunResult(runId, statistics, sorted, spool);
            } catch (InterruptedException e) {
                log.warn("run.cancelled runId={}", runId);
                Thread.currentThread().interrupt();
                throw e;
            } finally {
                spool.deleteStaging();
            }
        }
    }

    private int partition(Iterable<InputRecord> records, MatchParameters parameters, BatchSpool spool,
                          List<BatchJob> jobs) throws InterruptedException {
        int batchSize = options.getBatchSize();
        List<InputRecord> buffer = new ArrayList<>(batchSize);
        int total = 0;
        for (InputRecord record : records) {
            buffer.add(record);
            total++;
            if (buffer.size() == batchSize) {
                jobs.add(spoolBatch(jobs.size() + 1, buffer, parameters, spool));
                buffer = new ArrayList<>(batchSize);
                if (Thread.interrupted()) {
                    throw new InterruptedException("Interrupted while partitioning input");
                }
            }
        }
        if (!buffer.isEmpty()) {
            jobs.add(spoolBatch(jobs.size() + 1, buffer, parameters, spool));
        }
        return total;
    }

    private BatchJob spoolBatch(int batchId, List<InputRecord> records, MatchParameters parameters, BatchSpool spool)
            throws InterruptedException {
        BatchHandle handle;
        try {
            handle = spool.writeBatch(batchId, records);
        } catch (BatchSpoolException e) {
            // file channels fail with ClosedByInterruptException when the caller is interrupted mid-write
            if (Thread.interrupted()) {
                InterruptedException interrupted = new InterruptedException("Interrupted while spooling batch " + batchId);
                interrupted.initCause(e);
                throw interrupted;
            }
            throw e;
        }
        return new BatchJob(batchId, handle, parameters, spool.getResultsDirectory());
    }

    private List<BatchOutcome> dispatch(List<BatchJob> jobs, String runId, BatchSpool spool)
            throws InterruptedException {
        WorkerInitializer initializer = createInitializer();
        BatchProcessor processor = new BatchProcessor(spool, metrics, runId);

        if (jobs.size() == 1 || options.getWorkers() == 1) {
            return runInline(jobs, initializer, processor);
        }

        int workers = Math.min(options.getWorkers(), jobs.size());
        int recycleAfter = WorkerRecyclingPolicy.withOverride(options.getRecycleAfterBatches())
                .batchesBeforeRecycle(jobs.size(), workers);
        WorkerPool pool = new WorkerPool(workers, initializer, recycleAfter, options.getBatchTimeout(),
                processor::process);
        pool.start();
        try {
            jobs.forEach(pool::submit);
            List<BatchOutcome> outcomes = new ArrayList<>(jobs.size());
            while (outcomes.size() < jobs.size()) {
                BatchOutcome outcome = pool.awaitOutcome();
                record(outcome);
                outcomes.add(outcome);
            }
            return outcomes;
        } finally {
            pool.shutdown();
        }
    }

    private List<BatchOutcome> runInline(List<BatchJob> jobs, WorkerInitializer initializer,
                                         BatchProcessor processor) throws InterruptedException {
        log.info("run.inline batches={}", jobs.size());
        List<BatchOutcome> outcomes = new ArrayList<>(jobs.size());
        try (WorkerContext context = initializer.initialize("inline")) {
            for (BatchJob job : jobs) {
                if (Thread.interrupted()) {
                    throw new InterruptedException("Interrupted before batch " + job.batchId());
                }
                BatchOutcome outcome = processor.process(context, job);
                record(outcome);
                outcomes.add(outcome);
            }
        }
        return outcomes;
    }

    private WorkerInitializer createInitializer() {
        return switch (options.getInitMode()) {
            case SHARED -> new SharedIndexInitializer(loadSharedIndexes(), config);
            case PER_WORKER -> new PerWorkerIndexInitializer(indexProvider, config);
        };
    }

    private IndexBundle loadSharedIndexes() {
        IndexBundle bundle = indexProvider.load();
        if (bundle == null) {
            throw new IndexLoadException("Index provider returned no indexes");
        }
        return bundle;
    }

    private void record(BatchOutcome outcome) {
        metrics.incrementBatchOutcome(outcome.status());
        Duration duration = outcome.status() == BatchOutcome.Status.TIMED_OUT
                ? options.getBatchTimeout()
                : Duration.ofMillis(outcome.stats().processingTimeMillis());
        metrics.recordBatchDuration(outcome.status(), duration);
        if (!outcome.isCompleted()) {
            log.warn("batch.lost batchId={} status={} records={}",
                    outcome.batchId(), outcome.status(), outcome.batchSize());
        }
    }
}
