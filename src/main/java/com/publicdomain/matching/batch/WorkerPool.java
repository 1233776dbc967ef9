package com.publicdomain.matching.batch;

import com.publicdomain.matching.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;

/**
 * Fixed-size pool of worker threads pulling batch jobs from a shared queue.
 *
 * <p>Each worker owns one {@link WorkerContext} for its lifetime. A worker is replaced
 * by a fresh one when it reaches its recycling interval or when a batch it is running
 * exceeds the batch timeout; a timed-out batch is reported as TIMED_OUT and its worker
 * is interrupted and abandoned. Outcomes are delivered in completion order.</p>
 *
 * <p>A worker that cannot initialize is fatal: the next {@link #awaitOutcome()} rethrows
 * its exception.</p>
 */
public class WorkerPool {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private static final long POLL_INTERVAL_MS = 100;
    private static final long SHUTDOWN_WAIT_MS = 5_000;

    private final int size;
    private final WorkerInitializer initializer;
    private final int recycleAfterBatches;
    private final Duration batchTimeout;
    private final BiFunction<WorkerContext, BatchJob, BatchOutcome> runner;

    private final BlockingQueue<BatchJob> jobs = new LinkedBlockingQueue<>();
    private final BlockingQueue<BatchOutcome> outcomes = new LinkedBlockingQueue<>();
    private final Set<Worker> workers = ConcurrentHashMap.newKeySet();
    private final AtomicInteger workerSequence = new AtomicInteger();
    private final AtomicReference<RuntimeException> fatalError = new AtomicReference<>();
    private volatile boolean shutdown;

    /**
     * @param recycleAfterBatches batches per worker before replacement, 0 to never recycle
     * @param runner              runs one batch; expected to turn batch errors into outcomes
     */
    public WorkerPool(int size, WorkerInitializer initializer, int recycleAfterBatches, Duration batchTimeout,
                      BiFunction<WorkerContext, BatchJob, BatchOutcome> runner) {
        if (size < 1) {
            throw new IllegalArgumentException("size must be at least 1");
        }
        this.size = size;
        this.initializer = initializer;
        this.recycleAfterBatches = recycleAfterBatches;
        this.batchTimeout = batchTimeout;
        this.runner = runner;
    }

    public void start() {
        log.info("pool.started workers={} recycleAfter={} batchTimeout={}", size, recycleAfterBatches, batchTimeout);
        for (int i = 0; i < size; i++) {
            spawnWorker();
        }
    }

    public void submit(BatchJob job) {
        if (shutdown) {
            throw new IllegalStateException("Pool is shut down");
        }
        jobs.add(job);
    }

    /**
     * Blocks until the next batch outcome is available.
     *
     * @throws WorkerInitializationException if a worker failed to initialize
     */
    public BatchOutcome awaitOutcome() throws InterruptedException {
        while (true) {
            RuntimeException fatal = fatalError.get();
            if (fatal != null) {
                throw fatal;
            }
            BatchOutcome outcome = outcomes.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            if (outcome != null) {
                return outcome;
            }
        }
    }

    /**
     * Stops all workers. Queued jobs are dropped; running batches are interrupted.
     */
    public void shutdown() {
        shutdown = true;
        jobs.clear();
        List<Worker> current = new ArrayList<>(workers);
        for (Worker worker : current) {
            worker.thread.interrupt();
        }
        long deadline = System.currentTimeMillis() + SHUTDOWN_WAIT_MS;
        for (Worker worker : current) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                break;
            }
            try {
                worker.thread.join(remaining);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("pool.shutdown workersStarted={}", workerSequence.get());
    }

    /**
     * Workers started so far, replacements included.
     */
    public int getWorkersStarted() {
        return workerSequence.get();
    }

    public int getActiveWorkers() {
        return workers.size();
    }

    private void spawnWorker() {
        if (shutdown) {
            return;
        }
        String workerId = "worker-" + workerSequence.incrementAndGet();
        Worker worker = new Worker(workerId);
        worker.thread.setDaemon(true);
        workers.add(worker);
        worker.thread.start();
    }

    private void onTimeout(Worker worker, BatchJob job) {
        log.warn("batch.timedOut batchId={} workerId={} timeout={}", job.batchId(), worker.workerId, batchTimeout);
        worker.retired = true;
        worker.thread.interrupt();
        outcomes.add(BatchOutcome.timedOut(job.batchId(), job.size()));
        spawnWorker();
    }

    private void onFatal(String workerId, RuntimeException e) {
        RuntimeException fatal = e instanceof WorkerInitializationException
                ? e
                : new WorkerInitializationException("Failed to initialize worker " + workerId, e);
        if (fatalError.compareAndSet(null, fatal)) {
            log.error("worker.initFailed workerId={} error={}", workerId, e.toString(), e);
        }
    }

    private final class Worker implements Runnable {
        private final String workerId;
        private final Thread thread;
        private volatile boolean retired;

        private Worker(String workerId) {
            this.workerId = workerId;
            this.thread = new Thread(this, "matcher-" + workerId);
        }

        @Override
        public void run() {
            try (LogContext ignored = LogContext.forWorker(workerId)) {
                WorkerContext context;
                try {
                    context = initializer.initialize(workerId);
                } catch (RuntimeException e) {
                    onFatal(workerId, e);
                    return;
                }
                try {
                    loop(context);
                } finally {
                    context.close();
                }
            } finally {
                workers.remove(this);
            }
        }

        private void loop(WorkerContext context) {
            while (!shutdown && !retired) {
                BatchJob job;
                try {
                    job = jobs.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    return;
                }
                if (job == null) {
                    continue;
                }
                if (!execute(context, job)) {
                    return;
                }
                if (recycleAfterBatches > 0 && context.getBatchesHandled() >= recycleAfterBatches) {
                    log.info("worker.recycled workerId={} batches={}", workerId, context.getBatchesHandled());
                    retired = true;
                    spawnWorker();
                    return;
                }
            }
        }

        /**
         * Runs one job under the batch timeout. Returns false when the job timed out and
         * this worker has been abandoned.
         */
        private boolean execute(WorkerContext context, BatchJob job) {
            CompletableFuture<BatchOutcome> future = new CompletableFuture<>();
            future.orTimeout(batchTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .whenComplete((outcome, error) -> {
                        if (error != null) {
                            onTimeout(this, job);
                        } else {
                            outcomes.add(outcome);
                        }
                    });

            BatchOutcome outcome;
            try {
                outcome = runner.apply(context, job);
            } catch (RuntimeException e) {
                log.warn("batch.failed batchId={} workerId={} error={}", job.batchId(), workerId, e.toString(), e);
                outcome = BatchOutcome.failed(job.batchId(), job.size());
            }
            if (future.complete(outcome)) {
                return true;
            }
            discardLate(outcome);
            return false;
        }

        /**
         * Removes whatever a timed-out batch managed to write after it was reported.
         */
        private void discardLate(BatchOutcome outcome) {
            for (Path file : new Path[]{outcome.resultFile(), outcome.statsFile()}) {
                if (file == null) {
                    continue;
                }
                try {
                    Files.deleteIfExists(file);
                } catch (IOException e) {
                    log.warn("batch.lateFileNotDeleted batchId={} file={} error={}",
                            outcome.batchId(), file, e.toString());
                }
            }
            log.debug("batch.lateOutcomeDiscarded batchId={} workerId={} status={}",
                    outcome.batchId(), workerId, outcome.status());
        }
    }
}
