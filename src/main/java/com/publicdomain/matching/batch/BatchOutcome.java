package com.publicdomain.matching.batch;

import java.nio.file.Path;
import java.util.Objects;

/**
 * What came back from one batch. Timed-out and failed batches carry empty stats and
 * no files.
 *
 * @param batchId    batch number
 * @param resultFile per-record results, or {@code null} unless completed
 * @param statsFile  serialized stats, or {@code null} unless completed
 * @param stats      batch counters
 * @param status     final status
 * @param batchSize  number of input records in the batch
 */
public record BatchOutcome(
        int batchId,
        Path resultFile,
        Path statsFile,
        BatchStats stats,
        Status status,
        int batchSize
) {
    public enum Status {
        COMPLETED,
        TIMED_OUT,
        FAILED
    }

    public BatchOutcome {
        Objects.requireNonNull(stats, "stats is required");
        Objects.requireNonNull(status, "status is required");
    }

    public static BatchOutcome completed(int batchId, Path resultFile, Path statsFile,
                                         BatchStats stats, int batchSize) {
        return new BatchOutcome(batchId, resultFile, statsFile, stats, Status.COMPLETED, batchSize);
    }

    public static BatchOutcome timedOut(int batchId, int batchSize) {
        return new BatchOutcome(batchId, null, null, BatchStats.EMPTY, Status.TIMED_OUT, batchSize);
    }

    public static BatchOutcome failed(int batchId, int batchSize) {
        return new BatchOutcome(batchId, null, null, BatchStats.EMPTY, Status.FAILED, batchSize);
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
}
