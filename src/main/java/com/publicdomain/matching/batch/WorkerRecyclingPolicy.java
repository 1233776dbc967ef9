package com.publicdomain.matching.batch;

/**
 * Decides after how many batches a worker is retired and replaced, which bounds the
 * memory a long-lived worker can accumulate.
 */
public final class WorkerRecyclingPolicy {

    static final int MIN_BATCHES_PER_WORKER = 20;
    private static final int RECYCLES_PER_WORKER = 3;

    private final Integer override;

    private WorkerRecyclingPolicy(Integer override) {
        this.override = override;
    }

    public static WorkerRecyclingPolicy automatic() {
        return new WorkerRecyclingPolicy(null);
    }

    public static WorkerRecyclingPolicy withOverride(Integer batchesBeforeRecycle) {
        if (batchesBeforeRecycle != null && batchesBeforeRecycle < 0) {
            throw new IllegalArgumentException("batchesBeforeRecycle must be non-negative");
        }
        return new WorkerRecyclingPolicy(batchesBeforeRecycle);
    }

    /**
     * Batches a worker runs before it is recycled, or 0 to never recycle.
     * Without an override: disabled when each worker would see fewer than 20 batches,
     * otherwise a third of each worker's share, rounded up.
     */
    public int batchesBeforeRecycle(int totalBatches, int workers) {
        if (override != null) {
            return override;
        }
        int perWorker = totalBatches / Math.max(1, workers);
        if (perWorker < MIN_BATCHES_PER_WORKER) {
            return 0;
        }
        return (perWorker + RECYCLES_PER_WORKER - 1) / RECYCLES_PER_WORKER;
    }
}
