package com.publicdomain.matching.batch;

import java.util.Collection;

/**
 * Run-level totals: summed batch counters plus batch bookkeeping.
 *
 * @param totals             sum of completed batch stats
 * @param totalInputRecords  records read from the input
 * @param totalBatches       batches dispatched
 * @param completedBatches   batches that finished
 * @param failedBatches      batches that threw
 * @param timedOutBatches    batches that exceeded the timeout
 * @param recordsLost        input records in failed or timed-out batches
 */
public record RunStatistics(
        BatchStats totals,
        int totalInputRecords,
        int totalBatches,
        int completedBatches,
        int failedBatches,
        int timedOutBatches,
        int recordsLost
) {
    public static RunStatistics empty() {
        return new RunStatistics(BatchStats.EMPTY, 0, 0, 0, 0, 0, 0);
    }

    public static RunStatistics from(int totalInputRecords, Collection<BatchOutcome> outcomes) {
        BatchStats totals = BatchStats.EMPTY;
        int completed = 0;
        int failed = 0;
        int timedOut = 0;
        int lost = 0;
        for (BatchOutcome outcome : outcomes) {
            totals = totals.plus(outcome.stats());
            switch (outcome.status()) {
                case COMPLETED -> completed++;
                case FAILED -> {
                    failed++;
                    lost += outcome.batchSize();
                }
                case TIMED_OUT -> {
                    timedOut++;
                    lost += outcome.batchSize();
                }
            }
        }
        return new RunStatistics(totals, totalInputRecords, outcomes.size(), completed, failed, timedOut, lost);
    }

    public int recordsProcessed() {
        return totals.marcCount();
    }

    public boolean isComplete() {
        return failedBatches == 0 && timedOutBatches == 0;
    }

    @Override
    public String toString() {
        return "RunStatistics{" +
                "processed=" + recordsProcessed() + "/" + totalInputRecords +
                ", batches=" + completedBatches + "/" + totalBatches +
                ", failed=" + failedBatches +
                ", timedOut=" + timedOutBatches +
                ", registrationMatches=" + totals.registrationMatches() +
                ", renewalMatches=" + totals.renewalMatches() +
                '}';
    }
}
