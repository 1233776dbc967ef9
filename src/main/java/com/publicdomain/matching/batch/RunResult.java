package com.publicdomain.matching.batch;

import com.publicdomain.matching.core.model.MatchedRecord;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a run. Per-record results stay on disk until a caller asks for them,
 * one batch at a time.
 */
public class RunResult {

    private final String runId;
    private final RunStatistics statistics;
    private final List<BatchOutcome> outcomes;
    private final BatchSpool spool;

    public RunResult(String runId, RunStatistics statistics, List<BatchOutcome> outcomes, BatchSpool spool) {
        this.runId = runId;
        this.statistics = statistics;
        this.outcomes = List.copyOf(outcomes);
        this.spool = spool;
    }

    public String getRunId() {
        return runId;
    }

    public RunStatistics getStatistics() {
        return statistics;
    }

    /**
     * Batch outcomes in batch-id order.
     */
    public List<BatchOutcome> getOutcomes() {
        return outcomes;
    }

    public Path getRunDirectory() {
        return spool == null ? null : spool.getRunDirectory();
    }

    /**
     * Loads the matched records of one batch. Batches that did not complete have none.
     */
    public List<MatchedRecord> readResults(BatchOutcome outcome) {
        if (!outcome.isCompleted() || outcome.resultFile() == null) {
            return List.of();
        }
        return spool.readResults(outcome.resultFile());
    }

    /**
     * Deletes every result and stats file of the run.
     */
    public void discard() {
        if (spool != null) {
            spool.discardResults(outcomes);
        }
    }

    @Override
    public String toString() {
        return "RunResult{runId=" + runId + ", " + statistics + '}';
    }
}
