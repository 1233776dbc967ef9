package com.publicdomain.matching.batch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunStatisticsTest {

    private static BatchStats handled(int count, int registrations) {
        BatchStats.Builder builder = BatchStats.builder();
        for (int i = 0; i < count; i++) {
            builder.recordHandled();
        }
        for (int i = 0; i < registrations; i++) {
            builder.registrationMatch();
        }
        return builder.build();
    }

    @Test
    @DisplayName("Should sum completed batches and count lost records")
    void aggregate() {
        List<BatchOutcome> outcomes = List.of(
                BatchOutcome.completed(1, Path.of("r1"), Path.of("s1"), handled(10, 3), 10),
                BatchOutcome.timedOut(2, 10),
                BatchOutcome.completed(3, Path.of("r3"), Path.of("s3"), handled(10, 1), 10),
                BatchOutcome.failed(4, 5));

        RunStatistics statistics = RunStatistics.from(35, outcomes);

        assertEquals(35, statistics.totalInputRecords());
        assertEquals(4, statistics.totalBatches());
        assertEquals(2, statistics.completedBatches());
        assertEquals(1, statistics.timedOutBatches());
        assertEquals(1, statistics.failedBatches());
        assertEquals(20, statistics.recordsProcessed());
        assertEquals(15, statistics.recordsLost());
        assertEquals(4, statistics.totals().registrationMatches());
        assertEquals(statistics.totalInputRecords(), statistics.recordsProcessed() + statistics.recordsLost());
        assertFalse(statistics.isComplete());
    }

    @Test
    @DisplayName("A run without batches is complete and empty")
    void empty() {
        RunStatistics statistics = RunStatistics.from(0, List.of());

        assertEquals(RunStatistics.empty(), statistics);
        assertTrue(statistics.isComplete());
        assertTrue(statistics.toString().contains("processed=0/0"));
    }

    @Test
    @DisplayName("Outcomes without files are not completed")
    void outcomeFactories() {
        BatchOutcome timedOut = BatchOutcome.timedOut(7, 200);

        assertFalse(timedOut.isCompleted());
        assertNull(timedOut.resultFile());
        assertEquals(BatchStats.EMPTY, timedOut.stats());
        assertThrows(NullPointerException.class,
                () -> new BatchOutcome(1, null, null, null, BatchOutcome.Status.FAILED, 0));
    }
}
