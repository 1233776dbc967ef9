package com.publicdomain.matching.batch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BatchStatsTest {

    private static BatchStats sample(int handled, int registrations, int skipped) {
        BatchStats.Builder builder = BatchStats.builder();
        for (int i = 0; i < handled; i++) {
            builder.recordHandled().usRecord();
        }
        for (int i = 0; i < registrations; i++) {
            builder.registrationMatch();
        }
        for (int i = 0; i < skipped; i++) {
            builder.skippedOutOfRange();
        }
        return builder.comparisons(handled * 10L).processingTimeMillis(handled).build();
    }

    @Test
    @DisplayName("Builder should accumulate every counter")
    void builder() {
        BatchStats stats = BatchStats.builder()
                .recordHandled().recordHandled().recordHandled()
                .registrationMatch().renewalMatch().lccnMatch()
                .comparisons(5).comparisons(7)
                .usRecord().nonUsRecord().unknownCountryRecord()
                .skippedNoYear().skippedOutOfRange().skippedNonUs()
                .recordWithError()
                .processingTimeMillis(42)
                .build();

        assertEquals(new BatchStats(3, 1, 1, 1, 12, 1, 1, 1, 1, 1, 1, 1, 42), stats);
        assertEquals(3, stats.totalSkipped());
    }

    @Test
    @DisplayName("Summation should be associative and commutative")
    void plus() {
        BatchStats a = sample(5, 2, 1);
        BatchStats b = sample(3, 1, 0);
        BatchStats c = sample(7, 4, 2);

        assertEquals(a.plus(b).plus(c), a.plus(b.plus(c)));
        assertEquals(a.plus(b), b.plus(a));
        assertEquals(a, a.plus(BatchStats.EMPTY));
        assertEquals(15, a.plus(b).plus(c).marcCount());
        assertEquals(150, a.plus(b).plus(c).totalComparisons());
    }
}
