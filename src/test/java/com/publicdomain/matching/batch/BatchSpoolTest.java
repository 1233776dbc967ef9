package com.publicdomain.matching.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.publicdomain.matching.core.model.InputRecord;
import com.publicdomain.matching.core.model.MatchedRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchSpoolTest {

    @TempDir
    Path tempDir;

    private BatchSpool spool;
    private List<InputRecord> records;

    @BeforeEach
    void setUp() {
        spool = new BatchSpool(tempDir.resolve("run-1"), new ObjectMapper());
        records = List.of(
                InputRecord.builder().sourceId("m1").title("The Great Gatsby").year(1925).build(),
                InputRecord.builder().sourceId("m2").title("Moby Dick").normalizedLccn("51012345").build());
    }

    @Nested
    @DisplayName("Batch files")
    class BatchFiles {

        @Test
        @DisplayName("Should write a batch and read it back exactly once")
        void readOnce() {
            BatchHandle handle = spool.writeBatch(1, records);

            assertEquals(BatchHandle.State.CREATED, handle.getState());
            assertEquals(2, handle.getSize());
            assertEquals(spool.getBatchesDirectory().resolve("batch_1.json"), handle.getFile());
            assertTrue(Files.exists(handle.getFile()));

            assertEquals(records, spool.readBatch(handle));
            assertEquals(BatchHandle.State.DELETED, handle.getState());
            assertFalse(Files.exists(handle.getFile()));

            assertThrows(IllegalStateException.class, () -> spool.readBatch(handle));
        }

        @Test
        @DisplayName("A missing batch file fails the read and still ends deleted")
        void missingFile() throws Exception {
            BatchHandle handle = spool.writeBatch(2, records);
            Files.delete(handle.getFile());

            assertThrows(BatchSpoolException.class, () -> spool.readBatch(handle));
            assertEquals(BatchHandle.State.DELETED, handle.getState());
        }

        @Test
        @DisplayName("deleteStaging removes pending batch files")
        void deleteStaging() {
            spool.writeBatch(1, records);
            spool.writeBatch(2, records);

            spool.deleteStaging();

            assertFalse(Files.exists(spool.getBatchesDirectory()));
            assertTrue(Files.exists(spool.getResultsDirectory()));
        }
    }

    @Nested
    @DisplayName("Result files")
    class ResultFiles {

        @Test
        @DisplayName("Should round-trip results and stats")
        void roundTrip() {
            List<MatchedRecord> results = records.stream().map(MatchedRecord::unmatched).toList();
            BatchStats stats = BatchStats.builder().recordHandled().recordHandled().skippedNoYear().build();

            Path resultFile = spool.writeResults(3, results);
            Path statsFile = spool.writeStats(3, stats);

            assertEquals(spool.resultFile(3), resultFile);
            assertEquals(spool.statsFile(3), statsFile);
            assertEquals(results, spool.readResults(resultFile));
            assertEquals(stats, spool.readStats(statsFile));
        }

        @Test
        @DisplayName("discardResults removes files and the empty run directory")
        void discard() {
            Path resultFile = spool.writeResults(1, List.of());
            Path statsFile = spool.writeStats(1, BatchStats.EMPTY);
            spool.deleteStaging();

            spool.discardResults(List.of(
                    BatchOutcome.completed(1, resultFile, statsFile, BatchStats.EMPTY, 0),
                    BatchOutcome.failed(2, 10)));

            assertFalse(Files.exists(resultFile));
            assertFalse(Files.exists(spool.getRunDirectory()));
        }

        @Test
        @DisplayName("Reading a missing result file fails")
        void missingResults() {
            assertThrows(BatchSpoolException.class, () -> spool.readResults(spool.resultFile(99)));
            assertThrows(BatchSpoolException.class, () -> spool.readStats(spool.statsFile(99)));
        }
    }
}
