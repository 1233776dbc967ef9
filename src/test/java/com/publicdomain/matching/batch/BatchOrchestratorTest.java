package com.publicdomain.matching.batch;

import com.publicdomain.matching.config.MatchParameters;
import com.publicdomain.matching.config.MatchingConfig;
import com.publicdomain.matching.core.model.CandidateRecord;
import com.publicdomain.matching.core.model.InputRecord;
import com.publicdomain.matching.core.model.MatchedRecord;
import com.publicdomain.matching.core.model.SourceType;
import com.publicdomain.matching.index.CandidateIndex;
import com.publicdomain.matching.index.InMemoryCandidateIndex;
import com.publicdomain.matching.index.IndexBundle;
import com.publicdomain.matching.index.IndexLoadException;
import com.publicdomain.matching.index.IndexProvider;
import com.publicdomain.matching.matching.DefaultGenericTitleDetector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BatchOrchestratorTest {

    private static final int RECORDS = 23;

    @TempDir
    Path spoolDirectory;

    private List<InputRecord> records;
    private IndexBundle bundle;

    @BeforeEach
    void setUp() {
        records = new ArrayList<>();
        InMemoryCandidateIndex.Builder registrations = InMemoryCandidateIndex.builder();
        InMemoryCandidateIndex.Builder renewals = InMemoryCandidateIndex.builder();
        for (int i = 0; i < RECORDS; i++) {
            // years three apart keep each record to its own candidate under the default tolerance
            int year = 1900 + 3 * i;
            String title = title(i);
            records.add(InputRecord.builder().sourceId("m" + i).title(title).author("Writer, Some")
                    .year(year).countryCode("nyu").build());
            if (i % 2 == 0) {
                registrations.add(CandidateRecord.builder().sourceId("A" + i).sourceType(SourceType.REGISTRATION)
                        .title(title).author("Writer, Some").year(year).build());
            }
            if (i % 3 == 0) {
                renewals.add(CandidateRecord.builder().sourceId("R" + i).sourceType(SourceType.RENEWAL)
                        .title(title).author("Writer, Some").year(year).build());
            }
        }
        bundle = new IndexBundle(registrations.build(), renewals.build(), DefaultGenericTitleDetector.builder().build());
    }

    private static String title(int i) {
        return "quill" + (char) ('a' + i / 26) + (char) ('a' + i % 26);
    }

    private OrchestratorOptions.Builder options() {
        return OrchestratorOptions.builder().spoolDirectory(spoolDirectory);
    }

    private BatchOrchestrator orchestrator(IndexProvider provider, OrchestratorOptions options) {
        return new BatchOrchestrator(provider, MatchingConfig.defaults(), options);
    }

    private static Map<String, String> matches(RunResult result) {
        Map<String, String> matches = new TreeMap<>();
        for (BatchOutcome outcome : result.getOutcomes()) {
            for (MatchedRecord matched : result.readResults(outcome)) {
                String registration = matched.hasRegistrationMatch()
                        ? matched.registrationMatch().candidate().getSourceId() : "-";
                String renewal = matched.hasRenewalMatch()
                        ? matched.renewalMatch().candidate().getSourceId() : "-";
                matches.put(matched.record().getSourceId(), registration + "/" + renewal);
            }
        }
        return matches;
    }

    @Nested
    @DisplayName("Batching")
    class Batching {

        @ParameterizedTest(name = "batchSize={0}, workers={1}")
        @CsvSource({
                "5, 1",
                "5, 3",
                "23, 4",
                "1, 4",
                "7, 2"
        })
        @DisplayName("Results do not depend on batch size or worker count")
        void invariantUnderBatching(int batchSize, int workers) throws Exception {
            RunResult reference = orchestrator(() -> bundle, options().batchSize(RECORDS).workers(1).build())
                    .run(records, MatchParameters.defaults());
            RunResult result = orchestrator(() -> bundle, options().batchSize(batchSize).workers(workers).build())
                    .run(records, MatchParameters.defaults());

            RunStatistics stats = result.getStatistics();
            assertTrue(stats.isComplete());
            assertEquals(RECORDS, stats.totalInputRecords());
            assertEquals(RECORDS, stats.recordsProcessed());
            assertEquals((RECORDS + batchSize - 1) / batchSize, stats.totalBatches());
            assertEquals(12, stats.totals().registrationMatches());
            assertEquals(8, stats.totals().renewalMatches());
            assertEquals(RECORDS, stats.totals().usRecords());
            assertEquals(matches(reference), matches(result));
            assertEquals("A0/R0", matches(result).get("m0"));
            assertEquals("-/-", matches(result).get("m1"));

            List<Integer> ids = result.getOutcomes().stream().map(BatchOutcome::batchId).toList();
            List<Integer> sorted = new ArrayList<>(ids);
            sorted.sort(Integer::compare);
            assertEquals(sorted, ids);
            assertEquals(1, ids.get(0));
        }

        @Test
        @DisplayName("Empty input yields a complete run with no batches")
        void emptyInput() throws Exception {
            RunResult result = orchestrator(() -> bundle, options().build()).run(List.of(), MatchParameters.defaults());

            assertTrue(result.getOutcomes().isEmpty());
            assertEquals(0, result.getStatistics().totalBatches());
            assertTrue(result.getStatistics().isComplete());
        }
    }

    @Nested
    @DisplayName("Spool lifecycle")
    class SpoolLifecycle {

        @Test
        @DisplayName("Staging is removed after a run and results remain until discarded")
        void stagingAndDiscard() throws Exception {
            RunResult result = orchestrator(() -> bundle, options().batchSize(10).workers(2).build())
                    .run(records, MatchParameters.defaults());

            Path runDirectory = result.getRunDirectory();
            assertEquals(spoolDirectory.resolve(result.getRunId()), runDirectory);
            assertFalse(Files.exists(runDirectory.resolve("batches")));
            for (BatchOutcome outcome : result.getOutcomes()) {
                assertTrue(Files.exists(outcome.resultFile()));
                assertTrue(Files.exists(outcome.statsFile()));
            }

            result.discard();

            assertFalse(Files.exists(runDirectory));
        }

        @Test
        @DisplayName("Every run gets its own directory")
        void distinctRuns() throws Exception {
            BatchOrchestrator orchestrator = orchestrator(() -> bundle, options().batchSize(10).build());

            RunResult first = orchestrator.run(records, MatchParameters.defaults());
            RunResult second = orchestrator.run(records, MatchParameters.defaults());

            assertNotEquals(first.getRunId(), second.getRunId());
            assertEquals(matches(first), matches(second));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @Timeout(30)
        @DisplayName("A batch exceeding the timeout is lost and the run carries on")
        void timedOutBatch() throws Exception {
            String slowTitle = title(0);
            CandidateIndex slow = new SlowIndex(bundle.registrations(), slowTitle);
            IndexBundle slowBundle = new IndexBundle(slow, bundle.renewals(), bundle.genericTitleDetector());
            OrchestratorOptions options = options().batchSize(5).workers(2)
                    .batchTimeout(Duration.ofSeconds(2)).build();

            RunResult result = orchestrator(() -> slowBundle, options).run(records, MatchParameters.defaults());

            RunStatistics stats = result.getStatistics();
            assertEquals(5, stats.totalBatches());
            assertEquals(1, stats.timedOutBatches());
            assertEquals(4, stats.completedBatches());
            assertEquals(18, stats.recordsProcessed());
            assertEquals(5, stats.recordsLost());
            assertFalse(stats.isComplete());

            BatchOutcome first = result.getOutcomes().get(0);
            assertEquals(BatchOutcome.Status.TIMED_OUT, first.status());
            assertTrue(result.readResults(first).isEmpty());
        }

        @Test
        @DisplayName("Shared index load failure aborts the run")
        void sharedLoadFailure() {
            IndexProvider broken = () -> {
                throw new IndexLoadException("cache missing");
            };
            BatchOrchestrator orchestrator = orchestrator(broken,
                    options().batchSize(5).workers(3).initMode(WorkerInitMode.SHARED).build());

            assertThrows(IndexLoadException.class, () -> orchestrator.run(records, MatchParameters.defaults()));
        }

        @ParameterizedTest(name = "workers={0}")
        @CsvSource({"1", "3"})
        @DisplayName("Per-worker index load failure aborts the run")
        void perWorkerLoadFailure(int workers) {
            IndexProvider broken = () -> {
                throw new IllegalStateException("cache corrupt");
            };
            BatchOrchestrator orchestrator = orchestrator(broken,
                    options().batchSize(5).workers(workers).initMode(WorkerInitMode.PER_WORKER).build());

            WorkerInitializationException e = assertThrows(WorkerInitializationException.class,
                    () -> orchestrator.run(records, MatchParameters.defaults()));
            assertInstanceOf(IllegalStateException.class, e.getCause());
        }

        @Test
        @DisplayName("An interrupted caller cancels the run")
        void interruptedCaller() {
            BatchOrchestrator orchestrator = orchestrator(() -> bundle, options().batchSize(5).build());

            Thread.currentThread().interrupt();
            try {
                assertThrows(InterruptedException.class, () -> orchestrator.run(records, MatchParameters.defaults()));
            } finally {
                Thread.interrupted();
            }
        }
    }

    @Nested
    @DisplayName("Workers")
    class Workers {

        @Test
        @DisplayName("Recycled per-worker contexts reload their indexes")
        void recyclingReloads() throws Exception {
            AtomicInteger loads = new AtomicInteger();
            IndexProvider counting = () -> {
                loads.incrementAndGet();
                return bundle;
            };
            OrchestratorOptions options = options().batchSize(5).workers(2)
                    .initMode(WorkerInitMode.PER_WORKER).recycleAfterBatches(1).build();

            RunResult result = orchestrator(counting, options).run(records.subList(0, 20), MatchParameters.defaults());

            assertEquals(4, result.getStatistics().completedBatches());
            assertTrue(loads.get() >= 4, "each batch runs in a fresh context, got " + loads.get());
        }

        @Test
        @DisplayName("Shared mode loads indexes once")
        void sharedLoadsOnce() throws Exception {
            AtomicInteger loads = new AtomicInteger();
            IndexProvider counting = () -> {
                loads.incrementAndGet();
                return bundle;
            };
            OrchestratorOptions options = options().batchSize(5).workers(3)
                    .initMode(WorkerInitMode.SHARED).recycleAfterBatches(1).build();

            orchestrator(counting, options).run(records, MatchParameters.defaults());

            assertEquals(1, loads.get());
        }
    }

    private static final class SlowIndex implements CandidateIndex {
        private final CandidateIndex delegate;
        private final String slowTitle;

        private SlowIndex(CandidateIndex delegate, String slowTitle) {
            this.delegate = delegate;
            this.slowTitle = slowTitle;
        }

        @Override
        public List<CandidateRecord> lookup(InputRecord record, int yearTolerance) {
            if (slowTitle.equals(record.getTitle())) {
                try {
                    Thread.sleep(60_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return delegate.lookup(record, yearTolerance);
        }

        @Override
        public int size() {
            return delegate.size();
        }
    }
}
