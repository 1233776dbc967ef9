package com.publicdomain.matching.batch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.publicdomain.matching.core.model.InputRecord;
import com.publicdomain.matching.core.model.MatchedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * On-disk layout of one run:
 * <pre>
 * &lt;run&gt;/batches/batch_&lt;id&gt;.json          input records, deleted once read
 * &lt;run&gt;/results/batch_&lt;id&gt;_result.json   matched records
 * &lt;run&gt;/results/batch_&lt;id&gt;_stats.json    batch counters
 * </pre>
 * Safe for concurrent use as long as each batch id is handled by one thread.
 */
public class BatchSpool {
    private static final Logger log = LoggerFactory.getLogger(BatchSpool.class);

    private static final TypeReference<List<InputRecord>> INPUT_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<MatchedRecord>> RESULT_LIST = new TypeReference<>() {
    };

    private final Path runDirectory;
    private final Path batchesDirectory;
    private final Path resultsDirectory;
    private final ObjectMapper objectMapper;

    public BatchSpool(Path runDirectory, ObjectMapper objectMapper) {
        this.runDirectory = runDirectory;
        this.batchesDirectory = runDirectory.resolve("batches");
        this.resultsDirectory = runDirectory.resolve("results");
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(batchesDirectory);
            Files.createDirectories(resultsDirectory);
        } catch (IOException e) {
            throw new BatchSpoolException("Failed to create spool directories under " + runDirectory, e);
        }
    }

    public BatchHandle writeBatch(int batchId, List<InputRecord> records) {
        Path file = batchesDirectory.resolve("batch_" + batchId + ".json");
        write(file, records);
        log.debug("batch.spooled batchId={} records={} file={}", batchId, records.size(), file);
        return new BatchHandle(batchId, file, records.size());
    }

    /**
     * Reads a spooled batch and deletes its file, whether or not the read succeeded.
     *
     * @throws IllegalStateException if the handle was already consumed
     */
    public List<InputRecord> readBatch(BatchHandle handle) {
        handle.markConsumed();
        try (InputStream in = Files.newInputStream(handle.getFile())) {
            return objectMapper.readValue(in, INPUT_LIST);
        } catch (IOException e) {
            throw new BatchSpoolException("Failed to read batch " + handle.getBatchId(), e);
        } finally {
            deleteQuietly(handle.getFile());
            handle.markDeleted();
        }
    }

    public Path writeResults(int batchId, List<MatchedRecord> results) {
        Path file = resultFile(batchId);
        write(file, results);
        return file;
    }

    public Path writeStats(int batchId, BatchStats stats) {
        Path file = statsFile(batchId);
        write(file, stats);
        return file;
    }

    public List<MatchedRecord> readResults(Path resultFile) {
        try (InputStream in = Files.newInputStream(resultFile)) {
            return objectMapper.readValue(in, RESULT_LIST);
        } catch (IOException e) {
            throw new BatchSpoolException("Failed to read results " + resultFile, e);
        }
    }

    public BatchStats readStats(Path statsFile) {
        try (InputStream in = Files.newInputStream(statsFile)) {
            return objectMapper.readValue(in, BatchStats.class);
        } catch (IOException e) {
            throw new BatchSpoolException("Failed to read stats " + statsFile, e);
        }
    }

    public Path resultFile(int batchId) {
        return resultsDirectory.resolve("batch_" + batchId + "_result.json");
    }

    public Path statsFile(int batchId) {
        return resultsDirectory.resolve("batch_" + batchId + "_stats.json");
    }

    /**
     * Removes the staging directory and any batch files still in it.
     */
    public void deleteStaging() {
        if (!Files.exists(batchesDirectory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(batchesDirectory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(BatchSpool::deleteQuietly);
        } catch (IOException e) {
            log.warn("spool.cleanupFailed dir={} error={}", batchesDirectory, e.getMessage());
        }
    }

    /**
     * Deletes result and stats files, then the run directory if nothing else is left in it.
     */
    public void discardResults(List<BatchOutcome> outcomes) {
        for (BatchOutcome outcome : outcomes) {
            if (outcome.resultFile() != null) {
                deleteQuietly(outcome.resultFile());
            }
            if (outcome.statsFile() != null) {
                deleteQuietly(outcome.statsFile());
            }
        }
        deleteIfEmpty(resultsDirectory);
        deleteIfEmpty(runDirectory);
    }

    public Path getRunDirectory() {
        return runDirectory;
    }

    public Path getResultsDirectory() {
        return resultsDirectory;
    }

    Path getBatchesDirectory() {
        return batchesDirectory;
    }

    private void write(Path file, Object value) {
        try (OutputStream out = Files.newOutputStream(file)) {
            objectMapper.writeValue(out, value);
        } catch (IOException e) {
            throw new BatchSpoolException("Failed to write " + file, e);
        }
    }

    private static void deleteIfEmpty(Path dir) {
        try (Stream<Path> entries = Files.list(dir)) {
            if (entries.findAny().isEmpty()) {
                Files.deleteIfExists(dir);
            }
        } catch (IOException e) {
            log.debug("spool.keepDirectory dir={} reason={}", dir, e.getMessage());
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("spool.deleteFailed path={} error={}", path, e.getMessage());
        }
    }
}
