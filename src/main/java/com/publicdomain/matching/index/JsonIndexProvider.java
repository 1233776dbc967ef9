package com.publicdomain.matching.index;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.publicdomain.matching.config.MatchingConfig;
import com.publicdomain.matching.core.model.CandidateRecord;
import com.publicdomain.matching.core.model.SourceType;
import com.publicdomain.matching.matching.DefaultGenericTitleDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Builds an {@link IndexBundle} from two JSON arrays of candidate records, one for
 * registrations and one for renewals. The source type is taken from the file, not
 * from the records. Title frequencies of both corpora feed the generic-title detector.
 *
 * <p>Each {@link #load()} builds a fresh bundle, so this provider suits per-worker
 * initialization as well as a single shared load.</p>
 */
public class JsonIndexProvider implements IndexProvider {
    private static final Logger log = LoggerFactory.getLogger(JsonIndexProvider.class);

    private static final TypeReference<List<CandidateRecord>> CANDIDATE_LIST = new TypeReference<>() {
    };

    private final Path registrationsFile;
    private final Path renewalsFile;
    private final MatchingConfig config;
    private final ObjectMapper objectMapper;
    private final int maxCandidates;

    public JsonIndexProvider(Path registrationsFile, Path renewalsFile, MatchingConfig config) {
        this(registrationsFile, renewalsFile, config, new ObjectMapper(), InMemoryCandidateIndex.DEFAULT_MAX_CANDIDATES);
    }

    public JsonIndexProvider(Path registrationsFile, Path renewalsFile, MatchingConfig config,
                             ObjectMapper objectMapper, int maxCandidates) {
        this.registrationsFile = Objects.requireNonNull(registrationsFile, "registrationsFile is required");
        this.renewalsFile = Objects.requireNonNull(renewalsFile, "renewalsFile is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.objectMapper = objectMapper;
        this.maxCandidates = maxCandidates;
    }

    @Override
    public IndexBundle load() {
        long start = System.currentTimeMillis();
        List<CandidateRecord> registrations = read(registrationsFile, SourceType.REGISTRATION);
        List<CandidateRecord> renewals = read(renewalsFile, SourceType.RENEWAL);

        DefaultGenericTitleDetector.Builder detector = DefaultGenericTitleDetector.builder()
                .frequencyThreshold(config.getGenericFrequencyThreshold());
        registrations.forEach(c -> detector.addTitle(c.getTitle()));
        renewals.forEach(c -> detector.addTitle(c.getTitle()));

        IndexBundle bundle = new IndexBundle(
                InMemoryCandidateIndex.builder().addAll(registrations).maxCandidates(maxCandidates).build(),
                InMemoryCandidateIndex.builder().addAll(renewals).maxCandidates(maxCandidates).build(),
                detector.build());
        log.info("index.loaded registrations={} renewals={} durationMs={}",
                registrations.size(), renewals.size(), System.currentTimeMillis() - start);
        return bundle;
    }

    private List<CandidateRecord> read(Path file, SourceType type) {
        if (!Files.isRegularFile(file)) {
            throw new IndexLoadException("Candidate file not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            List<CandidateRecord> records = objectMapper.readValue(in, CANDIDATE_LIST);
            if (records == null) {
                throw new IndexLoadException("Candidate file is empty: " + file);
            }
            return records.stream()
                    .map(r -> r.getSourceType() == type ? r : r.toBuilder().sourceType(type).build())
                    .toList();
        } catch (IOException e) {
            throw new IndexLoadException("Failed to read candidate file " + file, e);
        }
    }
}
