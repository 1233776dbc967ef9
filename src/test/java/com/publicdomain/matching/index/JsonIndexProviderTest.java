package com.publicdomain.matching.index;

import com.publicdomain.matching.config.MatchingConfig;
import com.publicdomain.matching.core.model.CandidateRecord;
import com.publicdomain.matching.core.model.InputRecord;
import com.publicdomain.matching.core.model.SourceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonIndexProviderTest {

    @TempDir
    Path dir;

    private Path write(String name, String json) throws Exception {
        Path file = dir.resolve(name);
        Files.writeString(file, json);
        return file;
    }

    @Test
    @DisplayName("Should load both indexes and tag records with the file's source type")
    void load() throws Exception {
        Path registrations = write("registrations.json", "["
                + "{\"sourceId\":\"A1\",\"title\":\"The Great Gatsby\",\"author\":\"Fitzgerald, F. Scott\",\"year\":1925},"
                + "{\"sourceId\":\"A2\",\"title\":\"Annual Catalogue\",\"year\":1930},"
                + "{\"sourceId\":\"A3\",\"title\":\"Annual Catalogue\",\"year\":1931}"
                + "]");
        Path renewals = write("renewals.json", "["
                + "{\"sourceId\":\"R1\",\"sourceType\":\"REGISTRATION\",\"title\":\"The Great Gatsby\","
                + "\"author\":\"Fitzgerald, F. Scott\",\"year\":1925,\"fullText\":\"Charles Scribner's Sons\"},"
                + "{\"sourceId\":\"R2\",\"title\":\"Annual Catalogue\",\"year\":1932}"
                + "]");
        MatchingConfig config = MatchingConfig.builder().genericFrequencyThreshold(2).build();

        IndexBundle bundle = new JsonIndexProvider(registrations, renewals, config).load();

        assertEquals(3, bundle.registrations().size());
        assertEquals(2, bundle.renewals().size());

        InputRecord input = InputRecord.builder().title("The Great Gatsby").author("Fitzgerald, F. Scott")
                .year(1925).build();
        List<CandidateRecord> renewalHits = bundle.renewals().lookup(input, 1);
        assertEquals("R1", renewalHits.get(0).getSourceId());
        assertEquals(SourceType.RENEWAL, renewalHits.get(0).getSourceType());
        assertEquals(SourceType.REGISTRATION, bundle.registrations().lookup(input, 1).get(0).getSourceType());

        assertTrue(bundle.genericTitleDetector().isGeneric("Annual Catalogue", "eng"));
        assertFalse(bundle.genericTitleDetector().isGeneric("The Great Gatsby", "eng"));
    }

    @Test
    @DisplayName("A missing file fails the load")
    void missingFile() throws Exception {
        Path registrations = write("registrations.json", "[]");

        assertThrows(IndexLoadException.class, () -> new JsonIndexProvider(registrations,
                dir.resolve("renewals.json"), MatchingConfig.defaults()).load());
    }

    @Test
    @DisplayName("Malformed or empty content fails the load")
    void malformed() throws Exception {
        Path good = write("good.json", "[]");
        Path broken = write("broken.json", "[{\"sourceId\":");
        Path nullContent = write("null.json", "null");
        Path unknownField = write("unknown.json", "[{\"sourceId\":\"A1\",\"colour\":\"red\"}]");

        assertThrows(IndexLoadException.class,
                () -> new JsonIndexProvider(broken, good, MatchingConfig.defaults()).load());
        assertThrows(IndexLoadException.class,
                () -> new JsonIndexProvider(nullContent, good, MatchingConfig.defaults()).load());
        assertThrows(IndexLoadException.class,
                () -> new JsonIndexProvider(unknownField, good, MatchingConfig.defaults()).load());
    }

    @Test
    @DisplayName("Each load builds a fresh bundle")
    void freshBundles() throws Exception {
        Path file = write("empty.json", "[]");
        JsonIndexProvider provider = new JsonIndexProvider(file, file, MatchingConfig.defaults());

        assertNotSame(provider.load(), provider.load());
    }
}
