package com.publicdomain.matching.similarity;

import com.publicdomain.matching.config.MatchingConfig;
import com.publicdomain.matching.core.model.FieldKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DefaultFieldSimilarity Tests")
class DefaultFieldSimilarityTest {

    private DefaultFieldSimilarity similarity;

    @BeforeEach
    void setUp() {
        similarity = new DefaultFieldSimilarity(MatchingConfig.defaults());
    }

    @ParameterizedTest
    @DisplayName("Blank values score 0 for every field")
    @EnumSource(FieldKind.class)
    void blanks(FieldKind kind) {
        assertEquals(0.0, similarity.score("", "Something", kind, "eng"));
        assertEquals(0.0, similarity.score("Something", null, kind, "eng"));
    }

    @Nested
    @DisplayName("Titles")
    class Titles {

        @Test
        @DisplayName("Identical titles score 100")
        void identical() {
            assertEquals(100.0, similarity.score("The Great Gatsby", "The Great Gatsby", FieldKind.TITLE, "eng"));
            assertEquals(100.0, similarity.score("The Great Gatsby", "great gatsby.", FieldKind.TITLE, "eng"));
        }

        @Test
        @DisplayName("A base title within a longer title scores on containment")
        void containment() {
            assertEquals(92.31, similarity.score("Tax guide", "Tax guide 1934", FieldKind.TITLE, "eng"), 0.01);
        }

        @Test
        @DisplayName("Titles sharing no words score 0")
        void unrelated() {
            assertEquals(0.0, similarity.score("The Great Gatsby", "Moby Dick", FieldKind.TITLE, "eng"));
        }

        @Test
        @DisplayName("A single shared word is capped")
        void singleSharedWord() {
            double score = similarity.score("History of the Peloponnesian War",
                    "History of Modern Architecture in Europe", FieldKind.TITLE, "eng");

            assertTrue(score <= 40.0, "score was " + score);
        }

        @Test
        @DisplayName("Titles made only of stopwords compare literally")
        void stopwordOnly() {
            assertEquals(100.0, similarity.score("It", "it", FieldKind.TITLE, "eng"));
            assertEquals(0.0, similarity.score("It", "Them", FieldKind.TITLE, "eng"));
        }
    }

    @Nested
    @DisplayName("Authors")
    class Authors {

        @Test
        @DisplayName("Inverted names score 100")
        void inverted() {
            assertEquals(100.0, similarity.score("Hemingway, Ernest", "Ernest Hemingway", FieldKind.AUTHOR, "eng"));
        }

        @Test
        @DisplayName("Unrelated names fall under the noise floor")
        void noise() {
            assertEquals(0.0, similarity.score("Fitzgerald, F. Scott", "Hemingway, Ernest", FieldKind.AUTHOR, "eng"));
        }
    }

    @Nested
    @DisplayName("Publishers")
    class Publishers {

        @Test
        @DisplayName("Abbreviated and expanded forms score 100")
        void abbreviations() {
            assertEquals(100.0, similarity.score("Harper & Bros.", "Harper and Brothers", FieldKind.PUBLISHER, "eng"));
        }

        @Test
        @DisplayName("Publisher is found inside the renewal full text")
        void fullText() {
            String entry = "THE SUN ALSO RISES. (c) 22Oct26; A950987. Charles Scribner's Sons (PWH)";

            assertEquals(100.0, similarity.score("Scribner", entry, FieldKind.FULL_TEXT, "eng"));
        }
    }
}
