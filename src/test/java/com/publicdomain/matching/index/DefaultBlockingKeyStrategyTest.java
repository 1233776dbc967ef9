package com.publicdomain.matching.index;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DefaultBlockingKeyStrategyTest {

    private final DefaultBlockingKeyStrategy strategy = new DefaultBlockingKeyStrategy();

    @Test
    @DisplayName("Should generate title, surname and LCCN keys in order")
    void allKeyTypes() {
        Set<String> keys = strategy.generateKeys("The Great Gatsby", "Fitzgerald, F. Scott", "25012345");

        assertEquals(List.of("t:great", "t:gatsby", "a:fitzgerald", "l:25012345"), List.copyOf(keys));
    }

    @Test
    @DisplayName("Should skip stopwords and short words in titles")
    void titleWords() {
        assertEquals(List.of("tale", "two", "cities"), DefaultBlockingKeyStrategy.titleWords("A Tale of Two Cities"));
        assertEquals(List.of("les", "miserables"), DefaultBlockingKeyStrategy.titleWords("Les Misérables"));
        assertTrue(DefaultBlockingKeyStrategy.titleWords("It Is").isEmpty());
    }

    @ParameterizedTest
    @DisplayName("Should extract the surname")
    @CsvSource({
            "'Fitzgerald, F. Scott', fitzgerald",
            "F. Scott Fitzgerald, fitzgerald",
            "'Dumas, Alexandre, 1802-1870', dumas",
            "'Saint-Exupéry, Antoine de', saint exupery",
            "'  ', ''"
    })
    void surname(String author, String expected) {
        assertEquals(expected, DefaultBlockingKeyStrategy.surname(author));
    }

    @Test
    @DisplayName("Missing fields produce no keys")
    void missingFields() {
        assertTrue(strategy.generateKeys(null, null, null).isEmpty());
        assertTrue(strategy.generateKeys("", "", " ").isEmpty());
    }
}
