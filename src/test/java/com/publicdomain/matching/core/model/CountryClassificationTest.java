package com.publicdomain.matching.core.model;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.DisplayName;

import static org.junit.jupiter.api.Assertions.*;

class CountryClassificationTest {

    @ParameterizedTest
    @DisplayName("Should classify MARC country codes")
    @CsvSource({
            "nyu, US",
            "' xxu ', US",
            "CAU, US",
            "enk, NON_US",
            "fr, NON_US",
            "'', UNKNOWN",
            "'  ', UNKNOWN",
            "x, UNKNOWN",
            "12a, UNKNOWN",
            "'|||', UNKNOWN"
    })
    void classify(String code, CountryClassification expected) {
        assertEquals(expected, CountryClassification.fromCountryCode(code));
    }
}
