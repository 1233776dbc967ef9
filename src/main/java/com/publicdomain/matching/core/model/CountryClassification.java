package com.publicdomain.matching.core.model;

import java.util.Locale;
import java.util.Set;

/**
 * Classification of a record's country of publication, derived from its MARC country code.
 */
public enum CountryClassification {
    US,
    NON_US,
    UNKNOWN;

    private static final Set<String> US_COUNTRY_CODES = Set.of(
            "aku", "alu", "aru", "azu", "cau", "cou", "ctu", "dcu", "deu", "flu",
            "gau", "hiu", "iau", "idu", "ilu", "inu", "ksu", "kyu", "lau", "mau",
            "mdu", "meu", "miu", "mnu", "mou", "msu", "mtu", "nbu", "ncu", "ndu",
            "nhu", "nju", "nmu", "nvu", "nyu", "ohu", "oku", "oru", "pau", "riu",
            "scu", "sdu", "tnu", "txu", "utu", "vau", "vtu", "wau", "wvu", "wyu",
            "xxu"
    );

    /**
     * Classifies a MARC country code. Blank or malformed codes are {@link #UNKNOWN}.
     */
    public static CountryClassification fromCountryCode(String countryCode) {
        if (countryCode == null || countryCode.isBlank()) {
            return UNKNOWN;
        }
        String code = countryCode.trim().toLowerCase(Locale.ROOT);
        if (US_COUNTRY_CODES.contains(code)) {
            return US;
        }
        if (code.length() < 2 || code.chars().anyMatch(c -> !Character.isLetter(c))) {
            return UNKNOWN;
        }
        return NON_US;
    }
}
