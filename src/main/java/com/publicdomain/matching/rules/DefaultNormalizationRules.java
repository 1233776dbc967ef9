package com.publicdomain.matching.rules;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Built-in normalization rules for bibliographic text: ampersands, publishing
 * abbreviations, Roman numerals, ordinals, number words and punctuation.
 *
 * <p>Input is expected to be ASCII-folded and lowercased already.</p>
 */
public final class DefaultNormalizationRules {

    private static final int PRIORITY_AMPERSAND = 5;
    private static final int PRIORITY_ABBREVIATION = 10;
    private static final int PRIORITY_ROMAN = 20;
    private static final int PRIORITY_ORDINAL_WORD = 30;
    private static final int PRIORITY_ORDINAL_SUFFIX = 35;
    private static final int PRIORITY_NUMBER_WORD = 40;
    private static final int PRIORITY_PUNCTUATION = 90;

    private static final Map<String, String> ABBREVIATIONS = orderedMap(
            "co", "company",
            "corp", "corporation",
            "inc", "incorporated",
            "ltd", "limited",
            "bros", "brothers",
            "pub", "publishing",
            "publ", "publishing",
            "pubs", "publishers",
            "univ", "university",
            "dept", "department",
            "assn", "association",
            "assoc", "association",
            "soc", "society",
            "inst", "institute",
            "natl", "national",
            "intl", "international",
            "amer", "american",
            "govt", "government",
            "mfg", "manufacturing",
            "vol", "volume",
            "vols", "volumes",
            "illus", "illustrated",
            "rev", "revised",
            "enl", "enlarged",
            "mt", "mount",
            "ft", "fort"
    );

    private static final Map<String, String> AMPERSAND_WORDS = orderedMap(
            "eng", "and",
            "fre", "et",
            "ger", "und",
            "spa", "y",
            "ita", "e"
    );

    private static final Map<String, Map<String, String>> ORDINAL_WORDS = Map.of(
            "eng", orderedMap(
                    "first", "1", "second", "2", "third", "3", "fourth", "4", "fifth", "5",
                    "sixth", "6", "seventh", "7", "eighth", "8", "ninth", "9", "tenth", "10",
                    "eleventh", "11", "twelfth", "12", "thirteenth", "13", "fourteenth", "14",
                    "fifteenth", "15", "sixteenth", "16", "seventeenth", "17", "eighteenth", "18",
                    "nineteenth", "19", "twentieth", "20"),
            "fre", orderedMap(
                    "premier", "1", "premiere", "1", "deuxieme", "2", "second", "2", "seconde", "2",
                    "troisieme", "3", "quatrieme", "4", "cinquieme", "5", "sixieme", "6",
                    "septieme", "7", "huitieme", "8", "neuvieme", "9", "dixieme", "10"),
            "ger", orderedMap(
                    "erste", "1", "erster", "1", "ersten", "1", "zweite", "2", "zweiter", "2",
                    "zweiten", "2", "dritte", "3", "dritter", "3", "dritten", "3", "vierte", "4",
                    "funfte", "5", "sechste", "6", "siebte", "7", "achte", "8", "neunte", "9",
                    "zehnte", "10"),
            "spa", orderedMap(
                    "primero", "1", "primera", "1", "segundo", "2", "segunda", "2", "tercero", "3",
                    "tercera", "3", "cuarto", "4", "cuarta", "4", "quinto", "5", "quinta", "5"),
            "ita", orderedMap(
                    "primo", "1", "prima", "1", "secondo", "2", "seconda", "2", "terzo", "3",
                    "terza", "3", "quarto", "4", "quarta", "4", "quinto", "5", "quinta", "5")
    );

    private static final Map<String, String> ORDINAL_SUFFIXES = orderedMap(
            "eng", "st|nd|rd|th",
            "fre", "eme|er|re|e",
            "spa", "o|a",
            "ita", "o|a"
    );

    private static final Map<String, Map<String, String>> NUMBER_WORDS = Map.of(
            "eng", orderedMap(
                    "one", "1", "two", "2", "three", "3", "four", "4", "five", "5", "six", "6",
                    "seven", "7", "eight", "8", "nine", "9", "ten", "10", "eleven", "11",
                    "twelve", "12", "thirteen", "13", "fourteen", "14", "fifteen", "15",
                    "sixteen", "16", "seventeen", "17", "eighteen", "18", "nineteen", "19",
                    "twenty", "20", "thirty", "30", "forty", "40", "fifty", "50", "sixty", "60",
                    "seventy", "70", "eighty", "80", "ninety", "90", "hundred", "100",
                    "thousand", "1000"),
            "fre", orderedMap(
                    "deux", "2", "trois", "3", "quatre", "4", "cinq", "5", "six", "6", "sept", "7",
                    "huit", "8", "neuf", "9", "dix", "10", "vingt", "20", "cent", "100",
                    "mille", "1000"),
            "ger", orderedMap(
                    "zwei", "2", "drei", "3", "vier", "4", "funf", "5", "sechs", "6", "sieben", "7",
                    "acht", "8", "neun", "9", "zehn", "10", "zwanzig", "20", "hundert", "100",
                    "tausend", "1000"),
            "spa", orderedMap(
                    "dos", "2", "tres", "3", "cuatro", "4", "cinco", "5", "seis", "6", "siete", "7",
                    "ocho", "8", "nueve", "9", "diez", "10", "veinte", "20", "cien", "100",
                    "mil", "1000"),
            "ita", orderedMap(
                    "due", "2", "tre", "3", "quattro", "4", "cinque", "5", "sei", "6", "sette", "7",
                    "otto", "8", "nove", "9", "dieci", "10", "venti", "20", "cento", "100",
                    "mille", "1000")
    );

    private static final String ENGLISH_TENS = "twenty|thirty|forty|fifty|sixty|seventy|eighty|ninety";
    private static final String ENGLISH_UNITS = "one|two|three|four|five|six|seven|eight|nine";

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates an engine with every default rule.
     */
    public static NormalizationEngine createDefaultEngine() {
        return createEngine(true);
    }

    /**
     * Creates an engine with the default rules, optionally leaving out abbreviation expansion.
     */
    public static NormalizationEngine createEngine(boolean expandAbbreviations) {
        List<NormalizationRule> rules = new ArrayList<>(getAmpersandRules());
        if (expandAbbreviations) {
            rules.addAll(getAbbreviationRules());
        }
        rules.addAll(getNumberRules());
        rules.addAll(getPunctuationRules());
        return new NormalizationEngine(rules);
    }

    public static List<NormalizationRule> getAmpersandRules() {
        List<NormalizationRule> rules = new ArrayList<>();
        AMPERSAND_WORDS.forEach((language, word) -> rules.add(NormalizationRule.builder()
                .name("ampersand-" + language)
                .pattern("\\s*&\\s*")
                .replacement(" " + word + " ")
                .languages(language)
                .priority(PRIORITY_AMPERSAND)
                .build()));
        return rules;
    }

    /**
     * Abbreviations are expanded when written with a trailing period, or when shorter than
     * five letters even without one.
     */
    public static List<NormalizationRule> getAbbreviationRules() {
        List<NormalizationRule> rules = new ArrayList<>();
        ABBREVIATIONS.forEach((abbreviation, expansion) -> {
            String pattern = abbreviation.length() < 5
                    ? "\\b" + abbreviation + "\\b(?!')\\.?"
                    : "\\b" + abbreviation + "\\.";
            rules.add(NormalizationRule.builder()
                    .name("abbreviation-" + abbreviation)
                    .pattern(pattern)
                    .replacement(expansion)
                    .priority(PRIORITY_ABBREVIATION)
                    .build());
        });
        return rules;
    }

    public static List<NormalizationRule> getNumberRules() {
        List<NormalizationRule> rules = new ArrayList<>();

        // ii through xxxix; single letters are left alone
        rules.add(NormalizationRule.builder()
                .name("roman-numeral")
                .pattern("\\b(?=[ivx]{2,}\\b)x{0,3}(?:ix|iv|v?i{0,3})\\b")
                .replacer(match -> Integer.toString(romanToInt(match.group())))
                .priority(PRIORITY_ROMAN)
                .build());

        ORDINAL_WORDS.forEach((language, words) -> rules.add(NormalizationRule.builder()
                .name("ordinal-words-" + language)
                .pattern(wordAlternation(words))
                .replacer(match -> words.get(match.group().toLowerCase(Locale.ROOT)))
                .languages(language)
                .priority(PRIORITY_ORDINAL_WORD)
                .build()));

        ORDINAL_SUFFIXES.forEach((language, suffixes) -> rules.add(NormalizationRule.builder()
                .name("ordinal-suffix-" + language)
                .pattern("\\b(\\d+)(?:" + suffixes + ")\\b")
                .replacement("$1")
                .languages(language)
                .priority(PRIORITY_ORDINAL_SUFFIX)
                .build()));

        Map<String, String> englishNumbers = NUMBER_WORDS.get("eng");
        rules.add(NormalizationRule.builder()
                .name("compound-number-eng")
                .pattern("\\b(" + ENGLISH_TENS + ")[-\\s](" + ENGLISH_UNITS + ")\\b")
                .replacer(match -> Integer.toString(
                        Integer.parseInt(englishNumbers.get(match.group(1).toLowerCase(Locale.ROOT)))
                                + Integer.parseInt(englishNumbers.get(match.group(2).toLowerCase(Locale.ROOT)))))
                .languages("eng")
                .priority(PRIORITY_NUMBER_WORD - 1)
                .build());

        NUMBER_WORDS.forEach((language, words) -> rules.add(NormalizationRule.builder()
                .name("number-words-" + language)
                .pattern(wordAlternation(words))
                .replacer(match -> words.get(match.group().toLowerCase(Locale.ROOT)))
                .languages(language)
                .priority(PRIORITY_NUMBER_WORD)
                .build()));

        return rules;
    }

    public static List<NormalizationRule> getPunctuationRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("apostrophe")
                        .pattern("['`]")
                        .replacement("")
                        .priority(PRIORITY_PUNCTUATION)
                        .build(),
                NormalizationRule.builder()
                        .name("punctuation")
                        .pattern("[^\\p{Alnum}\\s]+")
                        .replacement(" ")
                        .priority(PRIORITY_PUNCTUATION + 1)
                        .build()
        );
    }

    static int romanToInt(String roman) {
        int total = 0;
        int previous = 0;
        String lower = roman.toLowerCase(Locale.ROOT);
        for (int i = lower.length() - 1; i >= 0; i--) {
            int value = switch (lower.charAt(i)) {
                case 'i' -> 1;
                case 'v' -> 5;
                case 'x' -> 10;
                default -> throw new IllegalArgumentException("Not a Roman numeral: " + roman);
            };
            total += value < previous ? -value : value;
            previous = Math.max(previous, value);
        }
        return total;
    }

    private static String wordAlternation(Map<String, String> words) {
        return "\\b(?:" + String.join("|", words.keySet()) + ")\\b";
    }

    private static Map<String, String> orderedMap(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return map;
    }
}
