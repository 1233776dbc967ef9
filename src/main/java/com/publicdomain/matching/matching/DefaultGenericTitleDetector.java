package com.publicdomain.matching.matching;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.publicdomain.matching.core.model.FieldKind;
import com.publicdomain.matching.rules.StopwordLists;
import com.publicdomain.matching.rules.TextNormalizer;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Hybrid generic-title detector combining, in order of confidence:
 * <ol>
 *   <li><b>pattern</b>: known generic titles such as "collected works" or "proceedings";</li>
 *   <li><b>frequency</b>: titles seen more often than a threshold in the candidate corpus;</li>
 *   <li><b>linguistic</b>: very short titles made only of genre words or stopwords.</li>
 * </ol>
 * Only English (or unspecified) titles are examined; other languages report
 * {@code skipped_non_english_<code>}.
 *
 * <p>Title frequencies are collected through the {@link Builder} while the candidate index
 * is built and are immutable afterwards.</p>
 */
public class DefaultGenericTitleDetector implements GenericTitleDetector {

    public static final String REASON_PATTERN = "pattern";
    public static final String REASON_FREQUENCY = "frequency";
    public static final String REASON_LINGUISTIC = "linguistic";
    public static final String REASON_NONE = "none";
    public static final String REASON_EMPTY = "empty";

    private static final Set<String> GENERIC_PATTERNS = Set.of(
            "collected works", "complete works", "selected works", "works",
            "collected writings", "complete writings", "selected writings",
            "collected papers", "selected papers", "papers",
            "poems", "poetry", "selected poems", "complete poems", "collected poems",
            "essays", "selected essays", "complete essays", "collected essays",
            "stories", "short stories", "selected stories", "collected stories",
            "plays", "dramas", "selected plays", "complete plays", "collected plays",
            "letters", "correspondence", "selected letters", "collected letters",
            "speeches", "addresses", "selected speeches", "collected speeches",
            "novels", "selected novels", "collected novels",
            "anthology", "collection", "selections", "miscellany",
            "writings", "documents", "memoirs", "autobiography",
            "biography", "journal", "diary", "notebook",
            "proceedings", "transactions", "bulletin",
            "report", "reports", "studies", "articles", "records"
    );

    private static final Set<String> GENRE_TERMS = Set.of(
            "poems", "essays", "stories", "plays", "letters", "works", "novels",
            "writings", "papers", "speeches", "addresses"
    );

    private static final Set<String> ENGLISH_CODES = Set.of("eng", "en");
    private static final int MAX_PATTERN_SUBSTRING_WORDS = 3;
    private static final int MAX_GENRE_ONLY_WORDS = 2;
    private static final int MAX_STOPWORD_HEAVY_WORDS = 4;
    private static final double STOPWORD_RATIO = 0.6;
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

    private final Set<String> patterns;
    private final Map<String, Integer> titleCounts;
    private final int frequencyThreshold;
    private final Cache<String, String> reasonCache;

    private DefaultGenericTitleDetector(Builder builder) {
        Set<String> merged = new HashSet<>(GENERIC_PATTERNS);
        merged.addAll(builder.customPatterns);
        this.patterns = Set.copyOf(merged);
        this.titleCounts = Map.copyOf(builder.titleCounts);
        this.frequencyThreshold = builder.frequencyThreshold;
        this.reasonCache = Caffeine.newBuilder()
                .maximumSize(builder.cacheSize)
                .build();
    }

    @Override
    public boolean isGeneric(String title, String language) {
        String reason = detectionReason(title, language);
        return REASON_PATTERN.equals(reason)
                || REASON_FREQUENCY.equals(reason)
                || REASON_LINGUISTIC.equals(reason);
    }

    @Override
    public String detectionReason(String title, String language) {
        if (title == null || title.isBlank()) {
            return REASON_EMPTY;
        }
        if (!isEnglish(language)) {
            return "skipped_non_english_" + language.toLowerCase(Locale.ROOT);
        }
        String normalized = normalizeTitle(title);
        if (normalized.isEmpty()) {
            return REASON_EMPTY;
        }
        return reasonCache.get(normalized, this::detect);
    }

    public int titleCount(String title) {
        return titleCounts.getOrDefault(normalizeTitle(title), 0);
    }

    private String detect(String normalized) {
        if (isPatternMatch(normalized)) {
            return REASON_PATTERN;
        }
        if (titleCounts.getOrDefault(normalized, 0) > frequencyThreshold) {
            return REASON_FREQUENCY;
        }
        if (isLinguisticMatch(normalized)) {
            return REASON_LINGUISTIC;
        }
        return REASON_NONE;
    }

    private boolean isPatternMatch(String normalized) {
        if (patterns.contains(normalized)) {
            return true;
        }
        String[] words = normalized.split(" ");
        if (words.length <= MAX_PATTERN_SUBSTRING_WORDS) {
            for (String pattern : patterns) {
                if (normalized.contains(pattern)) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean isLinguisticMatch(String normalized) {
        String[] words = normalized.split(" ");
        if (words.length <= MAX_GENRE_ONLY_WORDS) {
            boolean allGenre = true;
            for (String word : words) {
                if (!GENRE_TERMS.contains(word)) {
                    allGenre = false;
                    break;
                }
            }
            if (allGenre) {
                return true;
            }
        }
        if (words.length <= MAX_STOPWORD_HEAVY_WORDS) {
            Set<String> stopwords = StopwordLists.stopwords("eng", FieldKind.TITLE);
            long count = 0;
            for (String word : words) {
                if (stopwords.contains(word)) {
                    count++;
                }
            }
            return (double) count / words.length > STOPWORD_RATIO;
        }
        return false;
    }

    private static boolean isEnglish(String language) {
        return language == null || language.isBlank() || ENGLISH_CODES.contains(language.toLowerCase(Locale.ROOT));
    }

    static String normalizeTitle(String title) {
        if (title == null) {
            return "";
        }
        String folded = TextNormalizer.foldToAscii(title).toLowerCase(Locale.ROOT);
        return NON_ALPHANUMERIC.matcher(folded).replaceAll(" ").trim();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, Integer> titleCounts = new HashMap<>();
        private final Set<String> customPatterns = new HashSet<>();
        private int frequencyThreshold = 10;
        private long cacheSize = 10_000;

        /**
         * Records one occurrence of a candidate title for frequency detection.
         */
        public Builder addTitle(String title) {
            String normalized = normalizeTitle(title);
            if (!normalized.isEmpty()) {
                titleCounts.merge(normalized, 1, Integer::sum);
            }
            return this;
        }

        public Builder customPattern(String pattern) {
            String normalized = normalizeTitle(pattern);
            if (!normalized.isEmpty()) {
                customPatterns.add(normalized);
            }
            return this;
        }

        public Builder frequencyThreshold(int frequencyThreshold) {
            if (frequencyThreshold <= 0) {
                throw new IllegalArgumentException("frequencyThreshold must be positive");
            }
            this.frequencyThreshold = frequencyThreshold;
            return this;
        }

        public Builder cacheSize(long cacheSize) {
            if (cacheSize <= 0) {
                throw new IllegalArgumentException("cacheSize must be positive");
            }
            this.cacheSize = cacheSize;
            return this;
        }

        public DefaultGenericTitleDetector build() {
            return new DefaultGenericTitleDetector(this);
        }
    }
}
