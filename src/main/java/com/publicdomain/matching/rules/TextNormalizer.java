package com.publicdomain.matching.rules;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.publicdomain.matching.config.MatchingConfig;
import com.publicdomain.matching.core.model.FieldKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Field-aware normalization pipeline: ASCII folding, lowercasing, rule-based rewriting
 * (abbreviations, numbers, punctuation), stopword removal, and stemming for titles.
 * Results are memoized in a bounded cache shared by all threads.
 */
public class TextNormalizer {
    private static final Logger log = LoggerFactory.getLogger(TextNormalizer.class);
    private static final String DEFAULT_LANGUAGE = "eng";
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private final NormalizationEngine engine;
    private final boolean stemmingEnabled;
    private final Cache<CacheKey, NormalizedText> cache;

    public TextNormalizer(MatchingConfig config) {
        this(DefaultNormalizationRules.createEngine(config.isAbbreviationExpansionEnabled()),
                config.isStemmingEnabled(), config.getNormalizationCacheSize());
    }

    public TextNormalizer(NormalizationEngine engine, boolean stemmingEnabled, long cacheSize) {
        this.engine = engine;
        this.stemmingEnabled = stemmingEnabled;
        this.cache = Caffeine.newBuilder()
                .maximumSize(cacheSize)
                .build();
        log.debug("TextNormalizer initialized: rules={}, stemming={}, cacheSize={}",
                engine.getRules().size(), stemmingEnabled, cacheSize);
    }

    /**
     * Normalizes a field value. Blank input yields {@link NormalizedText#EMPTY}.
     */
    public NormalizedText normalize(String text, FieldKind field, String language) {
        if (text == null || text.isBlank()) {
            return NormalizedText.EMPTY;
        }
        String lang = language == null || language.isBlank() ? DEFAULT_LANGUAGE : language.toLowerCase(Locale.ROOT);
        return cache.get(new CacheKey(text, field, lang), this::compute);
    }

    private NormalizedText compute(CacheKey key) {
        String lowered = foldToAscii(key.text()).toLowerCase(Locale.ROOT);
        String normalized = engine.normalize(lowered, key.field(), key.language());
        List<String> words = StopwordLists.removeStopwords(normalized, key.language(), key.field());
        List<String> stems = stemmingEnabled && key.field() == FieldKind.TITLE
                ? SnowballStemmers.stem(words, key.language())
                : words;
        return new NormalizedText(normalized, words, stems);
    }

    /**
     * Folds accented and special Latin characters to plain ASCII.
     */
    public static String foldToAscii(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String expanded = text
                .replace("ß", "ss")
                .replace("æ", "ae").replace("Æ", "AE")
                .replace("œ", "oe").replace("Œ", "OE")
                .replace("ø", "o").replace("Ø", "O")
                .replace("ł", "l").replace("Ł", "L")
                .replace("đ", "d").replace("Đ", "D")
                .replace("þ", "th").replace("Þ", "Th");
        String decomposed = Normalizer.normalize(expanded, Normalizer.Form.NFKD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("");
    }

    private record CacheKey(String text, FieldKind field, String language) {
    }
}
