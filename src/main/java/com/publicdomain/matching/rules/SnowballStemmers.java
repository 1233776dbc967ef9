package com.publicdomain.matching.rules;

import org.tartarus.snowball.SnowballStemmer;
import org.tartarus.snowball.ext.EnglishStemmer;
import org.tartarus.snowball.ext.FrenchStemmer;
import org.tartarus.snowball.ext.GermanStemmer;
import org.tartarus.snowball.ext.ItalianStemmer;
import org.tartarus.snowball.ext.SpanishStemmer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Snowball stemming for the supported catalog languages, backed by Lucene's stemmers.
 * Stemmer instances are stateful, so each thread gets its own set.
 */
public final class SnowballStemmers {

    private static final Map<String, Supplier<SnowballStemmer>> FACTORIES = Map.of(
            "eng", EnglishStemmer::new,
            "fre", FrenchStemmer::new,
            "ger", GermanStemmer::new,
            "spa", SpanishStemmer::new,
            "ita", ItalianStemmer::new
    );

    private static final ThreadLocal<Map<String, SnowballStemmer>> STEMMERS =
            ThreadLocal.withInitial(HashMap::new);

    private SnowballStemmers() {
        // Utility class
    }

    public static boolean supports(String language) {
        return language != null && FACTORIES.containsKey(language);
    }

    /**
     * Stems each word. Unsupported languages fall back to English.
     */
    public static List<String> stem(List<String> words, String language) {
        List<String> stemmed = new ArrayList<>(words.size());
        if (words.isEmpty()) {
            return stemmed;
        }
        String key = supports(language) ? language : "eng";
        SnowballStemmer stemmer = STEMMERS.get().computeIfAbsent(key, k -> FACTORIES.get(k).get());
        for (String word : words) {
            stemmer.setCurrent(word);
            stemmer.stem();
            stemmed.add(stemmer.getCurrent());
        }
        return stemmed;
    }
}
