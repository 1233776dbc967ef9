package com.publicdomain.matching.rules;

import com.publicdomain.matching.core.model.FieldKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Language- and field-specific stopwords. English is stripped aggressively; French, German,
 * Spanish and Italian keep their articles, which carry matching signal.
 * Unknown languages fall back to English.
 */
public final class StopwordLists {

    private static final int MIN_WORD_LENGTH = 2;

    private static final Map<String, Map<FieldKind, Set<String>>> STOPWORDS = Map.of(
            "eng", Map.of(
                    FieldKind.TITLE, Set.of(
                            "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "he",
                            "in", "is", "it", "its", "of", "on", "that", "the", "to", "was", "will",
                            "with", "or", "not", "this", "these", "those", "they", "their", "there",
                            "been", "have", "had", "were", "what", "when", "where", "which", "who",
                            "why", "how", "all", "some", "other", "another", "any", "many", "more",
                            "most", "such", "our"),
                    FieldKind.AUTHOR, Set.of(
                            "a", "an", "and", "as", "at", "by", "for", "from", "in", "of", "on", "the",
                            "to", "with", "or", "ed", "trans", "comp"),
                    FieldKind.PUBLISHER, Set.of(
                            "a", "an", "and", "at", "by", "for", "from", "in", "of", "on", "the", "to",
                            "with")),
            "fre", Map.of(
                    FieldKind.TITLE, Set.of("et", "ou", "avec", "dans", "pour", "sur", "par", "aux", "des"),
                    FieldKind.AUTHOR, Set.of("et", "avec", "par"),
                    FieldKind.PUBLISHER, Set.of("et")),
            "ger", Map.of(
                    FieldKind.TITLE, Set.of("und", "oder", "mit", "fur", "auf", "bei", "zu", "vom", "zur"),
                    FieldKind.AUTHOR, Set.of("und", "mit", "von"),
                    FieldKind.PUBLISHER, Set.of("und")),
            "spa", Map.of(
                    FieldKind.TITLE, Set.of("y", "o", "con", "para", "por", "en", "sobre", "desde", "hasta"),
                    FieldKind.AUTHOR, Set.of("y", "con", "por"),
                    FieldKind.PUBLISHER, Set.of("y")),
            "ita", Map.of(
                    FieldKind.TITLE, Set.of("e", "o", "con", "per", "su", "da", "tra", "fra", "nei"),
                    FieldKind.AUTHOR, Set.of("e", "con", "da"),
                    FieldKind.PUBLISHER, Set.of("e"))
    );

    /** Common words that must survive stopword removal because they distinguish works. */
    private static final Map<FieldKind, Set<String>> PRESERVED = Map.of(
            FieldKind.TITLE, Set.of("new", "history", "story", "life", "american", "world", "book",
                    "complete", "selected", "collected"),
            FieldKind.AUTHOR, Set.of("illustrated", "edited", "translated", "compiled", "introduction"),
            FieldKind.PUBLISHER, Set.of("company", "press", "university", "college", "institute",
                    "corporation", "incorporated", "limited", "publishing", "publishers")
    );

    private StopwordLists() {
        // Utility class
    }

    public static Set<String> stopwords(String language, FieldKind field) {
        Map<FieldKind, Set<String>> byField = language != null && STOPWORDS.containsKey(language)
                ? STOPWORDS.get(language) : STOPWORDS.get("eng");
        FieldKind key = field == FieldKind.FULL_TEXT ? FieldKind.PUBLISHER : field;
        return byField.getOrDefault(key, byField.get(FieldKind.TITLE));
    }

    /**
     * Splits normalized text on whitespace and drops stopwords and words shorter than two
     * characters. Preserved words are always kept.
     */
    public static List<String> removeStopwords(String normalizedText, String language, FieldKind field) {
        List<String> result = new ArrayList<>();
        if (normalizedText == null || normalizedText.isBlank()) {
            return result;
        }
        Set<String> stopwords = stopwords(language, field);
        Set<String> preserved = PRESERVED.getOrDefault(field, Set.of());
        for (String word : normalizedText.trim().split("\\s+")) {
            if (preserved.contains(word)) {
                result.add(word);
            } else if (!stopwords.contains(word) && word.length() >= MIN_WORD_LENGTH) {
                result.add(word);
            }
        }
        return result;
    }
}
