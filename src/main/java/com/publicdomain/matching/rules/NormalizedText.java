package com.publicdomain.matching.rules;

import java.util.List;

/**
 * Result of running one field value through the normalization pipeline.
 *
 * @param normalized rule-normalized text, before stopword removal
 * @param words      significant words after stopword removal
 * @param stems      stemmed words, or the words themselves when stemming is off or not applied
 */
public record NormalizedText(String normalized, List<String> words, List<String> stems) {

    public static final NormalizedText EMPTY = new NormalizedText("", List.of(), List.of());

    public NormalizedText {
        words = List.copyOf(words);
        stems = List.copyOf(stems);
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }

    public String joinedWords() {
        return String.join(" ", words);
    }

    public String joinedStems() {
        return String.join(" ", stems);
    }
}
