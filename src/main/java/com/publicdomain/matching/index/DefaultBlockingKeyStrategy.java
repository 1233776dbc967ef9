package com.publicdomain.matching.index;

import com.publicdomain.matching.core.model.FieldKind;
import com.publicdomain.matching.rules.StopwordLists;
import com.publicdomain.matching.rules.TextNormalizer;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Default blocking key strategy using three complementary key types:
 * <ul>
 *   <li><b>Title word keys</b>: each distinctive title word of 3+ characters (e.g. {@code t:gatsby})</li>
 *   <li><b>Author surname keys</b>: the surname, taken before the first comma or as the last token
 *   (e.g. {@code a:fitzgerald})</li>
 *   <li><b>LCCN keys</b>: the normalized LCCN (e.g. {@code l:25012345})</li>
 * </ul>
 */
public class DefaultBlockingKeyStrategy implements BlockingKeyStrategy {

    private static final int MIN_TITLE_WORD_LENGTH = 3;

    @Override
    public Set<String> generateKeys(String title, String author, String normalizedLccn) {
        Set<String> keys = new LinkedHashSet<>();

        for (String word : titleWords(title)) {
            keys.add("t:" + word);
        }

        String surname = surname(author);
        if (!surname.isEmpty()) {
            keys.add("a:" + surname);
        }

        if (normalizedLccn != null && !normalizedLccn.isBlank()) {
            keys.add("l:" + normalizedLccn);
        }
        return keys;
    }

    static List<String> titleWords(String title) {
        if (title == null || title.isBlank()) {
            return List.of();
        }
        String cleaned = clean(title);
        return StopwordLists.removeStopwords(cleaned, "eng", FieldKind.TITLE).stream()
                .filter(w -> w.length() >= MIN_TITLE_WORD_LENGTH)
                .toList();
    }

    static String surname(String author) {
        if (author == null || author.isBlank()) {
            return "";
        }
        int comma = author.indexOf(',');
        String cleaned = clean(comma > 0 ? author.substring(0, comma) : author);
        if (cleaned.isEmpty()) {
            return "";
        }
        if (comma > 0) {
            return cleaned;
        }
        String[] tokens = cleaned.split(" ");
        return tokens[tokens.length - 1];
    }

    private static String clean(String text) {
        return TextNormalizer.foldToAscii(text).toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9\\s]+", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }
}
