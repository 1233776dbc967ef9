package com.publicdomain.matching.similarity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Integer 0-100 fuzzy ratios over whole strings, substrings and token sets.
 * All ratios return 0 when either side is empty after processing.
 */
public final class FuzzyRatios {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{Alnum}]+");

    private FuzzyRatios() {
        // Utility class
    }

    /**
     * Whole-string similarity.
     */
    public static int ratio(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        return (int) Math.round(100.0 * LevenshteinSimilarity.ratio(a, b));
    }

    /**
     * Best ratio of the shorter string against every same-length window of the longer one.
     */
    public static int partialRatio(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        String shorter = a.length() <= b.length() ? a : b;
        String longer = a.length() <= b.length() ? b : a;
        if (longer.contains(shorter)) {
            return 100;
        }
        int window = shorter.length();
        int best = 0;
        for (int start = 0; start + window <= longer.length(); start++) {
            int score = ratio(shorter, longer.substring(start, start + window));
            if (score > best) {
                best = score;
                if (best == 100) {
                    break;
                }
            }
        }
        return best;
    }

    /**
     * Ratio after lowercasing, stripping punctuation and sorting tokens alphabetically.
     */
    public static int tokenSortRatio(String a, String b) {
        String sortedA = String.join(" ", sortedTokens(a));
        String sortedB = String.join(" ", sortedTokens(b));
        return ratio(sortedA, sortedB);
    }

    /**
     * Compares the shared tokens against each side's shared-plus-remaining tokens and
     * keeps the best ratio, so a string that is a token subset of the other scores 100.
     */
    public static int tokenSetRatio(String a, String b) {
        TreeSet<String> tokensA = new TreeSet<>(sortedTokens(a));
        TreeSet<String> tokensB = new TreeSet<>(sortedTokens(b));
        if (tokensA.isEmpty() || tokensB.isEmpty()) {
            return 0;
        }

        TreeSet<String> intersection = new TreeSet<>(tokensA);
        intersection.retainAll(tokensB);
        TreeSet<String> onlyA = new TreeSet<>(tokensA);
        onlyA.removeAll(tokensB);
        TreeSet<String> onlyB = new TreeSet<>(tokensB);
        onlyB.removeAll(tokensA);

        String common = String.join(" ", intersection);
        String combinedA = (common + " " + String.join(" ", onlyA)).trim();
        String combinedB = (common + " " + String.join(" ", onlyB)).trim();

        int best = ratio(combinedA, combinedB);
        if (!common.isEmpty()) {
            best = Math.max(best, ratio(common, combinedA));
            best = Math.max(best, ratio(common, combinedB));
        }
        return best;
    }

    private static List<String> sortedTokens(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String processed = NON_ALPHANUMERIC.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
        if (processed.isEmpty()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>(Arrays.asList(processed.split("\\s+")));
        tokens.sort(null);
        return tokens;
    }
}
