package com.publicdomain.matching.similarity;

/**
 * Indel-weighted Levenshtein ratio: a substitution costs 2 (one deletion plus one
 * insertion), and similarity is {@code (len1 + len2 - distance) / (len1 + len2)}.
 * This is the base of every ratio in {@link FuzzyRatios}.
 */
public final class LevenshteinSimilarity {

    private static final int SUBSTITUTION_COST = 2;

    private LevenshteinSimilarity() {
    }

    /**
     * Similarity in [0, 1]. Null or empty input on either side scores 0.
     */
    public static double ratio(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        int total = a.length() + b.length();
        return (double) (total - weightedDistance(a, b)) / total;
    }

    /**
     * Edit distance with substitutions weighted 2, in a single DP row sized to the
     * shorter string.
     */
    static int weightedDistance(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;
        int[] row = new int[shorter.length() + 1];
        for (int i = 0; i < row.length; i++) {
            row[i] = i;
        }
        for (int j = 1; j <= longer.length(); j++) {
            int diagonal = row[0];
            row[0] = j;
            char c = longer.charAt(j - 1);
            for (int i = 1; i < row.length; i++) {
                int above = row[i];
                int substitution = diagonal + (shorter.charAt(i - 1) == c ? 0 : SUBSTITUTION_COST);
                row[i] = Math.min(substitution, Math.min(row[i - 1], above) + 1);
                diagonal = above;
            }
        }
        return row[shorter.length()];
    }
}
