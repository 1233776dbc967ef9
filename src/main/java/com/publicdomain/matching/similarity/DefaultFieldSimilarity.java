package com.publicdomain.matching.similarity;

import com.publicdomain.matching.config.MatchingConfig;
import com.publicdomain.matching.core.model.FieldKind;
import com.publicdomain.matching.rules.NormalizedText;
import com.publicdomain.matching.rules.TextNormalizer;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Default field similarity.
 *
 * <ul>
 *   <li><b>Title</b>: full normalization with stemming, then a containment check for
 *   base-title/subtitle pairs, then word-overlap-aware fuzzy matching that penalizes
 *   pairs sharing only one distinctive word.</li>
 *   <li><b>Author</b>: token-set ratio with a noise floor, so unrelated names score 0.</li>
 *   <li><b>Publisher</b>: plain ratio of the normalized names.</li>
 *   <li><b>Full text</b>: partial ratio of the normalized publisher within a renewal entry.</li>
 * </ul>
 */
public class DefaultFieldSimilarity implements FieldSimilarity {

    private static final int MIN_CONTAINMENT_ORIGINAL_LENGTH = 8;
    private static final int MIN_CONTAINED_LENGTH = 5;
    private static final int MIN_CONTAINED_WORDS = 2;
    private static final double MIN_CONTAINMENT_RATIO = 0.3;
    private static final double GOOD_OVERLAP_RATIO = 0.6;
    private static final int AUTHOR_WORD_COUNT_GAP = 3;
    private static final double AUTHOR_WORD_COUNT_FACTOR = 0.7;

    private final TextNormalizer normalizer;
    private final double authorNoiseFloor;
    private final String defaultLanguage;

    public DefaultFieldSimilarity(MatchingConfig config) {
        this(new TextNormalizer(config), config);
    }

    public DefaultFieldSimilarity(TextNormalizer normalizer, MatchingConfig config) {
        this.normalizer = normalizer;
        this.authorNoiseFloor = config.getAuthorNoiseFloor();
        this.defaultLanguage = config.getDefaultLanguage();
    }

    @Override
    public double score(String a, String b, FieldKind kind, String language) {
        if (a == null || b == null || a.isBlank() || b.isBlank()) {
            return 0.0;
        }
        String lang = language == null || language.isBlank() ? defaultLanguage : language;
        double score = switch (kind) {
            case TITLE -> titleScore(a, b, lang);
            case AUTHOR -> authorScore(a, b, lang);
            case PUBLISHER -> publisherScore(a, b, lang);
            case FULL_TEXT -> fullTextScore(a, b, lang);
        };
        return Math.min(100.0, Math.max(0.0, score));
    }

    private double titleScore(String a, String b, String language) {
        NormalizedText left = normalizer.normalize(a, FieldKind.TITLE, language);
        NormalizedText right = normalizer.normalize(b, FieldKind.TITLE, language);

        if (left.isEmpty() && right.isEmpty()) {
            return sameIgnoringCase(a, b) ? 100.0 : 0.0;
        }
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }

        String leftText = left.joinedStems();
        String rightText = right.joinedStems();

        double containment = containmentScore(leftText, rightText, a, b);
        if (containment > 0) {
            return containment;
        }
        return overlapAwareScore(leftText, rightText, left.stems(), right.stems(), a, b);
    }

    /**
     * Scores one normalized title contained in the other, e.g. "Tax guide" within
     * "Tax guide 1934". Returns 0 when there is no significant containment.
     */
    double containmentScore(String left, String right, String leftOriginal, String rightOriginal) {
        if (Math.min(leftOriginal.length(), rightOriginal.length()) < MIN_CONTAINMENT_ORIGINAL_LENGTH) {
            return 0.0;
        }
        boolean leftInRight = right.contains(left);
        boolean rightInLeft = left.contains(right);
        if (!leftInRight && !rightInLeft) {
            return 0.0;
        }

        String shorter = leftInRight ? left : right;
        String longer = leftInRight ? right : left;
        if (shorter.length() < MIN_CONTAINED_LENGTH || shorter.split(" ").length < MIN_CONTAINED_WORDS) {
            return 0.0;
        }

        double ratio = (double) shorter.length() / longer.length();
        if (ratio <= MIN_CONTAINMENT_RATIO) {
            return 0.0;
        }
        if (longer.startsWith(shorter)) {
            return Math.max(85.0, 80.0 + ratio * 20.0);
        }
        return 75.0 + ratio * 15.0;
    }

    private double overlapAwareScore(String left, String right, List<String> leftWords, List<String> rightWords,
                                     String leftOriginal, String rightOriginal) {
        if (left.equals(right)) {
            return 100.0;
        }

        Set<String> leftSet = new HashSet<>(leftWords);
        Set<String> rightSet = new HashSet<>(rightWords);
        int minDistinct = Math.min(leftSet.size(), rightSet.size());

        if (leftSet.equals(rightSet)) {
            return FuzzyRatios.tokenSortRatio(left, right);
        }

        Set<String> overlap = new HashSet<>(leftSet);
        overlap.retainAll(rightSet);
        int overlapCount = overlap.size();

        if (overlapCount == 0) {
            return 0.0;
        }
        if (overlapCount == 1) {
            int base = FuzzyRatios.tokenSortRatio(left, right);
            // a single shared word is weak evidence unless the titles are very short
            return minDistinct <= 2 ? Math.min(60.0, base * 0.8) : Math.min(40.0, base * 0.6);
        }

        double overlapRatio = (double) overlapCount / Math.max(leftSet.size(), rightSet.size());
        double adjusted = FuzzyRatios.tokenSortRatio(left, right);
        if (overlapRatio < GOOD_OVERLAP_RATIO) {
            adjusted *= 0.4 + overlapRatio;
        }
        if (leftWords.size() + rightWords.size() <= 4) {
            adjusted *= 0.8;
        }
        if (adjusted > 60) {
            // stems agreeing much better than the raw words suggests a stemming false positive
            int originalScore = FuzzyRatios.tokenSortRatio(
                    leftOriginal.toLowerCase(Locale.ROOT), rightOriginal.toLowerCase(Locale.ROOT));
            if (originalScore < adjusted * 0.7) {
                adjusted *= 0.7;
            }
        }
        return adjusted;
    }

    private double authorScore(String a, String b, String language) {
        String left = normalizer.normalize(a, FieldKind.AUTHOR, language).joinedWords();
        String right = normalizer.normalize(b, FieldKind.AUTHOR, language).joinedWords();

        double score = FuzzyRatios.tokenSetRatio(left, right);
        if (score < authorNoiseFloor) {
            return 0.0;
        }
        int leftCount = left.isEmpty() ? 0 : left.split(" ").length;
        int rightCount = right.isEmpty() ? 0 : right.split(" ").length;
        if (Math.abs(leftCount - rightCount) > AUTHOR_WORD_COUNT_GAP) {
            score *= AUTHOR_WORD_COUNT_FACTOR;
        }
        return score;
    }

    private double publisherScore(String a, String b, String language) {
        String left = normalizer.normalize(a, FieldKind.PUBLISHER, language).joinedWords();
        String right = normalizer.normalize(b, FieldKind.PUBLISHER, language).joinedWords();
        return FuzzyRatios.ratio(left, right);
    }

    private double fullTextScore(String publisher, String fullText, String language) {
        String processed = normalizer.normalize(publisher, FieldKind.PUBLISHER, language).joinedWords();
        String text = TextNormalizer.foldToAscii(fullText).toLowerCase(Locale.ROOT);
        return FuzzyRatios.partialRatio(processed, text);
    }

    private static boolean sameIgnoringCase(String a, String b) {
        return a.trim().equalsIgnoreCase(b.trim());
    }
}
