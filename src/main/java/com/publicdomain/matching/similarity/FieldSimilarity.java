package com.publicdomain.matching.similarity;

import com.publicdomain.matching.core.model.FieldKind;

/**
 * Field-aware fuzzy comparison of bibliographic strings.
 *
 * <p>Implementations must be deterministic and side-effect free. A blank value on either
 * side scores 0; callers decide whether such a field counts as absent rather than as a
 * confirmed mismatch.</p>
 */
public interface FieldSimilarity {

    /**
     * Scores two field values.
     *
     * @param a        input-side value
     * @param b        candidate-side value; for {@link FieldKind#FULL_TEXT}, the renewal full text
     * @param kind     which field is being compared
     * @param language catalog language code (eng, fre, ger, spa, ita)
     * @return similarity between 0 and 100
     */
    double score(String a, String b, FieldKind kind, String language);
}
