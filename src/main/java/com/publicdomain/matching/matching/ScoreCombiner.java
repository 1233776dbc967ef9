package com.publicdomain.matching.matching;

import com.publicdomain.matching.config.MatchingConfig;
import com.publicdomain.matching.config.ScoringScenario;
import com.publicdomain.matching.config.ScoringWeights;
import com.publicdomain.matching.config.ValidationThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines title, author and publisher scores into one 0-100 score.
 *
 * <p>Steps, in order: scenario weights; generic-title penalty on the title weight;
 * redistribution of a missing field's weight when the title is strong; weight
 * normalization; weighted sum; multi-field false-positive guards (skipped for LCCN
 * matches); derived-work penalty; LCCN boost. The result is clamped to [0, 100] and
 * rounded to two decimals.</p>
 */
public class ScoreCombiner {
    private static final Logger log = LoggerFactory.getLogger(ScoreCombiner.class);

    private static final double DERIVED_MISMATCH_FACTOR = 0.3;
    private static final double DERIVED_KIND_MISMATCH_FACTOR = 0.15;

    private final MatchingConfig config;

    public ScoreCombiner(MatchingConfig config) {
        this.config = config;
    }

    /**
     * Combines scores, treating a zero author or publisher score as an absent field.
     */
    public double combine(double title, double author, double publisher,
                          boolean hasGenericTitle, boolean hasLccnMatch) {
        return combine(ScoreInputs.of(title, author, publisher, hasGenericTitle, hasLccnMatch));
    }

    public double combine(ScoreInputs in) {
        double[] weights = weightsFor(in);
        double sum = weights[0] + weights[1] + weights[2];
        double combined = sum > 0
                ? (in.title() * weights[0] + in.author() * weights[1] + in.publisher() * weights[2]) / sum
                : 0.0;

        if (!in.lccnMatch()) {
            combined = applyValidation(combined, in);
            if (config.isDerivedWorkDetectionEnabled()) {
                combined = applyDerivedWorkPenalty(combined, in.inputDerived(), in.candidateDerived());
            }
        } else {
            combined += config.getLccnScoreBoost();
        }

        combined = Math.min(100.0, Math.max(0.0, combined));
        return Math.round(combined * 100.0) / 100.0;
    }

    private double[] weightsFor(ScoreInputs in) {
        boolean authorMissing = !in.authorPresent();
        boolean publisherMissing = !in.publisherPresent();

        if (authorMissing != publisherMissing && in.title() >= config.getRedistributionTitleFloor()) {
            if (authorMissing) {
                log.debug("Missing author with strong title ({}), redistributing weights", in.title());
                return new double[]{0.6, 0.0, 0.4};
            }
            log.debug("Missing publisher with strong title ({}), redistributing weights", in.title());
            return new double[]{0.7, 0.3, 0.0};
        }

        ScoringWeights w = config.scoringWeights(ScoringScenario.of(in.genericTitle(), in.publisherPresent()));
        double titleWeight = in.genericTitle() ? w.title() * config.getGenericTitlePenalty() : w.title();
        return new double[]{titleWeight, w.author(), w.publisher()};
    }

    private double applyValidation(double combined, ScoreInputs in) {
        ValidationThresholds v = config.getValidationThresholds();
        double title = in.title();
        double author = in.author();
        double publisher = in.publisher();

        if (author > v.authorOnlyAuthorMin() && title < v.authorOnlyTitleMax()
                && publisher < v.authorOnlyPublisherMax()) {
            log.debug("Author-only match (author={}, title={}), applying {}x penalty",
                    author, title, v.authorOnlyFactor());
            return combined * v.authorOnlyFactor();
        }
        if (publisher > v.publisherOnlyPublisherMin() && title < v.publisherOnlyTitleMax()
                && author < v.publisherOnlyAuthorMax()) {
            log.debug("Publisher-only match (publisher={}, title={}), applying {}x penalty",
                    publisher, title, v.publisherOnlyFactor());
            return combined * v.publisherOnlyFactor();
        }
        if (title >= v.weakTitleMin() && title < v.weakTitleMax()
                && author < v.weakTitleSupportMax() && publisher < v.weakTitleSupportMax()) {
            log.debug("Weak title-only match (title={}), capping at {}", title, v.weakTitleCap());
            return Math.min(combined, v.weakTitleCap());
        }
        return combined;
    }

    private double applyDerivedWorkPenalty(double combined, DerivedWorkInfo input, DerivedWorkInfo candidate) {
        if (input == null || candidate == null) {
            return combined;
        }
        double floor = config.getDerivedWorkConfidenceFloor();
        boolean confident = (input.derived() && input.confidence() >= floor)
                || (candidate.derived() && candidate.confidence() >= floor);
        if (!confident) {
            return combined;
        }
        if (input.derived() != candidate.derived()) {
            double factor = 1.0 - Math.max(input.confidence(), candidate.confidence()) * DERIVED_MISMATCH_FACTOR;
            log.debug("Derived work mismatch ({} vs {}), applying {}x penalty",
                    input.kind(), candidate.kind(), factor);
            return combined * factor;
        }
        if (!input.kind().equals(candidate.kind())) {
            double mean = (input.confidence() + candidate.confidence()) / 2.0;
            double factor = 1.0 - mean * DERIVED_KIND_MISMATCH_FACTOR;
            log.debug("Different derived work kinds ({} vs {}), applying {}x penalty",
                    input.kind(), candidate.kind(), factor);
            return combined * factor;
        }
        return combined;
    }
}
