package com.publicdomain.matching.matching;

import com.publicdomain.matching.config.MatchThresholds;
import com.publicdomain.matching.config.MatchingConfig;
import com.publicdomain.matching.core.model.CandidateRecord;
import com.publicdomain.matching.core.model.FieldKind;
import com.publicdomain.matching.core.model.GenericTitleInfo;
import com.publicdomain.matching.core.model.InputRecord;
import com.publicdomain.matching.core.model.MatchResult;
import com.publicdomain.matching.core.model.ScoreBreakdown;
import com.publicdomain.matching.similarity.DefaultFieldSimilarity;
import com.publicdomain.matching.similarity.FieldSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds the best registration or renewal candidate for one input record.
 *
 * <p>An LCCN shared by the input and a candidate wins outright. Otherwise candidates are
 * scored in index order. In threshold mode each field score must clear its threshold and
 * a near-perfect candidate ends the scan early. In score-everything mode every candidate
 * within the year tolerance is scored and the best combined score wins if it reaches the
 * optional minimum. Ties keep the earlier candidate in both modes.</p>
 *
 * <p>Instances hold no per-call state and may be shared, but a worker normally owns one.</p>
 */
public class CoreMatcher {
    private static final Logger log = LoggerFactory.getLogger(CoreMatcher.class);

    private final MatchingConfig config;
    private final FieldSimilarity similarity;
    private final ScoreCombiner combiner;
    private final LccnMatcher lccnMatcher;
    private final GenericTitleDetector genericTitleDetector;
    private final DerivedWorkDetector derivedWorkDetector;
    private final CandidateScoringListener listener;

    public CoreMatcher(MatchingConfig config, GenericTitleDetector genericTitleDetector) {
        this(config, new DefaultFieldSimilarity(config), genericTitleDetector, CandidateScoringListener.NO_OP);
    }

    public CoreMatcher(MatchingConfig config, FieldSimilarity similarity,
                       GenericTitleDetector genericTitleDetector, CandidateScoringListener listener) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.similarity = Objects.requireNonNull(similarity, "similarity is required");
        this.combiner = new ScoreCombiner(config);
        this.lccnMatcher = new LccnMatcher(config.isLccnMatchingEnabled());
        this.genericTitleDetector = genericTitleDetector;
        this.derivedWorkDetector = new DerivedWorkDetector();
        this.listener = listener != null ? listener : CandidateScoringListener.NO_OP;
    }

    /**
     * Threshold mode.
     */
    public Optional<MatchResult> findBestMatch(InputRecord input, List<CandidateRecord> candidates,
                                               MatchThresholds thresholds) {
        Objects.requireNonNull(thresholds, "thresholds is required");
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        Comparison cmp = new Comparison(input);
        Optional<MatchResult> lccn = lccnFastPath(cmp, candidates);
        if (lccn.isPresent()) {
            return lccn;
        }

        MatchResult best = null;
        for (CandidateRecord candidate : candidates) {
            if (!withinYearTolerance(input, candidate, thresholds.yearTolerance())) {
                continue;
            }

            double title = similarity.score(input.getTitle(), candidate.getTitle(), FieldKind.TITLE, cmp.language);
            if (title < thresholds.title()) {
                listener.candidateScored(input, candidate, new ScoreBreakdown(title, 0, 0, 0), false);
                continue;
            }

            boolean authorOnBothSides = input.hasAuthorData() && candidate.hasAuthorData();
            double author = authorScore(input, candidate, cmp.language);
            if (authorOnBothSides && author < thresholds.author()) {
                listener.candidateScored(input, candidate, new ScoreBreakdown(title, author, 0, 0), false);
                continue;
            }

            Double publisher = publisherScore(input, candidate, cmp.language);
            if (publisher != null && thresholds.publisher() != null && publisher < thresholds.publisher()) {
                listener.candidateScored(input, candidate, new ScoreBreakdown(title, author, publisher, 0), false);
                continue;
            }

            GenericTitleInfo generic = cmp.genericInfo(candidate);
            ScoreBreakdown scores = combine(cmp, candidate, title, author, authorOnBothSides, publisher, generic);
            listener.candidateScored(input, candidate, scores, true);
            MatchResult result = MatchBuilder.similarityMatch(input, candidate, scores, generic);

            boolean anyAuthorData = input.hasAuthorData() || candidate.hasAuthorData();
            if (isEarlyExit(title, author, anyAuthorData, publisher, thresholds)) {
                log.debug("match.earlyExit input={} candidate={} title={}",
                        input.getSourceId(), candidate.getSourceId(), title);
                return Optional.of(result);
            }
            if (best == null || scores.combined() > best.combinedScore()) {
                best = result;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Score-everything mode: no field thresholds and no early exit.
     *
     * @param minimumCombinedScore best match is rejected below this score; {@code null} accepts any
     */
    public Optional<MatchResult> findBestMatchIgnoringThresholds(InputRecord input, List<CandidateRecord> candidates,
                                                                 int yearTolerance, Double minimumCombinedScore) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        Comparison cmp = new Comparison(input);
        Optional<MatchResult> lccn = lccnFastPath(cmp, candidates);
        if (lccn.isPresent()) {
            return lccn;
        }

        MatchResult best = null;
        for (CandidateRecord candidate : candidates) {
            if (!withinYearTolerance(input, candidate, yearTolerance)) {
                continue;
            }
            double title = similarity.score(input.getTitle(), candidate.getTitle(), FieldKind.TITLE, cmp.language);
            boolean authorOnBothSides = input.hasAuthorData() && candidate.hasAuthorData();
            double author = authorScore(input, candidate, cmp.language);
            Double publisher = publisherScore(input, candidate, cmp.language);

            GenericTitleInfo generic = cmp.genericInfo(candidate);
            ScoreBreakdown scores = combine(cmp, candidate, title, author, authorOnBothSides, publisher, generic);
            listener.candidateScored(input, candidate, scores, true);
            if (best == null || scores.combined() > best.combinedScore()) {
                best = MatchBuilder.similarityMatch(input, candidate, scores, generic);
            }
        }

        if (best != null && minimumCombinedScore != null && best.combinedScore() < minimumCombinedScore) {
            log.debug("match.belowMinimum input={} best={} minimum={}",
                    input.getSourceId(), best.combinedScore(), minimumCombinedScore);
            return Optional.empty();
        }
        return Optional.ofNullable(best);
    }

    private Optional<MatchResult> lccnFastPath(Comparison cmp, List<CandidateRecord> candidates) {
        return lccnMatcher.check(cmp.input, candidates).map(candidate -> {
            InputRecord input = cmp.input;
            double title = similarity.score(input.getTitle(), candidate.getTitle(), FieldKind.TITLE, cmp.language);
            double author = authorScore(input, candidate, cmp.language);
            Double publisher = publisherScore(input, candidate, cmp.language);
            ScoreBreakdown diagnostics = ScoreBreakdown.forLccnMatch(title, author, publisher == null ? 0.0 : publisher);
            listener.candidateScored(input, candidate, diagnostics, true);
            return MatchBuilder.lccnMatch(input, candidate, title, author,
                    publisher == null ? 0.0 : publisher, cmp.genericInfo(candidate));
        });
    }

    private ScoreBreakdown combine(Comparison cmp, CandidateRecord candidate, double title, double author,
                                   boolean authorOnBothSides, Double publisher, GenericTitleInfo generic) {
        double publisherScore = publisher == null ? 0.0 : publisher;
        ScoreInputs inputs = new ScoreInputs(title, author, publisherScore, authorOnBothSides, publisher != null,
                generic != null && generic.hasGenericTitle(), false, null, null);
        if (config.isDerivedWorkDetectionEnabled()) {
            inputs = inputs.withDerivedWorks(cmp.derivedWork(),
                    derivedWorkDetector.detect(candidate.getTitle(), cmp.language));
        }
        return new ScoreBreakdown(title, author, publisherScore, combiner.combine(inputs));
    }

    private double authorScore(InputRecord input, CandidateRecord candidate, String language) {
        if (!input.hasAuthorData() && !candidate.hasAuthorData()) {
            return 0.0;
        }
        double best = similarity.score(input.getAuthor(), candidate.getAuthor(), FieldKind.AUTHOR, language);
        best = Math.max(best, similarity.score(input.getMainAuthor(), candidate.getMainAuthor(),
                FieldKind.AUTHOR, language));
        best = Math.max(best, similarity.score(input.getMainAuthor(), candidate.getAuthor(),
                FieldKind.AUTHOR, language));
        best = Math.max(best, similarity.score(input.getAuthor(), candidate.getMainAuthor(),
                FieldKind.AUTHOR, language));
        return best;
    }

    /**
     * Publisher score, or {@code null} when there is nothing to compare.
     */
    private Double publisherScore(InputRecord input, CandidateRecord candidate, String language) {
        if (!input.hasPublisher() || !candidate.hasPublisherText()) {
            return null;
        }
        if (candidate.hasPublisher()) {
            return similarity.score(input.getPublisher(), candidate.getPublisher(), FieldKind.PUBLISHER, language);
        }
        return similarity.score(input.getPublisher(), candidate.getFullText(), FieldKind.FULL_TEXT, language);
    }

    private static boolean withinYearTolerance(InputRecord input, CandidateRecord candidate, int tolerance) {
        if (input.getYear() == null || candidate.getYear() == null) {
            return true;
        }
        return Math.abs(input.getYear() - candidate.getYear()) <= tolerance;
    }

    /**
     * Author data on either side must be confirmed before stopping; a one-sided author
     * scores 0 and therefore never allows an early exit.
     */
    private static boolean isEarlyExit(double title, double author, boolean anyAuthorData,
                                       Double publisher, MatchThresholds thresholds) {
        if (title < thresholds.earlyExitTitle()) {
            return false;
        }
        if (anyAuthorData && author < thresholds.earlyExitAuthor()) {
            return false;
        }
        return publisher == null || thresholds.earlyExitPublisher() == null
                || publisher >= thresholds.earlyExitPublisher();
    }

    /**
     * Per-call state for one input record.
     */
    private final class Comparison {
        private final InputRecord input;
        private final String language;
        private final boolean inputGeneric;
        private final String inputReason;
        private DerivedWorkInfo derivedWork;

        private Comparison(InputRecord input) {
            this.input = Objects.requireNonNull(input, "input is required");
            this.language = input.languageOr(config.getDefaultLanguage());
            if (detectionEnabled()) {
                this.inputGeneric = genericTitleDetector.isGeneric(input.getTitle(), language);
                this.inputReason = genericTitleDetector.detectionReason(input.getTitle(), language);
            } else {
                this.inputGeneric = false;
                this.inputReason = null;
            }
        }

        private GenericTitleInfo genericInfo(CandidateRecord candidate) {
            if (!detectionEnabled()) {
                return null;
            }
            boolean candidateGeneric = genericTitleDetector.isGeneric(candidate.getTitle(), language);
            return new GenericTitleInfo(inputGeneric, inputGeneric ? inputReason : null, candidateGeneric,
                    candidateGeneric ? genericTitleDetector.detectionReason(candidate.getTitle(), language) : null);
        }

        private DerivedWorkInfo derivedWork() {
            if (derivedWork == null) {
                derivedWork = derivedWorkDetector.detect(input.getTitle(), language);
            }
            return derivedWork;
        }
    }

    private boolean detectionEnabled() {
        return genericTitleDetector != null && config.isGenericTitleDetectionEnabled();
    }

    public MatchingConfig getConfig() {
        return config;
    }
}
