package com.publicdomain.matching.matching;

import com.publicdomain.matching.core.model.CandidateRecord;
import com.publicdomain.matching.core.model.InputRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Exact-identifier fast path. A normalized LCCN shared by input and candidate is
 * authoritative, so it is checked before any fuzzy scoring.
 */
public class LccnMatcher {
    private static final Logger log = LoggerFactory.getLogger(LccnMatcher.class);

    private final boolean enabled;

    public LccnMatcher(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * Returns the first candidate, in the given order, whose normalized LCCN equals the input's.
     */
    public Optional<CandidateRecord> check(InputRecord input, List<CandidateRecord> candidates) {
        if (!enabled || !input.hasLccn()) {
            return Optional.empty();
        }
        String lccn = input.getNormalizedLccn();
        for (CandidateRecord candidate : candidates) {
            if (lccn.equals(candidate.getNormalizedLccn())) {
                log.debug("lccn.match lccn={} candidate={}", lccn, candidate.getSourceId());
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public boolean isEnabled() {
        return enabled;
    }
}
