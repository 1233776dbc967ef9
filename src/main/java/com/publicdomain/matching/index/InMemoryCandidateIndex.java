package com.publicdomain.matching.index;

import com.publicdomain.matching.core.model.CandidateRecord;
import com.publicdomain.matching.core.model.InputRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Candidate index held in memory and keyed by {@link BlockingKeyStrategy} keys.
 *
 * <p>Lookups rank candidates by the number of keys they share with the input, most
 * first, then by insertion order, and return at most {@code maxCandidates}.
 * The index is immutable once built.</p>
 */
public class InMemoryCandidateIndex implements CandidateIndex {

    public static final int DEFAULT_MAX_CANDIDATES = 1000;

    private final List<CandidateRecord> candidates;
    private final Map<String, List<Integer>> postings;
    private final BlockingKeyStrategy keyStrategy;
    private final int maxCandidates;

    private InMemoryCandidateIndex(Builder builder) {
        this.candidates = List.copyOf(builder.candidates);
        this.keyStrategy = builder.keyStrategy;
        this.maxCandidates = builder.maxCandidates;

        Map<String, List<Integer>> index = new HashMap<>();
        for (int i = 0; i < candidates.size(); i++) {
            CandidateRecord c = candidates.get(i);
            String author = c.getMainAuthor().isBlank() ? c.getAuthor() : c.getMainAuthor();
            for (String key : keyStrategy.generateKeys(c.getTitle(), author, c.getNormalizedLccn())) {
                index.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
            }
            if (!c.getAuthor().isBlank() && !c.getMainAuthor().isBlank()) {
                for (String key : keyStrategy.generateKeys(null, c.getAuthor(), null)) {
                    List<Integer> positions = index.computeIfAbsent(key, k -> new ArrayList<>());
                    if (positions.isEmpty() || positions.get(positions.size() - 1) != i) {
                        positions.add(i);
                    }
                }
            }
        }
        this.postings = index;
    }

    @Override
    public List<CandidateRecord> lookup(InputRecord record, int yearTolerance) {
        Map<Integer, Integer> shared = new HashMap<>();
        for (String key : inputKeys(record)) {
            for (int position : postings.getOrDefault(key, List.of())) {
                if (withinTolerance(record.getYear(), candidates.get(position).getYear(), yearTolerance)) {
                    shared.merge(position, 1, Integer::sum);
                }
            }
        }
        return shared.entrySet().stream()
                .sorted(Comparator.<Map.Entry<Integer, Integer>>comparingInt(Map.Entry::getValue).reversed()
                        .thenComparingInt(Map.Entry::getKey))
                .limit(maxCandidates)
                .map(e -> candidates.get(e.getKey()))
                .toList();
    }

    private Set<String> inputKeys(InputRecord record) {
        Set<String> keys = new LinkedHashSet<>(keyStrategy.generateKeys(record.getTitle(),
                record.getMainAuthor().isBlank() ? record.getAuthor() : record.getMainAuthor(),
                record.getNormalizedLccn()));
        if (!record.getAuthor().isBlank() && !record.getMainAuthor().isBlank()) {
            keys.addAll(keyStrategy.generateKeys(null, record.getAuthor(), null));
        }
        return keys;
    }

    private static boolean withinTolerance(Integer inputYear, Integer candidateYear, int tolerance) {
        return inputYear == null || candidateYear == null || Math.abs(inputYear - candidateYear) <= tolerance;
    }

    @Override
    public int size() {
        return candidates.size();
    }

    public List<CandidateRecord> getCandidates() {
        return candidates;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<CandidateRecord> candidates = new ArrayList<>();
        private BlockingKeyStrategy keyStrategy = new DefaultBlockingKeyStrategy();
        private int maxCandidates = DEFAULT_MAX_CANDIDATES;

        public Builder add(CandidateRecord candidate) {
            candidates.add(candidate);
            return this;
        }

        public Builder addAll(Collection<CandidateRecord> all) {
            candidates.addAll(all);
            return this;
        }

        public Builder keyStrategy(BlockingKeyStrategy keyStrategy) {
            this.keyStrategy = keyStrategy;
            return this;
        }

        public Builder maxCandidates(int maxCandidates) {
            if (maxCandidates < 1) {
                throw new IllegalArgumentException("maxCandidates must be at least 1");
            }
            this.maxCandidates = maxCandidates;
            return this;
        }

        public InMemoryCandidateIndex build() {
            return new InMemoryCandidateIndex(this);
        }
    }
}
