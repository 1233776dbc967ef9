package com.publicdomain.matching.batch;

/**
 * Counters for one batch. {@code marcCount} counts every input record handled,
 * including skipped ones. Summation with {@link #plus(BatchStats)} is associative and
 * commutative, so batch completion order does not affect run totals.
 */
public record BatchStats(
        int marcCount,
        int registrationMatches,
        int renewalMatches,
        int lccnMatches,
        long totalComparisons,
        int usRecords,
        int nonUsRecords,
        int unknownCountryRecords,
        int skippedNoYear,
        int skippedOutOfRange,
        int skippedNonUs,
        int recordsWithErrors,
        long processingTimeMillis
) {
    public static final BatchStats EMPTY = new BatchStats(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

    public BatchStats plus(BatchStats other) {
        return new BatchStats(
                marcCount + other.marcCount,
                registrationMatches + other.registrationMatches,
                renewalMatches + other.renewalMatches,
                lccnMatches + other.lccnMatches,
                totalComparisons + other.totalComparisons,
                usRecords + other.usRecords,
                nonUsRecords + other.nonUsRecords,
                unknownCountryRecords + other.unknownCountryRecords,
                skippedNoYear + other.skippedNoYear,
                skippedOutOfRange + other.skippedOutOfRange,
                skippedNonUs + other.skippedNonUs,
                recordsWithErrors + other.recordsWithErrors,
                processingTimeMillis + other.processingTimeMillis);
    }

    public int totalSkipped() {
        return skippedNoYear + skippedOutOfRange + skippedNonUs;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable accumulator used while a batch runs. Confined to the worker thread.
     */
    public static class Builder {
        private int marcCount;
        private int registrationMatches;
        private int renewalMatches;
        private int lccnMatches;
        private long totalComparisons;
        private int usRecords;
        private int nonUsRecords;
        private int unknownCountryRecords;
        private int skippedNoYear;
        private int skippedOutOfRange;
        private int skippedNonUs;
        private int recordsWithErrors;
        private long processingTimeMillis;

        public Builder recordHandled() {
            marcCount++;
            return this;
        }

        public Builder registrationMatch() {
            registrationMatches++;
            return this;
        }

        public Builder renewalMatch() {
            renewalMatches++;
            return this;
        }

        public Builder lccnMatch() {
            lccnMatches++;
            return this;
        }

        public Builder comparisons(long count) {
            totalComparisons += count;
            return this;
        }

        public Builder usRecord() {
            usRecords++;
            return this;
        }

        public Builder nonUsRecord() {
            nonUsRecords++;
            return this;
        }

        public Builder unknownCountryRecord() {
            unknownCountryRecords++;
            return this;
        }

        public Builder skippedNoYear() {
            skippedNoYear++;
            return this;
        }

        public Builder skippedOutOfRange() {
            skippedOutOfRange++;
            return this;
        }

        public Builder skippedNonUs() {
            skippedNonUs++;
            return this;
        }

        public Builder recordWithError() {
            recordsWithErrors++;
            return this;
        }

        public Builder processingTimeMillis(long millis) {
            this.processingTimeMillis = millis;
            return this;
        }

        public BatchStats build() {
            return new BatchStats(marcCount, registrationMatches, renewalMatches, lccnMatches,
                    totalComparisons, usRecords, nonUsRecords, unknownCountryRecords,
                    skippedNoYear, skippedOutOfRange, skippedNonUs, recordsWithErrors,
                    processingTimeMillis);
        }
    }
}
