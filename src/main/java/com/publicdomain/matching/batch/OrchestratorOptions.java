package com.publicdomain.matching.batch;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Options for batch orchestration.
 * Use {@link #builder()} to create instances or {@link #defaults()} for sensible defaults.
 */
public class OrchestratorOptions {

    public static final int DEFAULT_BATCH_SIZE = 200;
    public static final Duration DEFAULT_BATCH_TIMEOUT = Duration.ofSeconds(900);

    private final int batchSize;
    private final int workers;
    private final Duration batchTimeout;
    private final WorkerInitMode initMode;
    private final Integer recycleAfterBatches;
    private final Path spoolDirectory;

    private OrchestratorOptions(Builder builder) {
        this.batchSize = builder.batchSize;
        this.workers = builder.workers;
        this.batchTimeout = builder.batchTimeout;
        this.initMode = builder.initMode;
        this.recycleAfterBatches = builder.recycleAfterBatches;
        this.spoolDirectory = builder.spoolDirectory;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getWorkers() {
        return workers;
    }

    public Duration getBatchTimeout() {
        return batchTimeout;
    }

    public WorkerInitMode getInitMode() {
        return initMode;
    }

    /**
     * Fixed recycling interval, or {@code null} to let {@link WorkerRecyclingPolicy} decide.
     */
    public Integer getRecycleAfterBatches() {
        return recycleAfterBatches;
    }

    public Path getSpoolDirectory() {
        return spoolDirectory;
    }

    public static OrchestratorOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "OrchestratorOptions{" +
                "batchSize=" + batchSize +
                ", workers=" + workers +
                ", batchTimeout=" + batchTimeout +
                ", initMode=" + initMode +
                ", recycleAfterBatches=" + recycleAfterBatches +
                ", spoolDirectory=" + spoolDirectory +
                '}';
    }

    public static class Builder {
        private int batchSize = DEFAULT_BATCH_SIZE;
        private int workers = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        private Duration batchTimeout = DEFAULT_BATCH_TIMEOUT;
        private WorkerInitMode initMode = WorkerInitMode.SHARED;
        private Integer recycleAfterBatches;
        private Path spoolDirectory = Path.of(System.getProperty("java.io.tmpdir"), "public-domain-matcher");

        public Builder batchSize(int batchSize) {
            if (batchSize < 1) {
                throw new IllegalArgumentException("batchSize must be at least 1");
            }
            this.batchSize = batchSize;
            return this;
        }

        public Builder workers(int workers) {
            if (workers < 1) {
                throw new IllegalArgumentException("workers must be at least 1");
            }
            this.workers = workers;
            return this;
        }

        public Builder batchTimeout(Duration batchTimeout) {
            Objects.requireNonNull(batchTimeout, "batchTimeout");
            if (batchTimeout.isZero() || batchTimeout.isNegative()) {
                throw new IllegalArgumentException("batchTimeout must be positive");
            }
            this.batchTimeout = batchTimeout;
            return this;
        }

        public Builder initMode(WorkerInitMode initMode) {
            this.initMode = Objects.requireNonNull(initMode, "initMode");
            return this;
        }

        public Builder recycleAfterBatches(Integer recycleAfterBatches) {
            if (recycleAfterBatches != null && recycleAfterBatches < 0) {
                throw new IllegalArgumentException("recycleAfterBatches must be non-negative");
            }
            this.recycleAfterBatches = recycleAfterBatches;
            return this;
        }

        public Builder spoolDirectory(Path spoolDirectory) {
            this.spoolDirectory = Objects.requireNonNull(spoolDirectory, "spoolDirectory");
            return this;
        }

        public OrchestratorOptions build() {
            return new OrchestratorOptions(this);
        }
    }
}
