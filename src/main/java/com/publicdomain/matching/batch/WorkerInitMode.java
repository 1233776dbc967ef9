package com.publicdomain.matching.batch;

/**
 * How worker contexts obtain their indexes.
 */
public enum WorkerInitMode {
    /** Indexes are loaded once by the orchestrator and shared read-only by every worker. */
    SHARED,
    /** Each worker loads its own copy from the index provider. */
    PER_WORKER
}
