package com.publicdomain.matching.batch;

/**
 * Builds the context for a new worker. Chosen once when the pool starts.
 */
public interface WorkerInitializer {

    /**
     * @throws WorkerInitializationException if the worker cannot be set up; fatal to the run
     */
    WorkerContext initialize(String workerId);
}
