package com.publicdomain.matching.batch;

/**
 * Thrown when a worker context cannot be created. Aborts the run.
 */
public class WorkerInitializationException extends RuntimeException {

    public WorkerInitializationException(String message) {
        super(message);
    }

    public WorkerInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
