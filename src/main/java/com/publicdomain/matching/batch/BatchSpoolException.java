package com.publicdomain.matching.batch;

/**
 * Thrown when a spooled batch, result or stats file cannot be written or read.
 */
public class BatchSpoolException extends RuntimeException {

    public BatchSpoolException(String message) {
        super(message);
    }

    public BatchSpoolException(String message, Throwable cause) {
        super(message, cause);
    }
}
