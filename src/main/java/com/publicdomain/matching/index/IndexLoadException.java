package com.publicdomain.matching.index;

/**
 * Thrown when candidate indexes cannot be loaded. Fatal to a run.
 */
public class IndexLoadException extends RuntimeException {

    public IndexLoadException(String message) {
        super(message);
    }

    public IndexLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
