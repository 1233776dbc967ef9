package com.publicdomain.matching.config;

/**
 * Thrown when matching configuration is missing, malformed, or yields unusable weights.
 * Fatal for a run.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
