package com.logfire.sdk.config;

/**
 * Thrown when the SDK configuration is invalid. Raised eagerly, before any pipeline is built.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
