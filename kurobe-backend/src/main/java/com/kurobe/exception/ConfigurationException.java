package com.kurobe.exception;

/**
 * Thrown for unknown backend types and malformed connection or engine configuration.
 */
public class ConfigurationException extends KurobeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
