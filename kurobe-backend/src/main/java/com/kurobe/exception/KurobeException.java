package com.kurobe.exception;

/**
 * Base type for failures raised by connectors, the connection pool and the engine registry.
 */
public class KurobeException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public KurobeException(String message) {
        super(message);
    }

    /**
     * Create a new exception with a cause.
     *
     * @param message error message
     * @param cause underlying cause
     */
    public KurobeException(String message, Throwable cause) {
        super(message, cause);
    }
}
