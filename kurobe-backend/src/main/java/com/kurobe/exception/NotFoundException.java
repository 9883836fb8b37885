package com.kurobe.exception;

/**
 * Thrown when a named connection, engine or question cannot be resolved.
 */
public class NotFoundException extends KurobeException {
    public NotFoundException(String message) {
        super(message);
    }
}
