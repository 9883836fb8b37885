package com.kurobe.exception;

/**
 * Thrown when a connection name is already taken in the pool.
 */
public class DuplicateNameException extends KurobeException {
    public DuplicateNameException(String message) {
        super(message);
    }
}
