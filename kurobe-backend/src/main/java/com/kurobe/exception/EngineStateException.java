package com.kurobe.exception;

/**
 * Thrown when an engine is used outside its lifecycle, e.g. before initialize or after shutdown.
 */
public class EngineStateException extends KurobeException {
    public EngineStateException(String message) {
        super(message);
    }
}
