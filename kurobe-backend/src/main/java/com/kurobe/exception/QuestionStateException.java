package com.kurobe.exception;

/**
 * Thrown when a question is not in a state that allows the requested transition, e.g. retrying
 * a question that has not failed.
 */
public class QuestionStateException extends KurobeException {
    public QuestionStateException(String message) {
        super(message);
    }
}
