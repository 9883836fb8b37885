package com.kurobe.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Processing state of a question: pending, then processing, then completed or failed.
 */
public enum QuestionStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
