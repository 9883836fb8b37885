package com.kurobe.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Complexity {
    SIMPLE,
    MODERATE,
    COMPLEX;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
