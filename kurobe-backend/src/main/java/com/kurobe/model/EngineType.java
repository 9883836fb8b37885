package com.kurobe.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.kurobe.exception.ConfigurationException;

import java.util.Locale;

/**
 * Engine roles known to the registry.
 */
public enum EngineType {
    TEXT_TO_SQL("text_to_sql"),
    VISUALIZATION("visualization"),
    SEMANTIC("semantic");

    private final String id;

    EngineType(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public static EngineType fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new ConfigurationException("Engine type is required");
        }
        String v = id.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (EngineType t : values()) {
            if (t.id.equals(v)) {
                return t;
            }
        }
        throw new ConfigurationException("Unsupported engine type: " + id);
    }
}
