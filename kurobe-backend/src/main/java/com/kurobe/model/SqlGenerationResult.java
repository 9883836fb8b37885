package com.kurobe.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of a Text-to-SQL engine. {@code confidence} is always within [0, 1]; metadata keeps the
 * engine's key order and may hold null values.
 */
@Value
public class SqlGenerationResult {
    String sql;
    String connectionId;
    double confidence;
    String explanation;
    Map<String, Object> metadata;

    @Builder
    private SqlGenerationResult(String sql, String connectionId, double confidence, String explanation, Map<String, Object> metadata) {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        this.sql = sql;
        this.connectionId = connectionId;
        this.confidence = confidence;
        this.explanation = explanation;
        this.metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }
}
