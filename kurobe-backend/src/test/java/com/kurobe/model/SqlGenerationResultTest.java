package com.kurobe.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqlGenerationResultTest {

    @Test
    void metadataKeepsNullValuesAndOrder() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("model", "gpt");
        metadata.put("finish_reason", null);
        metadata.put("tokens", 42);

        SqlGenerationResult result = SqlGenerationResult.builder()
                .sql("SELECT 1")
                .confidence(0.5)
                .metadata(metadata)
                .build();
        metadata.put("late", true);

        assertThat(result.getMetadata()).containsExactly(
                Map.entry("model", "gpt"), Map.entry("finish_reason", null), Map.entry("tokens", 42));
        assertThatThrownBy(() -> result.getMetadata().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void confidenceOutsideUnitIntervalIsRejected() {
        assertThatThrownBy(() -> SqlGenerationResult.builder().sql("SELECT 1").confidence(1.5).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(SqlGenerationResult.builder().sql("SELECT 1").build().getMetadata()).isEmpty();
    }
}
