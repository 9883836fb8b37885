package com.kurobe.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
public class QueryRequest {
    @NotBlank(message = "SQL is required")
    private String sql;

    private Map<String, Object> parameters = new LinkedHashMap<>();

    @Positive(message = "Timeout must be positive")
    private Integer timeoutSeconds;
}
