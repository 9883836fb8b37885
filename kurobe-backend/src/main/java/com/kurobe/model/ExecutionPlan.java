package com.kurobe.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Ordered steps a semantic engine proposes for answering a question.
 * {@code estimatedTime} is in seconds.
 */
@Value
@Builder
public class ExecutionPlan {
    @Singular
    List<Map<String, Object>> steps;
    double estimatedTime;
    @Singular
    List<String> requiredEngines;
    @Singular("metadataEntry")
    Map<String, Object> metadata;
}
