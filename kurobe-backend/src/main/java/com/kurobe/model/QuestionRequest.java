package com.kurobe.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * What to answer and which connection and engines to answer it with.
 *
 * <p>{@code semanticEngine} is optional; without it the analysis, planning and summary steps are
 * skipped.
 */
@Value
@Builder(toBuilder = true)
public class QuestionRequest {
    String question;
    String connection;
    String textToSqlEngine;
    String visualizationEngine;
    String semanticEngine;
    Integer timeoutSeconds;
    @Builder.Default
    Map<String, Object> context = Map.of();
}
