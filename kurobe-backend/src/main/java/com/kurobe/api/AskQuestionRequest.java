package com.kurobe.api;

import com.kurobe.model.QuestionRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
public class AskQuestionRequest {
    @NotBlank(message = "Question is required")
    private String question;

    @NotBlank(message = "Connection is required")
    private String connection;

    private String textToSqlEngine;
    private String visualizationEngine;
    private String semanticEngine;

    @Positive(message = "Timeout must be positive")
    private Integer timeoutSeconds;

    private Map<String, Object> context = new LinkedHashMap<>();

    public QuestionRequest toQuestionRequest() {
        return QuestionRequest.builder()
                .question(question)
                .connection(connection)
                .textToSqlEngine(textToSqlEngine)
                .visualizationEngine(visualizationEngine)
                .semanticEngine(semanticEngine)
                .timeoutSeconds(timeoutSeconds)
                .context(context != null ? context : Map.of())
                .build();
    }
}
