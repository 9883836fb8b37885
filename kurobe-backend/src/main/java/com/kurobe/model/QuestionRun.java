package com.kurobe.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Snapshot of one question and everything produced while answering it.
 */
@Value
@Builder(toBuilder = true)
public class QuestionRun {
    String id;
    QuestionRequest request;
    QuestionStatus status;
    int attempts;
    QuestionAnalysis analysis;
    ExecutionPlan plan;
    SqlGenerationResult sql;
    QueryResult result;
    List<PanelSpec> panels;
    String summary;
    String error;
    OffsetDateTime createdAt;
    OffsetDateTime updatedAt;
    OffsetDateTime completedAt;
}
