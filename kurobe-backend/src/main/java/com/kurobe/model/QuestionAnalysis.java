package com.kurobe.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Intent and entities a semantic engine extracted from a question.
 */
@Value
@Builder
public class QuestionAnalysis {
    String intent;
    @Singular
    List<Map<String, Object>> entities;
    Complexity complexity;
    String suggestedApproach;
    @Singular("metadataEntry")
    Map<String, Object> metadata;
}
