package com.kurobe.engine;

import com.kurobe.model.EngineType;
import com.kurobe.model.ExecutionPlan;
import com.kurobe.model.PanelSpec;
import com.kurobe.model.QuestionAnalysis;

import java.util.List;
import java.util.Map;

/**
 * Understands questions, plans how to answer them and summarizes the outcome.
 */
public interface SemanticEngine extends Engine {

    @Override
    default EngineType getType() {
        return EngineType.SEMANTIC;
    }

    QuestionAnalysis analyzeQuestion(String question, Map<String, Object> context);

    ExecutionPlan generatePlan(String question, QuestionAnalysis analysis, List<String> availableConnections);

    String summarizeResults(String question, List<PanelSpec> panels, Map<String, Object> context);
}
