package com.kurobe.engine;

import com.kurobe.model.ColumnInfo;
import com.kurobe.model.EngineType;
import com.kurobe.model.SqlGenerationResult;

import java.util.List;
import java.util.Map;

/**
 * Turns a natural-language question into SQL.
 */
public interface TextToSqlEngine extends Engine {

    @Override
    default EngineType getType() {
        return EngineType.TEXT_TO_SQL;
    }

    /**
     * Generate SQL for a question.
     *
     * @param question natural-language question
     * @param context free-form caller context, may be empty
     * @param connectionId target connection, may be null
     * @param schemaHints {@code schema -> table -> columns} of the target, may be null
     * @return generated SQL with a confidence in [0, 1]
     */
    SqlGenerationResult generateSql(String question, Map<String, Object> context, String connectionId,
                                    Map<String, Map<String, List<ColumnInfo>>> schemaHints);

    default SqlGenerationResult generateSql(String question) {
        return generateSql(question, Map.of(), null, null);
    }

    /**
     * Describe what a query does in plain language.
     *
     * @param sql query text
     * @return explanation
     */
    String explainQuery(String sql);
}
