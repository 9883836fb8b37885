package com.kurobe.engine;

import com.kurobe.model.EngineType;
import com.kurobe.model.PanelSpec;
import com.kurobe.model.QueryResult;

import java.util.List;
import java.util.Map;

/**
 * Recommends chart panels for a query result.
 */
public interface VisualizationEngine extends Engine {

    @Override
    default EngineType getType() {
        return EngineType.VISUALIZATION;
    }

    /**
     * @param result query result to chart
     * @param question question the result answers, may be null
     * @param context free-form caller context, may be empty
     * @return panels, best recommendation first
     */
    List<PanelSpec> recommendVisualization(QueryResult result, String question, Map<String, Object> context);

    /**
     * @param panel panel to revise
     * @param feedback requested changes
     * @return revised panel
     */
    PanelSpec optimizeVisualization(PanelSpec panel, Map<String, Object> feedback);
}
