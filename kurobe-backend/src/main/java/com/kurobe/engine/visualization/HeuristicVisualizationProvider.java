package com.kurobe.engine.visualization;

import com.kurobe.engine.Engine;
import com.kurobe.engine.EngineProvider;
import com.kurobe.model.EngineConfig;
import com.kurobe.model.EngineType;
import org.springframework.stereotype.Component;

@Component
public class HeuristicVisualizationProvider implements EngineProvider {

    @Override
    public EngineType type() {
        return EngineType.VISUALIZATION;
    }

    @Override
    public String name() {
        return HeuristicVisualizationEngine.PROVIDER;
    }

    @Override
    public Engine create(EngineConfig config) {
        return new HeuristicVisualizationEngine(config);
    }
}
