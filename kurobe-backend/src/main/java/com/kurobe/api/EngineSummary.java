package com.kurobe.api;

import com.kurobe.engine.Engine;
import com.kurobe.model.EngineType;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class EngineSummary {
    private EngineType type;
    private String name;
    private String provider;
    private String version;
    private boolean ready;

    public static EngineSummary of(Engine engine) {
        return EngineSummary.builder()
                .type(engine.getType())
                .name(engine.getName())
                .provider(engine.getConfig().getProvider())
                .version(engine.getConfig().getVersion())
                .ready(engine.isReady())
                .build();
    }
}
