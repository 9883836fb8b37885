package com.kurobe.config;

import com.kurobe.model.ConnectionConfig;
import com.kurobe.model.EngineConfig;
import com.kurobe.model.EngineType;

import java.util.List;

/**
 * Connections and engines declared in the bootstrap file.
 */
public record BootstrapConfig(List<ConnectionConfig> connections, List<EngineDefinition> engines) {

    public static final BootstrapConfig EMPTY = new BootstrapConfig(List.of(), List.of());

    public BootstrapConfig {
        connections = List.copyOf(connections);
        engines = List.copyOf(engines);
    }

    /**
     * One {@code engines:} entry: the role plus the engine config.
     */
    public record EngineDefinition(EngineType type, EngineConfig config) {
    }
}
