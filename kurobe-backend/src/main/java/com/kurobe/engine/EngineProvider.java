package com.kurobe.engine;

import com.kurobe.model.EngineConfig;
import com.kurobe.model.EngineType;

/**
 * An engine implementation contributed as a Spring bean. Every provider bean is registered with
 * the {@link EngineRegistry} at startup under {@link #type()} and {@link #name()}.
 */
public interface EngineProvider {

    EngineType type();

    String name();

    Engine create(EngineConfig config);
}
