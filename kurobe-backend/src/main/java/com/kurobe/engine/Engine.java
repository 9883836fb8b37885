package com.kurobe.engine;

import com.kurobe.model.EngineConfig;
import com.kurobe.model.EngineType;

/**
 * Lifecycle shared by every engine role.
 *
 * <p>{@link #initialize()} runs exactly once before first use, {@link #validate()} may be called
 * at any time and has no side effects, {@link #shutdown()} is terminal and idempotent.
 */
public interface Engine {

    EngineType getType();

    EngineConfig getConfig();

    default String getName() {
        return getConfig().getName();
    }

    /**
     * Prepare the engine for use.
     *
     * @throws com.kurobe.exception.EngineStateException if already initialized or shut down
     */
    void initialize();

    /**
     * Health and configuration check. Never throws.
     *
     * @return true if the engine is usable
     */
    boolean validate();

    void shutdown();

    boolean isReady();
}
