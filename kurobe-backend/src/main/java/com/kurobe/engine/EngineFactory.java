package com.kurobe.engine;

import com.kurobe.model.EngineConfig;

/**
 * Constructs an uninitialized engine from its config.
 *
 * @param <T> engine role
 */
@FunctionalInterface
public interface EngineFactory<T extends Engine> {
    T create(EngineConfig config);
}
