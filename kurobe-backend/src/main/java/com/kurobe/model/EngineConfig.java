package com.kurobe.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Identifies which engine implementation to build and how to configure it.
 */
@Value
@Builder(toBuilder = true)
public class EngineConfig {
    String name;
    String version;
    String provider;
    @Singular("setting")
    Map<String, Object> config;
    @Builder.Default
    boolean enabled = true;

    public String getString(String key, String defaultValue) {
        Object v = config.get(key);
        return v != null ? String.valueOf(v) : defaultValue;
    }
}
