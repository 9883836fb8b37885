package com.kurobe.exception;

import com.kurobe.model.EngineType;

/**
 * Thrown when no constructor is registered for an engine type and provider name.
 */
public class UnknownProviderException extends KurobeException {
    private final EngineType engineType;
    private final String provider;

    public UnknownProviderException(EngineType engineType, String provider) {
        super("Unknown engine provider: " + provider + " for type: " + (engineType != null ? engineType.id() : null));
        this.engineType = engineType;
        this.provider = provider;
    }

    public EngineType getEngineType() {
        return engineType;
    }

    public String getProvider() {
        return provider;
    }
}
