package com.kurobe.engine;

import com.kurobe.exception.EngineStateException;
import com.kurobe.model.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lifecycle guard for engine implementations.
 *
 * <p>Subclasses implement the {@code do*} hooks and call {@link #requireReady()} at the top of
 * each role operation.
 */
public abstract class AbstractEngine implements Engine {

    private enum State {
        CREATED,
        READY,
        SHUT_DOWN
    }

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final EngineConfig config;
    private volatile State state = State.CREATED;

    protected AbstractEngine(EngineConfig config) {
        this.config = config;
    }

    @Override
    public EngineConfig getConfig() {
        return config;
    }

    @Override
    public final synchronized void initialize() {
        if (state != State.CREATED) {
            throw new EngineStateException("Engine " + describe() + " cannot be initialized in state " + state);
        }
        doInitialize();
        state = State.READY;
    }

    @Override
    public final boolean validate() {
        if (state == State.SHUT_DOWN) {
            return false;
        }
        try {
            return doValidate();
        } catch (RuntimeException e) {
            log.warn("Engine validation failed: engine={}, error={}", describe(), e.getMessage());
            return false;
        }
    }

    @Override
    public final synchronized void shutdown() {
        if (state == State.SHUT_DOWN) {
            return;
        }
        try {
            if (state == State.READY) {
                doShutdown();
            }
        } finally {
            state = State.SHUT_DOWN;
        }
    }

    @Override
    public boolean isReady() {
        return state == State.READY;
    }

    protected void requireReady() {
        State current = state;
        if (current != State.READY) {
            throw new EngineStateException("Engine " + describe() + " is not ready (state " + current + ")");
        }
    }

    protected void doInitialize() {
    }

    protected boolean doValidate() {
        return true;
    }

    protected void doShutdown() {
    }

    protected String describe() {
        return getType().id() + ":" + config.getName();
    }
}
