package com.kurobe.engine;

import com.kurobe.exception.ConfigurationException;
import com.kurobe.exception.UnknownProviderException;
import com.kurobe.model.EngineConfig;
import com.kurobe.model.EngineType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provider table per engine type plus the table of live, initialized engines.
 *
 * <p>Live engines are keyed {@code "<type>:<name>"}. Creating an engine under a key that is
 * already live replaces the old instance once the new one has initialized, and the old one is
 * shut down.
 */
public class EngineRegistry {
    private static final Logger log = LoggerFactory.getLogger(EngineRegistry.class);

    private static final Map<EngineType, Class<? extends Engine>> ROLES = Map.of(
            EngineType.TEXT_TO_SQL, TextToSqlEngine.class,
            EngineType.VISUALIZATION, VisualizationEngine.class,
            EngineType.SEMANTIC, SemanticEngine.class
    );

    private final Map<EngineType, Map<String, EngineFactory<? extends Engine>>> providers = new EnumMap<>(EngineType.class);
    private final Map<String, Engine> engines = new ConcurrentHashMap<>();

    public EngineRegistry() {
        for (EngineType type : EngineType.values()) {
            providers.put(type, new ConcurrentHashMap<>());
        }
    }

    public void registerTextToSqlEngine(String provider, EngineFactory<? extends TextToSqlEngine> factory) {
        registerProvider(EngineType.TEXT_TO_SQL, provider, factory);
    }

    public void registerVisualizationEngine(String provider, EngineFactory<? extends VisualizationEngine> factory) {
        registerProvider(EngineType.VISUALIZATION, provider, factory);
    }

    public void registerSemanticEngine(String provider, EngineFactory<? extends SemanticEngine> factory) {
        registerProvider(EngineType.SEMANTIC, provider, factory);
    }

    public void registerProvider(EngineProvider provider) {
        registerProvider(provider.type(), provider.name(), provider::create);
    }

    /**
     * Register a constructor. A later registration under the same provider name wins.
     *
     * @param type engine role
     * @param provider provider name referenced by {@link EngineConfig#getProvider()}
     * @param factory constructor
     */
    public void registerProvider(EngineType type, String provider, EngineFactory<? extends Engine> factory) {
        if (type == null || provider == null || provider.isBlank() || factory == null) {
            throw new ConfigurationException("Engine type, provider name and factory are required");
        }
        EngineFactory<? extends Engine> previous = providers.get(type).put(provider, factory);
        log.info("Engine provider registered: type={}, provider={}, replaced={}", type.id(), provider, previous != null);
    }

    public Set<String> registeredProviders(EngineType type) {
        return new TreeSet<>(providers.get(type).keySet());
    }

    /**
     * Construct, initialize and publish an engine.
     *
     * @param type engine role
     * @param config engine config; {@code provider} selects the constructor
     * @return the live engine
     * @throws UnknownProviderException if no constructor is registered for the type and provider
     * @throws RuntimeException whatever {@code initialize()} threw; nothing is published then
     */
    public Engine createEngine(EngineType type, EngineConfig config) {
        if (type == null) {
            throw new ConfigurationException("Engine type is required");
        }
        if (config == null || config.getName() == null || config.getName().isBlank()) {
            throw new ConfigurationException("Engine name is required");
        }
        EngineFactory<? extends Engine> factory = config.getProvider() != null ? providers.get(type).get(config.getProvider()) : null;
        if (factory == null) {
            throw new UnknownProviderException(type, config.getProvider());
        }

        Engine engine = factory.create(config);
        if (!ROLES.get(type).isInstance(engine)) {
            throw new ConfigurationException("Provider " + config.getProvider() + " did not produce a " + type.id() + " engine");
        }
        try {
            engine.initialize();
        } catch (RuntimeException e) {
            shutdownQuietly(key(type, config.getName()), engine);
            throw e;
        }

        String key = key(type, config.getName());
        Engine previous = engines.put(key, engine);
        log.info("Engine created: key={}, provider={}, version={}", key, config.getProvider(), config.getVersion());
        if (previous != null && previous != engine) {
            log.info("Replacing live engine, shutting down previous instance: key={}", key);
            shutdownQuietly(key, previous);
        }
        return engine;
    }

    public Optional<Engine> getEngine(EngineType type, String name) {
        return Optional.ofNullable(engines.get(key(type, name)));
    }

    public Optional<TextToSqlEngine> getTextToSqlEngine(String name) {
        return getEngine(EngineType.TEXT_TO_SQL, name).map(TextToSqlEngine.class::cast);
    }

    public Optional<VisualizationEngine> getVisualizationEngine(String name) {
        return getEngine(EngineType.VISUALIZATION, name).map(VisualizationEngine.class::cast);
    }

    public Optional<SemanticEngine> getSemanticEngine(String name) {
        return getEngine(EngineType.SEMANTIC, name).map(SemanticEngine.class::cast);
    }

    /**
     * Shut down and forget one engine.
     *
     * @return true if an engine was live under the key
     */
    public boolean shutdownEngine(EngineType type, String name) {
        String key = key(type, name);
        Engine engine = engines.remove(key);
        if (engine == null) {
            return false;
        }
        engine.shutdown();
        log.info("Engine shut down: key={}", key);
        return true;
    }

    public List<Engine> listEngines() {
        List<Engine> out = new ArrayList<>(engines.values());
        out.sort((a, b) -> key(a.getType(), a.getName()).compareTo(key(b.getType(), b.getName())));
        return out;
    }

    /**
     * Run {@link Engine#validate()} on every live engine.
     *
     * @return key to validation outcome, sorted by key
     */
    public Map<String, Boolean> validateAll() {
        Map<String, Boolean> out = new LinkedHashMap<>();
        for (Engine engine : listEngines()) {
            out.put(key(engine.getType(), engine.getName()), engine.validate());
        }
        return out;
    }

    /**
     * Shut down every live engine and clear the table. Failures are logged and skipped.
     */
    public void shutdownAll() {
        for (String key : new ArrayList<>(engines.keySet())) {
            Engine engine = engines.remove(key);
            if (engine != null) {
                shutdownQuietly(key, engine);
            }
        }
        engines.clear();
        log.info("All engines shut down");
    }

    private void shutdownQuietly(String key, Engine engine) {
        try {
            engine.shutdown();
        } catch (RuntimeException e) {
            log.warn("Engine shutdown failed: key={}, error={}", key, e.getMessage(), e);
        }
    }

    static String key(EngineType type, String name) {
        return type.id() + ":" + name;
    }
}
