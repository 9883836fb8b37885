package com.kurobe.config;

import com.kurobe.connector.ConnectionPool;
import com.kurobe.engine.EngineProvider;
import com.kurobe.engine.EngineRegistry;
import com.kurobe.model.ConnectionConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.nio.file.Paths;
import java.util.List;

/**
 * Populates the engine registry and connection pool at startup.
 *
 * <p>Provider beans are registered first, then the bootstrap file's connections and engines are
 * created. A connection or engine that fails is logged and skipped so the service still starts.
 */
@Slf4j
@Component
public class KurobeBootstrap {

    private final ConnectionPool connectionPool;
    private final EngineRegistry engineRegistry;
    private final List<EngineProvider> providers;
    private final BootstrapConfigLoader loader;

    @Value("${kurobe.bootstrap.config-path:config/kurobe.yaml}")
    private String configPath;

    public KurobeBootstrap(
            ConnectionPool connectionPool,
            EngineRegistry engineRegistry,
            List<EngineProvider> providers,
            BootstrapConfigLoader loader
    ) {
        this.connectionPool = connectionPool;
        this.engineRegistry = engineRegistry;
        this.providers = providers;
        this.loader = loader;
    }

    @PostConstruct
    public void start() {
        for (EngineProvider provider : providers) {
            engineRegistry.registerProvider(provider);
        }
        apply(loader.load(Paths.get(configPath)));
    }

    /**
     * Create every connection and enabled engine of a bootstrap config.
     *
     * @param config parsed bootstrap config
     * @return number of connections and engines that came up
     */
    public int apply(BootstrapConfig config) {
        int started = 0;
        for (ConnectionConfig connection : config.connections()) {
            try {
                connectionPool.addConnection(connection);
                started++;
            } catch (RuntimeException e) {
                log.error("Skipping connection at startup: name={}, type={}, error={}",
                        connection.getName(), connection.getType().id(), e.getMessage());
            }
        }
        for (BootstrapConfig.EngineDefinition engine : config.engines()) {
            String name = engine.config().getName();
            if (!engine.config().isEnabled()) {
                log.info("Engine disabled, not created: type={}, name={}", engine.type().id(), name);
                continue;
            }
            try {
                engineRegistry.createEngine(engine.type(), engine.config());
                started++;
            } catch (RuntimeException e) {
                log.error("Skipping engine at startup: type={}, name={}, provider={}, error={}",
                        engine.type().id(), name, engine.config().getProvider(), e.getMessage());
            }
        }
        log.info("Bootstrap finished: connections={}, engines={}",
                connectionPool.listConnections().size(), engineRegistry.listEngines().size());
        return started;
    }
}
