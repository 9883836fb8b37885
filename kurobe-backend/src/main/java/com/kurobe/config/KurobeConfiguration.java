package com.kurobe.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kurobe.connector.ConnectionPool;
import com.kurobe.connector.ConnectorFactory;
import com.kurobe.connector.QueryTimeouts;
import com.kurobe.engine.EngineRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Wires the connection pool and engine registry as context-scoped singletons. Spring closes every
 * connection and shuts every engine down when the context stops.
 */
@Configuration
public class KurobeConfiguration {

    @Bean
    public QueryTimeouts queryTimeouts(
            @Value("${kurobe.query.default-timeout-seconds:30}") int defaultTimeoutSeconds,
            @Value("${kurobe.query.max-timeout-seconds:300}") int maxTimeoutSeconds
    ) {
        return new QueryTimeouts(defaultTimeoutSeconds, maxTimeoutSeconds);
    }

    @Bean
    public ConnectorFactory connectorFactory(QueryTimeouts queryTimeouts, ObjectMapper objectMapper) {
        return new ConnectorFactory(queryTimeouts, objectMapper);
    }

    @Bean(destroyMethod = "closeAll")
    public ConnectionPool connectionPool(ConnectorFactory connectorFactory) {
        return new ConnectionPool(connectorFactory);
    }

    @Bean(destroyMethod = "shutdownAll")
    public EngineRegistry engineRegistry() {
        return new EngineRegistry();
    }

    @Bean
    public BootstrapConfigLoader bootstrapConfigLoader(Environment environment) {
        return new BootstrapConfigLoader(environment::resolveRequiredPlaceholders);
    }
}
