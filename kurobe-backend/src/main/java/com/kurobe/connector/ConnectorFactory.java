package com.kurobe.connector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kurobe.model.ConnectionConfig;

/**
 * Builds the connector variant for a {@link com.kurobe.model.ConnectionType}.
 */
public class ConnectorFactory {
    private final QueryTimeouts timeouts;
    private final ObjectMapper objectMapper;

    public ConnectorFactory(QueryTimeouts timeouts, ObjectMapper objectMapper) {
        this.timeouts = timeouts;
        this.objectMapper = objectMapper;
    }

    /**
     * Create an unconnected connector.
     *
     * @param config validated connection config
     * @return new connector
     */
    public DataConnector create(ConnectionConfig config) {
        return switch (config.getType()) {
            case RELATIONAL -> new PostgresConnector(config, timeouts);
            case DISTRIBUTED_HTTP -> new TrinoConnector(config, timeouts, objectMapper);
            case EMBEDDED -> new DuckDbConnector(config, timeouts);
        };
    }
}
