package com.kurobe.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.kurobe.exception.ConfigurationException;

import java.util.Locale;
import java.util.Map;

/**
 * The closed set of backend families a connector can be built for.
 */
public enum ConnectionType {
    RELATIONAL("postgres"),
    DISTRIBUTED_HTTP("trino"),
    EMBEDDED("duckdb");

    private static final Map<String, ConnectionType> ALIASES = Map.ofEntries(
            Map.entry("postgres", RELATIONAL),
            Map.entry("postgresql", RELATIONAL),
            Map.entry("pg", RELATIONAL),
            Map.entry("relational", RELATIONAL),
            Map.entry("trino", DISTRIBUTED_HTTP),
            Map.entry("presto", DISTRIBUTED_HTTP),
            Map.entry("distributed_http", DISTRIBUTED_HTTP),
            Map.entry("duckdb", EMBEDDED),
            Map.entry("embedded", EMBEDDED)
    );

    private final String id;

    ConnectionType(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Resolve a configured type name (case-insensitive, aliases allowed).
     *
     * @param name configured type
     * @return connection type
     * @throws ConfigurationException if the name is blank or unsupported
     */
    public static ConnectionType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Connection type is required");
        }
        ConnectionType type = ALIASES.get(name.trim().toLowerCase(Locale.ROOT));
        if (type == null) {
            throw new ConfigurationException("Unsupported connection type: " + name);
        }
        return type;
    }
}
