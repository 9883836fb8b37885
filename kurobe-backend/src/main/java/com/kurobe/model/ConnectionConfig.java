package com.kurobe.model;

import com.kurobe.exception.ConfigurationException;
import lombok.Builder;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

import java.util.Map;

/**
 * Immutable description of one named backend connection.
 *
 * <p>{@code extraParams} carries backend-specific options (pool sizing, catalog, file path, ...).
 */
@Value
@Builder(toBuilder = true)
public class ConnectionConfig {
    String name;
    ConnectionType type;
    String host;
    Integer port;
    String database;
    String username;
    @ToString.Exclude
    String password;
    boolean ssl;
    @Singular
    Map<String, Object> extraParams;

    /**
     * Check the fields every connector needs.
     *
     * @throws ConfigurationException if name or type is missing
     */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Connection name is required");
        }
        if (type == null) {
            throw new ConfigurationException("Connection type is required for connection: " + name);
        }
    }

    public String extraString(String key, String defaultValue) {
        Object v = extraParams.get(key);
        if (v == null) {
            return defaultValue;
        }
        String s = String.valueOf(v).trim();
        return s.isEmpty() ? defaultValue : s;
    }

    public int extraInt(String key, int defaultValue) {
        Object v = extraParams.get(key);
        if (v == null) {
            return defaultValue;
        }
        if (v instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Extra parameter '" + key + "' of connection " + name + " is not an integer: " + v);
        }
    }

    public boolean extraBoolean(String key, boolean defaultValue) {
        Object v = extraParams.get(key);
        if (v == null) {
            return defaultValue;
        }
        if (v instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(String.valueOf(v).trim());
    }
}
