package com.kurobe.config;

import com.kurobe.exception.ConfigurationException;
import com.kurobe.model.ConnectionConfig;
import com.kurobe.model.ConnectionType;
import com.kurobe.model.EngineConfig;
import com.kurobe.model.EngineType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Reads the bootstrap YAML file.
 *
 * <pre>
 * connections:
 *   - name: sales-db
 *     type: postgres
 *     host: localhost
 *     password: ${SALES_DB_PASSWORD}
 *     extra_params:
 *       pool_max_size: 5
 * engines:
 *   - type: visualization
 *     name: default
 *     provider: heuristic
 * </pre>
 *
 * String values go through a placeholder resolver, so secrets can come from the environment.
 */
public class BootstrapConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(BootstrapConfigLoader.class);

    private static final Set<String> CONNECTION_KEYS = Set.of(
            "name", "type", "host", "port", "database", "username", "password", "ssl", "extra_params");

    private final UnaryOperator<String> placeholderResolver;

    public BootstrapConfigLoader(UnaryOperator<String> placeholderResolver) {
        this.placeholderResolver = placeholderResolver != null ? placeholderResolver : UnaryOperator.identity();
    }

    /**
     * Load a bootstrap file. A missing file yields an empty config.
     *
     * @param path bootstrap file path
     * @return parsed config
     * @throws ConfigurationException if the file cannot be read or is malformed
     */
    public BootstrapConfig load(Path path) {
        if (path == null || !Files.exists(path)) {
            log.warn("Bootstrap config not found, starting with no connections or engines: path={}", path);
            return BootstrapConfig.EMPTY;
        }
        try (InputStream in = Files.newInputStream(path)) {
            BootstrapConfig config = parse(in);
            log.info("Bootstrap config loaded: path={}, connections={}, engines={}",
                    path, config.connections().size(), config.engines().size());
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read bootstrap config " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse bootstrap YAML.
     *
     * @param in YAML stream
     * @return parsed config
     * @throws ConfigurationException if the document is malformed
     */
    public BootstrapConfig parse(InputStream in) {
        Object root;
        try {
            root = new Yaml().load(in);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed bootstrap config: " + e.getMessage(), e);
        }
        if (root == null) {
            return BootstrapConfig.EMPTY;
        }
        Map<String, Object> doc = asMap(root, "document root");

        List<ConnectionConfig> connections = new ArrayList<>();
        for (Object item : asList(doc.get("connections"), "connections")) {
            connections.add(toConnectionConfig(asMap(item, "connections entry")));
        }
        List<BootstrapConfig.EngineDefinition> engines = new ArrayList<>();
        for (Object item : asList(doc.get("engines"), "engines")) {
            engines.add(toEngineDefinition(asMap(item, "engines entry")));
        }
        return new BootstrapConfig(connections, engines);
    }

    private ConnectionConfig toConnectionConfig(Map<String, Object> m) {
        for (String key : m.keySet()) {
            if (!CONNECTION_KEYS.contains(key)) {
                throw new ConfigurationException("Unknown connection key '" + key + "' in bootstrap config");
            }
        }
        ConnectionConfig.ConnectionConfigBuilder builder = ConnectionConfig.builder()
                .name(string(m.get("name")))
                .type(ConnectionType.fromName(string(m.get("type"))))
                .host(string(m.get("host")))
                .port(integer(m.get("port"), "port"))
                .database(string(m.get("database")))
                .username(string(m.get("username")))
                .password(string(m.get("password")))
                .ssl(bool(m.get("ssl")));
        Object extra = m.get("extra_params");
        if (extra != null) {
            asMap(extra, "extra_params").forEach((k, v) -> builder.extraParam(k, resolve(v)));
        }
        ConnectionConfig config = builder.build();
        config.validate();
        return config;
    }

    private BootstrapConfig.EngineDefinition toEngineDefinition(Map<String, Object> m) {
        EngineType type = EngineType.fromId(string(m.get("type")));
        String name = string(m.get("name"));
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Engine name is required in bootstrap config");
        }
        EngineConfig.EngineConfigBuilder builder = EngineConfig.builder()
                .name(name)
                .version(string(m.get("version")))
                .provider(string(m.get("provider")))
                .enabled(m.get("enabled") == null || bool(m.get("enabled")));
        Object settings = m.get("config");
        if (settings != null) {
            asMap(settings, "engine config").forEach((k, v) -> builder.setting(k, resolve(v)));
        }
        return new BootstrapConfig.EngineDefinition(type, builder.build());
    }

    private Object resolve(Object value) {
        if (value instanceof String s) {
            return placeholders(s);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(String.valueOf(k), resolve(v)));
            return out;
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            list.forEach(v -> out.add(resolve(v)));
            return out;
        }
        return value;
    }

    private String string(Object value) {
        return value != null ? placeholders(String.valueOf(value)) : null;
    }

    private String placeholders(String value) {
        try {
            return placeholderResolver.apply(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unresolvable placeholder in bootstrap config: " + e.getMessage(), e);
        }
    }

    private Integer integer(Object value, String key) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(string(value).trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer: " + value);
        }
    }

    private boolean bool(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(string(value).trim());
    }

    private static Map<String, Object> asMap(Object value, String what) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new ConfigurationException("Malformed bootstrap config: " + what + " must be a mapping");
        }
        Map<String, Object> out = new LinkedHashMap<>();
        map.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }

    private static List<?> asList(Object value, String what) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("Malformed bootstrap config: " + what + " must be a list");
        }
        return list;
    }
}
