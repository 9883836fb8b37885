package com.kurobe.connector;

import com.kurobe.exception.DataConnectionException;
import com.kurobe.exception.DuplicateNameException;
import com.kurobe.exception.NotFoundException;
import com.kurobe.model.ConnectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-keyed registry of live connectors.
 *
 * <p>A connector is only published once it has connected and passed its readiness probe.
 * Names are reserved for the duration of {@link #addConnection} so two concurrent adds of the
 * same name cannot both succeed.
 */
public class ConnectionPool {
    private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);

    private final ConnectorFactory connectorFactory;
    private final Map<String, DataConnector> connectors = new ConcurrentHashMap<>();
    private final Set<String> pending = ConcurrentHashMap.newKeySet();

    public ConnectionPool(ConnectorFactory connectorFactory) {
        this.connectorFactory = connectorFactory;
    }

    /**
     * Create, connect and test a connector, then publish it under its name.
     *
     * @param config connection config
     * @return the published connector
     * @throws DuplicateNameException if the name is taken
     * @throws DataConnectionException if connect fails or the readiness test fails
     */
    public DataConnector addConnection(ConnectionConfig config) {
        config.validate();
        String name = config.getName();
        if (connectors.containsKey(name) || !pending.add(name)) {
            throw new DuplicateNameException("Connection already exists: " + name);
        }
        try {
            if (connectors.containsKey(name)) {
                throw new DuplicateNameException("Connection already exists: " + name);
            }
            DataConnector connector = connectorFactory.create(config);
            connector.connect();
            if (!connector.testConnection()) {
                disconnectQuietly(connector);
                throw new DataConnectionException(name, "Connection test failed for " + name);
            }
            connectors.put(name, connector);
            log.info("Connection added: name={}, type={}", name, config.getType().id());
            return connector;
        } finally {
            pending.remove(name);
        }
    }

    /**
     * Look up a connector.
     *
     * @param name connection name
     * @return connector
     * @throws NotFoundException if nothing is registered under the name
     */
    public DataConnector getConnection(String name) {
        DataConnector connector = name != null ? connectors.get(name) : null;
        if (connector == null) {
            throw new NotFoundException("Connection not found: " + name);
        }
        return connector;
    }

    public boolean hasConnection(String name) {
        return name != null && connectors.containsKey(name);
    }

    /**
     * Disconnect and forget a connector. Unknown names are ignored.
     *
     * @param name connection name
     * @return true if a connector was removed
     */
    public boolean removeConnection(String name) {
        DataConnector connector = name != null ? connectors.remove(name) : null;
        if (connector == null) {
            return false;
        }
        connector.disconnect();
        log.info("Connection removed: name={}", name);
        return true;
    }

    /**
     * Snapshot of the registered names, sorted.
     *
     * @return connection names
     */
    public Set<String> listConnections() {
        return new TreeSet<>(connectors.keySet());
    }

    public List<DataConnector> connectors() {
        return new ArrayList<>(connectors.values());
    }

    /**
     * Disconnect every connector and empty the registry. Individual failures are logged and
     * do not stop the rest.
     */
    public void closeAll() {
        for (String name : new ArrayList<>(connectors.keySet())) {
            DataConnector connector = connectors.remove(name);
            if (connector != null) {
                disconnectQuietly(connector);
            }
        }
        log.info("All connections closed");
    }

    private void disconnectQuietly(DataConnector connector) {
        try {
            connector.disconnect();
        } catch (RuntimeException e) {
            log.warn("Failed to disconnect: name={}, error={}", connector.getConfig().getName(), e.getMessage(), e);
        }
    }
}
