package com.kurobe.connector;

import com.kurobe.exception.DataConnectionException;
import com.kurobe.exception.QueryExecutionException;
import com.kurobe.model.ColumnInfo;
import com.kurobe.model.ConnectionConfig;
import com.kurobe.model.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Lifecycle and bookkeeping shared by every connector.
 *
 * <p>Queries run under the read side of a lifecycle lock and {@link #disconnect()} takes the
 * write side, so disconnect waits for in-flight calls to complete or time out before the
 * backend handle is released.
 */
public abstract class AbstractConnector implements DataConnector {

    static final int TEST_TIMEOUT_SECONDS = 5;

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final ConnectionConfig config;
    protected final QueryTimeouts timeouts;

    private final ReentrantReadWriteLock lifecycleLock = new ReentrantReadWriteLock();
    private volatile boolean connected;

    protected AbstractConnector(ConnectionConfig config, QueryTimeouts timeouts) {
        this.config = config;
        this.timeouts = timeouts != null ? timeouts : QueryTimeouts.DEFAULTS;
    }

    @Override
    public ConnectionConfig getConfig() {
        return config;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public final void connect() {
        lifecycleLock.writeLock().lock();
        try {
            if (connected) {
                throw new DataConnectionException(config.getName(), "Connection already connected: " + config.getName());
            }
            doConnect();
            connected = true;
            log.info("Connected: name={}, type={}, target={}", config.getName(), config.getType().id(), describeTarget());
        } finally {
            lifecycleLock.writeLock().unlock();
        }
    }

    @Override
    public final void disconnect() {
        lifecycleLock.writeLock().lock();
        try {
            if (!connected) {
                return;
            }
            try {
                doDisconnect();
            } finally {
                connected = false;
            }
            log.info("Disconnected: name={}", config.getName());
        } finally {
            lifecycleLock.writeLock().unlock();
        }
    }

    @Override
    public final QueryResult executeQuery(String query, Map<String, ?> parameters, Integer timeoutSeconds) {
        int timeout = timeouts.resolve(timeoutSeconds);
        lifecycleLock.readLock().lock();
        try {
            requireConnected();
            long start = System.nanoTime();
            QueryResult result = doExecuteQuery(query, parameters, timeout, start);
            log.debug("Query finished: name={}, rows={}, duration_ms={}", config.getName(), result.getRowCount(), result.getExecutionTimeMs());
            return result;
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    @Override
    public final boolean testConnection() {
        try {
            QueryResult result = executeQuery(testQuery(), null, TEST_TIMEOUT_SECONDS);
            return result.getRowCount() == 1 && result.getColumns().size() == 1;
        } catch (Exception e) {
            log.warn("Connection test failed: name={}, error={}", config.getName(), e.getMessage());
            return false;
        }
    }

    @Override
    public final Map<String, Map<String, List<ColumnInfo>>> getSchemaInfo(String schema) {
        lifecycleLock.readLock().lock();
        try {
            requireConnected();
            return doGetSchemaInfo(schema != null && !schema.isBlank() ? schema.trim() : null);
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    protected void requireConnected() {
        if (!connected) {
            throw new QueryExecutionException("Not connected: " + config.getName());
        }
    }

    protected String testQuery() {
        return "SELECT 1";
    }

    protected QueryResult buildResult(List<String> columns, List<List<Object>> rows, String query, long startNanos) {
        return QueryResult.builder()
                .columns(columns)
                .rows(rows)
                .executionTimeMs((System.nanoTime() - startNanos) / 1_000_000.0)
                .query(query)
                .connectionId(config.getName())
                .build();
    }

    /**
     * Fold {@code information_schema.columns} rows of the shape
     * (schema, table, column, data_type, is_nullable, column_default) into the nested mapping.
     */
    protected static Map<String, Map<String, List<ColumnInfo>>> foldColumns(QueryResult result) {
        Map<String, Map<String, List<ColumnInfo>>> info = new LinkedHashMap<>();
        for (List<Object> row : result.getRows()) {
            String schemaName = String.valueOf(row.get(0));
            String tableName = String.valueOf(row.get(1));
            Object nullable = row.get(4);
            ColumnInfo column = ColumnInfo.builder()
                    .columnName(String.valueOf(row.get(2)))
                    .dataType(String.valueOf(row.get(3)))
                    .nullable(nullable instanceof Boolean b ? b : "YES".equalsIgnoreCase(String.valueOf(nullable)))
                    .defaultValue(row.size() > 5 && row.get(5) != null ? String.valueOf(row.get(5)) : null)
                    .build();
            info.computeIfAbsent(schemaName, k -> new LinkedHashMap<>())
                    .computeIfAbsent(tableName, k -> new ArrayList<>())
                    .add(column);
        }
        return info;
    }

    protected abstract void doConnect();

    protected abstract void doDisconnect();

    protected abstract QueryResult doExecuteQuery(String query, Map<String, ?> parameters, int timeoutSeconds, long startNanos);

    protected abstract Map<String, Map<String, List<ColumnInfo>>> doGetSchemaInfo(String schema);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + config.getName() + "]";
    }
}
