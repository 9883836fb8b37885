package com.kurobe.connector;

import com.kurobe.exception.DataConnectionException;
import com.kurobe.exception.QueryExecutionException;
import com.kurobe.exception.QueryTimeoutException;
import com.kurobe.model.ColumnInfo;
import com.kurobe.model.ConnectionConfig;
import com.kurobe.model.QueryResult;
import com.kurobe.util.JdbcValues;
import com.kurobe.util.NamedParameterSql;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Embedded analytical connector over a single in-process DuckDB connection.
 *
 * <p>All work is handed to one dedicated worker thread, which serializes access to the
 * connection and keeps blocking calls off request threads. On timeout the running statement
 * is cancelled.
 *
 * <p>Extra parameters: {@code path} (":memory:"), {@code read_only} (false).
 */
public class DuckDbConnector extends AbstractConnector {

    static final String IN_MEMORY = ":memory:";
    private static final long SHUTDOWN_WAIT_SECONDS = 10;

    private volatile Connection connection;
    private volatile ExecutorService worker;

    public DuckDbConnector(ConnectionConfig config, QueryTimeouts timeouts) {
        super(config, timeouts);
    }

    @Override
    protected void doConnect() {
        Properties props = new Properties();
        if (config.extraBoolean("read_only", false)) {
            props.setProperty("duckdb.read_only", "true");
        }
        try {
            connection = DriverManager.getConnection(jdbcUrl(), props);
        } catch (SQLException e) {
            throw new DataConnectionException(config.getName(), "Failed to open " + describeTarget() + ": " + e.getMessage(), e);
        }
        String threadName = "duckdb-" + config.getName();
        worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    String jdbcUrl() {
        String path = path();
        return IN_MEMORY.equals(path) ? "jdbc:duckdb:" : "jdbc:duckdb:" + path;
    }

    private String path() {
        String path = config.extraString("path", null);
        if (path == null) {
            path = config.getDatabase();
        }
        return path == null || path.isBlank() ? IN_MEMORY : path;
    }

    @Override
    protected void doDisconnect() {
        ExecutorService w = worker;
        Connection conn = connection;
        worker = null;
        connection = null;
        if (w != null) {
            w.shutdown();
            try {
                if (!w.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("DuckDB worker did not stop in time: name={}", config.getName());
                    w.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                w.shutdownNow();
            }
        }
        if (conn != null) {
            try {
                conn.close();
            } catch (SQLException e) {
                throw new DataConnectionException(config.getName(), "Failed to close " + describeTarget() + ": " + e.getMessage(), e);
            }
        }
    }

    @Override
    protected QueryResult doExecuteQuery(String query, Map<String, ?> parameters, int timeoutSeconds, long startNanos) {
        NamedParameterSql parsed = NamedParameterSql.parse(query);
        List<Object> values = parsed.bind(parameters);
        AtomicReference<Statement> running = new AtomicReference<>();

        return submit(() -> {
            Connection conn = connection;
            if (conn == null) {
                throw new QueryExecutionException("Not connected: " + config.getName());
            }
            if (values.isEmpty()) {
                try (Statement stmt = conn.createStatement()) {
                    running.set(stmt);
                    boolean hasResultSet = stmt.execute(parsed.getSql());
                    return readResult(stmt, hasResultSet, query, startNanos);
                }
            }
            try (PreparedStatement ps = conn.prepareStatement(parsed.getSql())) {
                running.set(ps);
                for (int i = 0; i < values.size(); i++) {
                    ps.setObject(i + 1, values.get(i));
                }
                boolean hasResultSet = ps.execute();
                return readResult(ps, hasResultSet, query, startNanos);
            }
        }, running, timeoutSeconds);
    }

    private QueryResult submit(Callable<QueryResult> task, AtomicReference<Statement> running, int timeoutSeconds) {
        ExecutorService w = worker;
        if (w == null) {
            throw new QueryExecutionException("Not connected: " + config.getName());
        }
        Future<QueryResult> future = w.submit(task);
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            cancel(running.get());
            future.cancel(true);
            throw new QueryTimeoutException(timeoutSeconds, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(running.get());
            throw new QueryExecutionException("Interrupted while waiting for query", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof QueryExecutionException qe) {
                throw qe;
            }
            throw new QueryExecutionException("Query execution failed: " + cause.getMessage(), cause);
        }
    }

    private void cancel(Statement stmt) {
        if (stmt == null) {
            return;
        }
        try {
            stmt.cancel();
        } catch (SQLException e) {
            log.warn("Failed to cancel DuckDB statement: name={}, error={}", config.getName(), e.getMessage());
        }
    }

    private QueryResult readResult(Statement stmt, boolean hasResultSet, String query, long startNanos) throws SQLException {
        if (!hasResultSet) {
            return buildResult(List.of(), List.of(), query, startNanos);
        }
        try (ResultSet rs = stmt.getResultSet()) {
            List<String> columns = JdbcValues.columnLabels(rs.getMetaData());
            List<List<Object>> rows = new ArrayList<>();
            while (rs.next()) {
                rows.add(JdbcValues.readRow(rs, columns.size()));
            }
            return buildResult(columns, rows, query, startNanos);
        }
    }

    @Override
    protected Map<String, Map<String, List<ColumnInfo>>> doGetSchemaInfo(String schema) {
        String sql = "SELECT table_schema, table_name, column_name, data_type, is_nullable, column_default "
                + "FROM information_schema.columns "
                + "WHERE table_schema NOT IN ('information_schema', 'pg_catalog')"
                + (schema != null ? " AND table_schema = :schema" : "")
                + " ORDER BY table_schema, table_name, ordinal_position";
        Map<String, Object> params = new HashMap<>();
        if (schema != null) {
            params.put("schema", schema);
        }
        return foldColumns(doExecuteQuery(sql, params, timeouts.defaultSeconds(), System.nanoTime()));
    }

    @Override
    public String describeTarget() {
        return "duckdb:" + path();
    }
}
