package com.kurobe.connector;

import com.kurobe.exception.DataConnectionException;
import com.kurobe.exception.QueryExecutionException;
import com.kurobe.exception.QueryTimeoutException;
import com.kurobe.model.ColumnInfo;
import com.kurobe.model.ConnectionConfig;
import com.kurobe.model.QueryResult;
import com.kurobe.util.JdbcValues;
import com.kurobe.util.NamedParameterSql;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Relational connector backed by a HikariCP sub-pool over the PostgreSQL JDBC driver.
 *
 * <p>Each call borrows a connection, sets the session {@code statement_timeout} so the backend
 * itself cancels runaway queries, and always returns the connection to the pool.
 *
 * <p>Extra parameters: {@code jdbc_url}, {@code pool_max_size} (10), {@code pool_min_idle} (2),
 * {@code pool_acquire_timeout_ms} (30000), {@code application_name} (kurobe).
 */
public class PostgresConnector extends AbstractConnector {

    static final int DEFAULT_POOL_MAX_SIZE = 10;
    static final int DEFAULT_POOL_MIN_IDLE = 2;
    static final int DEFAULT_ACQUIRE_TIMEOUT_MS = 30_000;
    private static final int VALIDATION_TIMEOUT_SECONDS = 5;

    private static final String SCHEMA_SQL = "SELECT table_schema, table_name, column_name, data_type, is_nullable, column_default "
            + "FROM information_schema.columns "
            + "WHERE table_schema IS NOT NULL AND %s "
            + "ORDER BY table_schema, table_name, ordinal_position";

    private volatile HikariDataSource dataSource;

    public PostgresConnector(ConnectionConfig config, QueryTimeouts timeouts) {
        super(config, timeouts);
    }

    @Override
    protected void doConnect() {
        HikariConfig hikariConfig = buildHikariConfig();
        HikariDataSource ds;
        try {
            ds = new HikariDataSource(hikariConfig);
        } catch (RuntimeException e) {
            throw new DataConnectionException(config.getName(), "Failed to connect to " + describeTarget() + ": " + rootMessage(e), e);
        }

        try (Connection conn = ds.getConnection()) {
            if (!conn.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                throw new SQLException("Connection is not valid");
            }
        } catch (SQLException e) {
            ds.close();
            throw new DataConnectionException(config.getName(), "Failed to connect to " + describeTarget() + ": " + e.getMessage(), e);
        }
        dataSource = ds;
    }

    HikariConfig buildHikariConfig() {
        String jdbcUrl = resolveJdbcUrl();
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setUsername(config.getUsername());
        hikariConfig.setPassword(config.getPassword());

        if (isPostgresUrl(jdbcUrl)) {
            hikariConfig.setDriverClassName("org.postgresql.Driver");
            // surfaces as pg_stat_activity.application_name
            hikariConfig.addDataSourceProperty("ApplicationName", config.extraString("application_name", "kurobe"));
        }

        int maxSize = Math.max(1, config.extraInt("pool_max_size", DEFAULT_POOL_MAX_SIZE));
        hikariConfig.setMaximumPoolSize(maxSize);
        hikariConfig.setMinimumIdle(Math.min(maxSize, Math.max(0, config.extraInt("pool_min_idle", DEFAULT_POOL_MIN_IDLE))));
        hikariConfig.setConnectionTimeout(config.extraInt("pool_acquire_timeout_ms", DEFAULT_ACQUIRE_TIMEOUT_MS));
        hikariConfig.setPoolName("kurobe-" + config.getName());
        return hikariConfig;
    }

    String resolveJdbcUrl() {
        String override = config.extraString("jdbc_url", null);
        if (override != null) {
            return override;
        }
        String host = config.getHost() != null ? config.getHost() : "localhost";
        int port = config.getPort() != null ? config.getPort() : 5432;
        String database = config.getDatabase() != null ? config.getDatabase() : "";
        String url = "jdbc:postgresql://" + host + ":" + port + "/" + database;
        if (config.isSsl()) {
            url += "?sslmode=require";
        }
        return url;
    }

    private static boolean isPostgresUrl(String jdbcUrl) {
        return jdbcUrl != null && jdbcUrl.startsWith("jdbc:postgresql:");
    }

    @Override
    protected void doDisconnect() {
        HikariDataSource ds = dataSource;
        dataSource = null;
        if (ds != null) {
            ds.close();
        }
    }

    @Override
    protected QueryResult doExecuteQuery(String query, Map<String, ?> parameters, int timeoutSeconds, long startNanos) {
        NamedParameterSql parsed = NamedParameterSql.parse(query);
        List<Object> values = parsed.bind(parameters);

        Connection conn = acquire();
        try (conn) {
            applyStatementTimeout(conn, timeoutSeconds);

            // Parameter-less queries go through a plain Statement; the extended protocol is only
            // needed when there is something to bind.
            if (values.isEmpty()) {
                try (Statement stmt = conn.createStatement()) {
                    stmt.setQueryTimeout(timeoutSeconds);
                    boolean hasResultSet = stmt.execute(parsed.getSql());
                    return readResult(conn, stmt, hasResultSet, parsed.getSql(), query, startNanos);
                }
            }

            try (PreparedStatement ps = conn.prepareStatement(parsed.getSql())) {
                ps.setQueryTimeout(timeoutSeconds);
                for (int i = 0; i < values.size(); i++) {
                    ps.setObject(i + 1, values.get(i));
                }
                boolean hasResultSet = ps.execute();
                return readResult(conn, ps, hasResultSet, parsed.getSql(), query, startNanos);
            }
        } catch (SQLException e) {
            if (isTimeout(e)) {
                throw new QueryTimeoutException(timeoutSeconds, e);
            }
            throw new QueryExecutionException("Query execution failed: " + e.getMessage(), e);
        }
    }

    private Connection acquire() {
        HikariDataSource ds = dataSource;
        if (ds == null) {
            throw new QueryExecutionException("Not connected: " + config.getName());
        }
        try {
            return ds.getConnection();
        } catch (SQLException e) {
            throw new DataConnectionException(config.getName(), "Failed to acquire connection from pool " + config.getName() + ": " + e.getMessage(), e);
        }
    }

    private void applyStatementTimeout(Connection conn, int timeoutSeconds) throws SQLException {
        if (!isPostgresUrl(resolveJdbcUrl())) {
            return;
        }
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("SET statement_timeout = " + (timeoutSeconds * 1000L));
        }
    }

    private QueryResult readResult(Connection conn, Statement stmt, boolean hasResultSet, String sql, String originalQuery, long startNanos)
            throws SQLException {
        if (!hasResultSet) {
            return buildResult(List.of(), List.of(), originalQuery, startNanos);
        }
        try (ResultSet rs = stmt.getResultSet()) {
            ResultSetMetaData metaData = rs.getMetaData();
            if (metaData == null) {
                metaData = describe(conn, sql);
            }
            List<String> columns = metaData != null ? JdbcValues.columnLabels(metaData) : List.of();
            int columnCount = columns.size();
            List<List<Object>> rows = new ArrayList<>();
            while (rs.next()) {
                rows.add(JdbcValues.readRow(rs, columnCount));
            }
            return buildResult(columns, rows, originalQuery, startNanos);
        }
    }

    private ResultSetMetaData describe(Connection conn, String sql) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            return ps.getMetaData();
        }
    }

    static boolean isTimeout(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLTimeoutException) {
                return true;
            }
            if (t instanceof SQLException sqlException && HikariSqlExceptionOverride.QUERY_CANCELED.equals(sqlException.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected Map<String, Map<String, List<ColumnInfo>>> doGetSchemaInfo(String schema) {
        long start = System.nanoTime();
        QueryResult result;
        if (schema != null) {
            Map<String, Object> params = new HashMap<>();
            params.put("schema", schema);
            result = doExecuteQuery(String.format(SCHEMA_SQL, "table_schema = :schema"), params, timeouts.defaultSeconds(), start);
        } else {
            result = doExecuteQuery(String.format(SCHEMA_SQL, "LOWER(table_schema) NOT IN ('pg_catalog', 'information_schema')"),
                    null, timeouts.defaultSeconds(), start);
        }
        return foldColumns(result);
    }

    @Override
    public String describeTarget() {
        String url = resolveJdbcUrl();
        // strip inline credentials such as user:secret@host
        return url.replaceAll("//[^/@]*@", "//****@").replaceAll("(?i)(password=)[^&;]*", "$1****");
    }

    private static String rootMessage(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : t.getMessage();
    }
}
