package com.kurobe.connector;

import com.kurobe.model.ColumnInfo;
import com.kurobe.model.ConnectionConfig;
import com.kurobe.model.QueryResult;

import java.util.List;
import java.util.Map;

/**
 * Uniform query, connect and introspection contract over one database backend family.
 *
 * <p>Implementations are safe to call concurrently from independent requests. Instances are
 * created and destroyed by {@link ConnectionPool} only.
 */
public interface DataConnector {

    ConnectionConfig getConfig();

    /**
     * Establish the pooled or single backend connection.
     *
     * @throws com.kurobe.exception.DataConnectionException if the backend is unreachable, rejects
     *         the credentials, or the connector is already connected
     */
    void connect();

    /**
     * Release all backend resources. Waits for in-flight queries to finish (or hit their timeout)
     * first. A no-op when already disconnected.
     */
    void disconnect();

    boolean isConnected();

    /**
     * Run a query.
     *
     * @param query SQL text, optionally with {@code :name} placeholders
     * @param parameters placeholder values, may be null
     * @param timeoutSeconds upper bound for this call, null for the configured default
     * @return query result
     * @throws com.kurobe.exception.QueryTimeoutException if the timeout elapsed
     * @throws com.kurobe.exception.QueryExecutionException if the backend failed the query
     */
    QueryResult executeQuery(String query, Map<String, ?> parameters, Integer timeoutSeconds);

    default QueryResult executeQuery(String query) {
        return executeQuery(query, null, null);
    }

    /**
     * Readiness probe: runs a trivial query and checks the result shape. Never throws.
     *
     * @return true if the query path is healthy
     */
    boolean testConnection();

    /**
     * Introspect columns as {@code schema -> table -> columns}.
     *
     * @param schema schema to restrict to, or null for every non-system schema
     * @return nested schema information
     * @throws com.kurobe.exception.QueryExecutionException if the metadata query fails
     */
    Map<String, Map<String, List<ColumnInfo>>> getSchemaInfo(String schema);

    /**
     * Short, credential-free description for listings and logs.
     *
     * @return target description
     */
    String describeTarget();
}
