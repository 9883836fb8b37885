package com.kurobe.connector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kurobe.exception.ConfigurationException;
import com.kurobe.exception.DataConnectionException;
import com.kurobe.exception.QueryExecutionException;
import com.kurobe.exception.QueryTimeoutException;
import com.kurobe.model.ColumnInfo;
import com.kurobe.model.ConnectionConfig;
import com.kurobe.model.QueryResult;
import com.kurobe.util.NamedParameterSql;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Connector for Trino's SQL-over-HTTP statement protocol.
 *
 * <p>A query is submitted with {@code POST /v1/statement}; the client then follows
 * {@code nextUri} until a page no longer advertises one. Column metadata comes from the first
 * page that carries it, rows are accumulated across all pages.
 *
 * <p>Parameters are bound with Trino prepared statements: the rewritten SQL travels in the
 * {@code X-Trino-Prepared-Statement} header and the body is {@code EXECUTE ... USING} with
 * escaped literals.
 *
 * <p>Extra parameters: {@code catalog} (hive), {@code http_timeout_seconds} (60).
 */
public class TrinoConnector extends AbstractConnector {

    static final String PREPARED_STATEMENT_NAME = "kurobe_stmt";
    private static final String DEFAULT_CATALOG = "hive";
    private static final String DEFAULT_USER = "kurobe";
    private static final int DEFAULT_HTTP_TIMEOUT_SECONDS = 60;
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration CANCEL_TIMEOUT = Duration.ofSeconds(5);
    private static final long BUSY_RETRY_MILLIS = 50;
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final ObjectMapper objectMapper;
    private volatile HttpClient httpClient;
    private URI baseUri;

    public TrinoConnector(ConnectionConfig config, QueryTimeouts timeouts, ObjectMapper objectMapper) {
        super(config, timeouts);
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doConnect() {
        if (config.getHost() == null || config.getHost().isBlank()) {
            throw new ConfigurationException("Host is required for Trino connection: " + config.getName());
        }
        URI uri = URI.create(scheme() + "://" + config.getHost() + ":" + port());
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .build();

        HttpRequest request = HttpRequest.newBuilder(uri.resolve("/v1/info"))
                .timeout(Duration.ofSeconds(config.extraInt("http_timeout_seconds", DEFAULT_HTTP_TIMEOUT_SECONDS)))
                .GET()
                .build();
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new DataConnectionException(config.getName(),
                        "Trino handshake failed for " + describeTarget() + ": HTTP " + response.statusCode());
            }
            JsonNode info = objectMapper.readTree(response.body());
            if (info.path("starting").asBoolean(false)) {
                throw new DataConnectionException(config.getName(), "Trino server is still starting: " + describeTarget());
            }
        } catch (IOException e) {
            throw new DataConnectionException(config.getName(), "Failed to connect to " + describeTarget() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DataConnectionException(config.getName(), "Interrupted while connecting to " + describeTarget(), e);
        }
        this.baseUri = uri;
        this.httpClient = client;
    }

    @Override
    protected void doDisconnect() {
        // java.net.http.HttpClient has no close() before JDK 21; dropping the reference lets its
        // selector thread wind down once idle.
        httpClient = null;
    }

    @Override
    protected QueryResult doExecuteQuery(String query, Map<String, ?> parameters, int timeoutSeconds, long startNanos) {
        HttpClient client = httpClient;
        if (client == null) {
            throw new QueryExecutionException("Not connected: " + config.getName());
        }
        long deadline = startNanos + Duration.ofSeconds(timeoutSeconds).toNanos();

        NamedParameterSql parsed = NamedParameterSql.parse(query);
        List<Object> values = parsed.bind(parameters);
        String preparedHeader = values.isEmpty() ? null
                : PREPARED_STATEMENT_NAME + "=" + URLEncoder.encode(parsed.getSql(), StandardCharsets.UTF_8);
        String body = values.isEmpty() ? query : TrinoLiterals.executeStatement(PREPARED_STATEMENT_NAME, values);
        URI statementUri = baseUri.resolve("/v1/statement");

        JsonNode page = send(client, () -> {
            HttpRequest.Builder submit = baseRequest(statementUri, deadline, timeoutSeconds);
            if (preparedHeader != null) {
                submit.header("X-Trino-Prepared-Statement", preparedHeader);
            }
            return submit.POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8)).build();
        }, null, deadline, timeoutSeconds);
        List<String> columns = null;
        List<List<Object>> rows = new ArrayList<>();
        while (true) {
            failOnError(page);
            if (columns == null && page.path("columns").isArray()) {
                columns = new ArrayList<>();
                for (JsonNode column : page.path("columns")) {
                    columns.add(column.path("name").asText());
                }
            }
            if (page.path("data").isArray()) {
                for (JsonNode row : page.path("data")) {
                    rows.add(toRow(row));
                }
            }

            String nextUri = page.path("nextUri").isTextual() ? page.path("nextUri").asText() : null;
            if (nextUri == null) {
                break;
            }
            URI pageUri = URI.create(nextUri);
            page = send(client, () -> baseRequest(pageUri, deadline, timeoutSeconds).GET().build(), nextUri, deadline, timeoutSeconds);
        }

        if (columns == null) {
            if (!rows.isEmpty()) {
                throw new QueryExecutionException("Trino returned data without column metadata");
            }
            columns = List.of();
        }
        return buildResult(columns, rows, query, startNanos);
    }

    private HttpRequest.Builder baseRequest(URI uri, long deadline, int timeoutSeconds) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
            throw new QueryTimeoutException(timeoutSeconds, null);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofNanos(remaining))
                .header("X-Trino-User", user())
                .header("X-Trino-Source", "kurobe")
                .header("X-Trino-Catalog", catalog())
                .header("X-Trino-Schema", config.getDatabase() != null ? config.getDatabase() : "default");
        if (config.getPassword() != null && !config.getPassword().isEmpty()) {
            String credentials = user() + ":" + config.getPassword();
            builder.header("Authorization", "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
        }
        return builder;
    }

    /**
     * Sends a request built fresh for every attempt, so each retry carries only the time left
     * before {@code deadline}. Busy responses are retried until the deadline passes.
     */
    private JsonNode send(HttpClient client, Supplier<HttpRequest> request, String cancelUri, long deadline, int timeoutSeconds) {
        try {
            while (true) {
                if (System.nanoTime() >= deadline) {
                    if (cancelUri != null) {
                        cancel(client, cancelUri);
                    }
                    throw new QueryTimeoutException(timeoutSeconds, null);
                }
                HttpResponse<String> response = client.send(request.get(), HttpResponse.BodyHandlers.ofString());
                int status = response.statusCode();
                // 502/503/504 mean the coordinator is busy; the protocol asks clients to retry
                if (status == 502 || status == 503 || status == 504) {
                    log.debug("Trino busy, retrying: name={}, status={}", config.getName(), status);
                    Thread.sleep(BUSY_RETRY_MILLIS);
                    continue;
                }
                if (status >= 400) {
                    throw new QueryExecutionException("Trino request failed: HTTP " + status + " - " + response.body());
                }
                return objectMapper.readTree(response.body());
            }
        } catch (HttpTimeoutException e) {
            if (cancelUri != null) {
                cancel(client, cancelUri);
            }
            throw new QueryTimeoutException(timeoutSeconds, e);
        } catch (JsonProcessingException e) {
            throw new QueryExecutionException("Trino returned an unreadable response: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new QueryExecutionException("Trino request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryExecutionException("Interrupted while waiting for Trino", e);
        }
    }

    private void failOnError(JsonNode page) {
        JsonNode error = page.path("error");
        if (error.isMissingNode() || error.isNull()) {
            return;
        }
        String message = error.path("message").asText("unknown error");
        String errorName = error.path("errorName").asText("");
        throw new QueryExecutionException(errorName.isEmpty() ? message : errorName + ": " + message);
    }

    private void cancel(HttpClient client, String nextUri) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(nextUri))
                .timeout(CANCEL_TIMEOUT)
                .header("X-Trino-User", user())
                .DELETE()
                .build();
        try {
            client.send(request, HttpResponse.BodyHandlers.discarding());
            log.info("Cancelled Trino query after timeout: name={}", config.getName());
        } catch (IOException e) {
            log.warn("Failed to cancel Trino query: name={}, error={}", config.getName(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private List<Object> toRow(JsonNode row) {
        List<Object> values = new ArrayList<>(row.size());
        for (JsonNode value : row) {
            try {
                values.add(objectMapper.treeToValue(value, Object.class));
            } catch (JsonProcessingException e) {
                values.add(value.toString());
            }
        }
        return values;
    }

    @Override
    protected Map<String, Map<String, List<ColumnInfo>>> doGetSchemaInfo(String schema) {
        String sql = "SELECT table_schema, table_name, column_name, data_type, is_nullable, column_default "
                + "FROM \"" + catalog() + "\".information_schema.columns "
                + "WHERE table_schema <> 'information_schema'"
                + (schema != null ? " AND table_schema = :schema" : "")
                + " ORDER BY table_schema, table_name, ordinal_position";
        Map<String, Object> params = new HashMap<>();
        if (schema != null) {
            params.put("schema", schema);
        }
        return foldColumns(doExecuteQuery(sql, params, timeouts.defaultSeconds(), System.nanoTime()));
    }

    String catalog() {
        String catalog = config.extraString("catalog", DEFAULT_CATALOG);
        if (!IDENTIFIER.matcher(catalog).matches()) {
            throw new ConfigurationException("Invalid Trino catalog name: " + catalog);
        }
        return catalog;
    }

    private String user() {
        return config.getUsername() != null ? config.getUsername() : DEFAULT_USER;
    }

    private String scheme() {
        return config.extraString("scheme", config.isSsl() ? "https" : "http");
    }

    private int port() {
        if (config.getPort() != null) {
            return config.getPort();
        }
        return config.isSsl() ? 443 : 8080;
    }

    @Override
    public String describeTarget() {
        return scheme() + "://" + config.getHost() + ":" + port() + "/" + config.extraString("catalog", DEFAULT_CATALOG);
    }
}
