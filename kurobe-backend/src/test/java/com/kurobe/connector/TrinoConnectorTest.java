package com.kurobe.connector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kurobe.exception.DataConnectionException;
import com.kurobe.exception.QueryExecutionException;
import com.kurobe.exception.QueryTimeoutException;
import com.kurobe.model.ColumnInfo;
import com.kurobe.model.ConnectionConfig;
import com.kurobe.model.ConnectionType;
import com.kurobe.model.QueryResult;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.groups.Tuple.tuple;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class TrinoConnectorTest {

    private HttpServer server;
    private ExecutorService serverThreads;
    private String base;

    private final List<String> pages = new CopyOnWriteArrayList<>();
    private final Map<String, String> submitHeaders = new ConcurrentHashMap<>();
    private final List<String> submitBodies = new CopyOnWriteArrayList<>();
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private volatile long pageDelayMillis;
    private volatile boolean submitBusy;
    private volatile boolean pagesBusy;
    private final AtomicInteger busyResponses = new AtomicInteger();
    private volatile String infoBody = "{\"starting\":false}";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        serverThreads = Executors.newCachedThreadPool();
        server.setExecutor(serverThreads);
        server.createContext("/v1/info", exchange -> respond(exchange, 200, infoBody));
        server.createContext("/v1/statement", this::handleStatement);
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
        serverThreads.shutdownNow();
    }

    private void handleStatement(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        if ("DELETE".equals(method)) {
            cancelled.countDown();
            respond(exchange, 204, null);
            return;
        }
        if ("POST".equals(method) && submitBusy) {
            busyResponses.incrementAndGet();
            respond(exchange, 503, "");
            return;
        }
        if ("POST".equals(method)) {
            submitBodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            exchange.getRequestHeaders().forEach((k, v) -> submitHeaders.put(k.toLowerCase(), v.get(0)));
            respond(exchange, 200, page(0));
            return;
        }
        String path = exchange.getRequestURI().getPath();
        int index = Integer.parseInt(path.substring(path.lastIndexOf('/') + 1));
        if (pagesBusy) {
            busyResponses.incrementAndGet();
            respond(exchange, 503, "");
            return;
        }
        if (pageDelayMillis > 0) {
            try {
                Thread.sleep(pageDelayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        respond(exchange, 200, page(index));
    }

    private String page(int index) {
        return pages.get(index).replace("%NEXT%", base + "/v1/statement/executing/q1/" + (index + 1));
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        if (body == null) {
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
            return;
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private TrinoConnector connector() {
        return connector(ConnectionConfig.builder()
                .name("lake")
                .type(ConnectionType.DISTRIBUTED_HTTP)
                .host("127.0.0.1")
                .port(server.getAddress().getPort())
                .username("analyst")
                .database("sales")
                .extraParam("catalog", "iceberg")
                .build());
    }

    private static TrinoConnector connector(ConnectionConfig config) {
        TrinoConnector connector = new TrinoConnector(config, QueryTimeouts.DEFAULTS, new ObjectMapper());
        connector.connect();
        return connector;
    }

    @Test
    void followsNextUriAndAccumulatesRows() {
        pages.add("{\"id\":\"q1\",\"nextUri\":\"%NEXT%\",\"stats\":{\"state\":\"QUEUED\"}}");
        pages.add("{\"id\":\"q1\",\"nextUri\":\"%NEXT%\",\"columns\":[{\"name\":\"region\"},{\"name\":\"total\"}],"
                + "\"data\":[[\"EU\",10]]}");
        pages.add("{\"id\":\"q1\",\"data\":[[\"US\",7]]}");
        TrinoConnector connector = connector();

        QueryResult result = connector.executeQuery("SELECT region, total FROM orders");

        assertThat(result.getColumns()).containsExactly("region", "total");
        assertThat(result.getRows()).containsExactly(List.of("EU", 10), List.of("US", 7));
        assertThat(result.getConnectionId()).isEqualTo("lake");
        assertThat(submitBodies).containsExactly("SELECT region, total FROM orders");
        assertThat(submitHeaders)
                .containsEntry("x-trino-user", "analyst")
                .containsEntry("x-trino-catalog", "iceberg")
                .containsEntry("x-trino-schema", "sales")
                .doesNotContainKey("x-trino-prepared-statement");
        connector.disconnect();
    }

    @Test
    void bindsParametersThroughPreparedStatement() {
        pages.add("{\"id\":\"q1\",\"columns\":[{\"name\":\"n\"}],\"data\":[[1]]}");
        TrinoConnector connector = connector();

        connector.executeQuery("SELECT count(*) AS n FROM customers WHERE name = :name AND tier > :tier",
                Map.of("name", "O'Brien", "tier", 5), null);

        assertThat(submitBodies).containsExactly("EXECUTE kurobe_stmt USING 'O''Brien', 5");
        String header = submitHeaders.get("x-trino-prepared-statement");
        assertThat(header).startsWith("kurobe_stmt=");
        assertThat(URLDecoder.decode(header.substring("kurobe_stmt=".length()), StandardCharsets.UTF_8))
                .isEqualTo("SELECT count(*) AS n FROM customers WHERE name = ? AND tier > ?");
    }

    @Test
    void errorPageBecomesQueryFailure() {
        pages.add("{\"id\":\"q1\",\"error\":{\"message\":\"Column 'x' cannot be resolved\",\"errorName\":\"COLUMN_NOT_FOUND\"}}");
        TrinoConnector connector = connector();

        assertThatThrownBy(() -> connector.executeQuery("SELECT x"))
                .isInstanceOf(QueryExecutionException.class)
                .hasMessage("COLUMN_NOT_FOUND: Column 'x' cannot be resolved");
    }

    @Test
    void slowPagesTimeOutAndCancelTheQuery() throws InterruptedException {
        pages.add("{\"id\":\"q1\",\"nextUri\":\"%NEXT%\"}");
        pages.add("{\"id\":\"q1\",\"columns\":[{\"name\":\"n\"}],\"data\":[[1]]}");
        pageDelayMillis = 3_000;
        TrinoConnector connector = connector();

        assertThatThrownBy(() -> connector.executeQuery("SELECT slow()", null, 1))
                .isInstanceOfSatisfying(QueryTimeoutException.class, e -> assertThat(e.getTimeoutSeconds()).isEqualTo(1));
        assertThat(cancelled.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void busyCoordinatorIsRetriedOnlyUntilTheTimeout() {
        submitBusy = true;
        TrinoConnector connector = connector();

        assertTimeoutPreemptively(Duration.ofSeconds(5), () ->
                assertThatThrownBy(() -> connector.executeQuery("SELECT 1", null, 1))
                        .isInstanceOfSatisfying(QueryTimeoutException.class, e -> assertThat(e.getTimeoutSeconds()).isEqualTo(1)));
        assertThat(busyResponses.get()).isGreaterThan(1);
        assertThat(submitBodies).isEmpty();
        connector.disconnect();
    }

    @Test
    void busyPagesTimeOutAndCancelTheQuery() throws InterruptedException {
        pages.add("{\"id\":\"q1\",\"nextUri\":\"%NEXT%\"}");
        pagesBusy = true;
        TrinoConnector connector = connector();

        assertTimeoutPreemptively(Duration.ofSeconds(5), () ->
                assertThatThrownBy(() -> connector.executeQuery("SELECT 1", null, 1))
                        .isInstanceOf(QueryTimeoutException.class));
        assertThat(cancelled.await(5, TimeUnit.SECONDS)).isTrue();
        connector.disconnect();
    }

    @Test
    void readinessProbeAndSchemaIntrospection() {
        pages.add("{\"id\":\"q1\",\"columns\":[{\"name\":\"_col0\"}],\"data\":[[1]]}");
        TrinoConnector connector = connector();
        assertThat(connector.testConnection()).isTrue();

        pages.clear();
        pages.add("{\"id\":\"q2\",\"columns\":[{\"name\":\"table_schema\"},{\"name\":\"table_name\"},"
                + "{\"name\":\"column_name\"},{\"name\":\"data_type\"},{\"name\":\"is_nullable\"},{\"name\":\"column_default\"}],"
                + "\"data\":[[\"sales\",\"orders\",\"id\",\"bigint\",\"NO\",null],"
                + "[\"sales\",\"orders\",\"region\",\"varchar\",\"YES\",null]]}");
        Map<String, Map<String, List<ColumnInfo>>> info = connector.getSchemaInfo("sales");

        assertThat(info.get("sales").get("orders"))
                .extracting(ColumnInfo::getColumnName, ColumnInfo::isNullable)
                .containsExactly(
                        tuple("id", false),
                        tuple("region", true));
        assertThat(submitBodies.get(submitBodies.size() - 1))
                .startsWith("EXECUTE kurobe_stmt USING 'sales'");
        assertThat(URLDecoder.decode(submitHeaders.get("x-trino-prepared-statement"), StandardCharsets.UTF_8))
                .contains("\"iceberg\".information_schema.columns");
    }

    @Test
    void startingServerIsNotConnected() {
        infoBody = "{\"starting\":true}";

        assertThatThrownBy(this::connector)
                .isInstanceOf(DataConnectionException.class)
                .hasMessageContaining("still starting");
    }

    @Test
    void unreachableServerIsNotConnected() {
        ConnectionConfig config = ConnectionConfig.builder()
                .name("down")
                .type(ConnectionType.DISTRIBUTED_HTTP)
                .host("127.0.0.1")
                .port(1)
                .build();

        assertThatThrownBy(() -> connector(config)).isInstanceOf(DataConnectionException.class);
    }

    @Test
    void catalogMustBeAnIdentifier() {
        TrinoConnector connector = new TrinoConnector(ConnectionConfig.builder()
                .name("bad")
                .type(ConnectionType.DISTRIBUTED_HTTP)
                .host("localhost")
                .extraParam("catalog", "hive\"; DROP")
                .build(), QueryTimeouts.DEFAULTS, new ObjectMapper());

        assertThatThrownBy(connector::catalog).hasMessageContaining("Invalid Trino catalog name");
    }
}
