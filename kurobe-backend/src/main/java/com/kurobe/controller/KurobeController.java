package com.kurobe.controller;

import com.kurobe.api.AskQuestionRequest;
import com.kurobe.api.ConnectionSummary;
import com.kurobe.api.ConnectionTestResponse;
import com.kurobe.api.EngineSummary;
import com.kurobe.api.QueryRequest;
import com.kurobe.connector.ConnectionPool;
import com.kurobe.connector.DataConnector;
import com.kurobe.engine.EngineRegistry;
import com.kurobe.model.ColumnInfo;
import com.kurobe.model.EngineType;
import com.kurobe.model.QueryResult;
import com.kurobe.model.QuestionRun;
import com.kurobe.service.QuestionOrchestrator;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/v1")
public class KurobeController {

    private static final Logger log = LoggerFactory.getLogger(KurobeController.class);

    private final ConnectionPool connectionPool;
    private final EngineRegistry engineRegistry;
    private final QuestionOrchestrator questionOrchestrator;

    public KurobeController(
            ConnectionPool connectionPool,
            EngineRegistry engineRegistry,
            QuestionOrchestrator questionOrchestrator
    ) {
        this.connectionPool = connectionPool;
        this.engineRegistry = engineRegistry;
        this.questionOrchestrator = questionOrchestrator;
    }

    /**
     * List live connections.
     *
     * GET /v1/connections
     */
    @GetMapping("/connections")
    public List<ConnectionSummary> listConnections() {
        return connectionPool.connectors().stream()
                .map(ConnectionSummary::of)
                .sorted(Comparator.comparing(ConnectionSummary::getName))
                .toList();
    }

    /**
     * Run the readiness probe of a connection.
     *
     * GET /v1/connections/{name}/test
     */
    @GetMapping("/connections/{name}/test")
    public ConnectionTestResponse testConnection(@PathVariable("name") String name) {
        DataConnector connector = connectionPool.getConnection(name);
        boolean healthy = connector.testConnection();
        log.info("Connection test: name={}, healthy={}, trace_id={}", name, healthy, MDC.get("trace_id"));
        return ConnectionTestResponse.builder()
                .name(name)
                .healthy(healthy)
                .traceId(MDC.get("trace_id"))
                .build();
    }

    /**
     * Introspect columns of a connection.
     *
     * GET /v1/connections/{name}/schema?schema=...
     */
    @GetMapping("/connections/{name}/schema")
    public Map<String, Map<String, List<ColumnInfo>>> getSchema(
            @PathVariable("name") String name,
            @RequestParam(value = "schema", required = false) String schema
    ) {
        return connectionPool.getConnection(name).getSchemaInfo(schema);
    }

    /**
     * Execute SQL against a connection.
     *
     * POST /v1/connections/{name}/query
     */
    @PostMapping("/connections/{name}/query")
    public QueryResult query(@PathVariable("name") String name, @Valid @RequestBody QueryRequest request) {
        log.info("Query requested: name={}, timeout_seconds={}, trace_id={}", name, request.getTimeoutSeconds(), MDC.get("trace_id"));
        return connectionPool.getConnection(name).executeQuery(request.getSql(), request.getParameters(), request.getTimeoutSeconds());
    }

    /**
     * List live engines.
     *
     * GET /v1/engines
     */
    @GetMapping("/engines")
    public List<EngineSummary> listEngines() {
        return engineRegistry.listEngines().stream().map(EngineSummary::of).toList();
    }

    /**
     * Registered provider names per engine type.
     *
     * GET /v1/engines/providers
     */
    @GetMapping("/engines/providers")
    public Map<String, Set<String>> listProviders() {
        Map<String, Set<String>> out = new LinkedHashMap<>();
        for (EngineType type : EngineType.values()) {
            out.put(type.id(), engineRegistry.registeredProviders(type));
        }
        return out;
    }

    /**
     * Validate every live engine.
     *
     * POST /v1/engines/validate
     */
    @PostMapping("/engines/validate")
    public Map<String, Boolean> validateEngines() {
        return engineRegistry.validateAll();
    }

    /**
     * Ask a question and answer it.
     *
     * POST /v1/questions
     */
    @PostMapping("/questions")
    public ResponseEntity<QuestionRun> ask(@Valid @RequestBody AskQuestionRequest request) {
        return ResponseEntity.ok(questionOrchestrator.ask(request.toQuestionRequest()));
    }

    @GetMapping("/questions")
    public List<QuestionRun> listQuestions() {
        return questionOrchestrator.list();
    }

    @GetMapping("/questions/{id}")
    public QuestionRun getQuestion(@PathVariable("id") String id) {
        return questionOrchestrator.get(id);
    }

    /**
     * Retry a failed question from the first step.
     *
     * POST /v1/questions/{id}/retry
     */
    @PostMapping("/questions/{id}/retry")
    public QuestionRun retryQuestion(@PathVariable("id") String id) {
        return questionOrchestrator.retry(id);
    }
}
