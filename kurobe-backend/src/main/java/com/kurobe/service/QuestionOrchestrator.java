package com.kurobe.service;

import com.kurobe.connector.ConnectionPool;
import com.kurobe.connector.DataConnector;
import com.kurobe.engine.EngineRegistry;
import com.kurobe.engine.SemanticEngine;
import com.kurobe.engine.TextToSqlEngine;
import com.kurobe.engine.VisualizationEngine;
import com.kurobe.exception.ConfigurationException;
import com.kurobe.exception.KurobeException;
import com.kurobe.exception.NotFoundException;
import com.kurobe.exception.QueryExecutionException;
import com.kurobe.exception.QuestionStateException;
import com.kurobe.model.ColumnInfo;
import com.kurobe.model.ExecutionPlan;
import com.kurobe.model.PanelSpec;
import com.kurobe.model.QueryResult;
import com.kurobe.model.QuestionAnalysis;
import com.kurobe.model.QuestionRequest;
import com.kurobe.model.QuestionRun;
import com.kurobe.model.QuestionStatus;
import com.kurobe.model.SqlGenerationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Answers a question end to end: semantic analysis and plan, SQL generation, execution through
 * the {@link ConnectionPool}, panel recommendation and summary.
 *
 * <p>Any failing step marks the run failed with the originating message; {@link #retry(String)}
 * resets a failed run and starts over from the first step. Runs are kept in memory; once more than
 * {@code kurobe.questions.max-retained} are held, the least recently updated completed or failed
 * runs are dropped. Runs still in progress are never dropped.
 */
@Slf4j
@Service
public class QuestionOrchestrator {

    /** Engine name used when a request does not pick one. */
    public static final String DEFAULT_ENGINE = "default";

    public static final int DEFAULT_MAX_RETAINED = 1000;

    private final ConnectionPool connectionPool;
    private final EngineRegistry engineRegistry;
    private final int maxRetained;

    private final Map<String, QuestionRun> runs = new ConcurrentHashMap<>();

    public QuestionOrchestrator(ConnectionPool connectionPool, EngineRegistry engineRegistry) {
        this(connectionPool, engineRegistry, DEFAULT_MAX_RETAINED);
    }

    @Autowired
    public QuestionOrchestrator(ConnectionPool connectionPool, EngineRegistry engineRegistry,
                                @Value("${kurobe.questions.max-retained:" + DEFAULT_MAX_RETAINED + "}") int maxRetained) {
        if (maxRetained < 1) {
            throw new ConfigurationException("kurobe.questions.max-retained must be at least 1, got " + maxRetained);
        }
        this.connectionPool = connectionPool;
        this.engineRegistry = engineRegistry;
        this.maxRetained = maxRetained;
    }

    /**
     * Record a question and answer it.
     *
     * @param request question, connection and engine names
     * @return the finished run, completed or failed
     */
    public QuestionRun ask(QuestionRequest request) {
        if (request == null || request.getQuestion() == null || request.getQuestion().isBlank()) {
            throw new IllegalArgumentException("question is required");
        }
        if (request.getConnection() == null || request.getConnection().isBlank()) {
            throw new IllegalArgumentException("connection is required");
        }
        OffsetDateTime now = OffsetDateTime.now();
        QuestionRun run = QuestionRun.builder()
                .id(UUID.randomUUID().toString())
                .request(request)
                .status(QuestionStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();
        runs.put(run.getId(), run);
        log.info("Question accepted: question_id={}, connection={}", run.getId(), request.getConnection());
        return process(run.getId());
    }

    public QuestionRun get(String id) {
        QuestionRun run = id != null ? runs.get(id) : null;
        if (run == null) {
            throw new NotFoundException("Question not found: " + id);
        }
        return run;
    }

    public List<QuestionRun> list() {
        List<QuestionRun> out = new ArrayList<>(runs.values());
        out.sort(Comparator.comparing(QuestionRun::getCreatedAt));
        return out;
    }

    /**
     * Reset a failed run to pending and answer it again from the top.
     *
     * @param id question id
     * @return the finished run
     * @throws NotFoundException if the id is unknown
     * @throws QuestionStateException if the run has not failed
     */
    public QuestionRun retry(String id) {
        get(id);
        boolean[] reset = {false};
        runs.computeIfPresent(id, (k, run) -> {
            if (run.getStatus() != QuestionStatus.FAILED) {
                return run;
            }
            reset[0] = true;
            return run.toBuilder()
                    .status(QuestionStatus.PENDING)
                    .error(null)
                    .analysis(null)
                    .plan(null)
                    .sql(null)
                    .result(null)
                    .panels(null)
                    .summary(null)
                    .completedAt(null)
                    .updatedAt(OffsetDateTime.now())
                    .build();
        });
        if (!reset[0]) {
            throw new QuestionStateException("Only failed questions can be retried: " + id + " is " + get(id).getStatus().id());
        }
        log.info("Question retry: question_id={}", id);
        return process(id);
    }

    private QuestionRun process(String id) {
        QuestionRun run = update(id, r -> r.toBuilder()
                .status(QuestionStatus.PROCESSING)
                .attempts(r.getAttempts() + 1)
                .build());
        QuestionRequest request = run.getRequest();
        String question = request.getQuestion();
        Map<String, Object> context = request.getContext() != null ? request.getContext() : Map.of();
        long start = System.nanoTime();

        try {
            TextToSqlEngine textToSql = engineRegistry.getTextToSqlEngine(nameOrDefault(request.getTextToSqlEngine()))
                    .orElseThrow(() -> new NotFoundException("Text-to-SQL engine not found: " + nameOrDefault(request.getTextToSqlEngine())));
            VisualizationEngine visualization = engineRegistry.getVisualizationEngine(nameOrDefault(request.getVisualizationEngine()))
                    .orElseThrow(() -> new NotFoundException("Visualization engine not found: " + nameOrDefault(request.getVisualizationEngine())));
            SemanticEngine semantic = null;
            if (request.getSemanticEngine() != null && !request.getSemanticEngine().isBlank()) {
                semantic = engineRegistry.getSemanticEngine(request.getSemanticEngine())
                        .orElseThrow(() -> new NotFoundException("Semantic engine not found: " + request.getSemanticEngine()));
            }
            DataConnector connector = connectionPool.getConnection(request.getConnection());

            if (semantic != null) {
                QuestionAnalysis analysis = semantic.analyzeQuestion(question, context);
                ExecutionPlan plan = semantic.generatePlan(question, analysis, new ArrayList<>(connectionPool.listConnections()));
                update(id, r -> r.toBuilder().analysis(analysis).plan(plan).build());
            }

            SqlGenerationResult sql = textToSql.generateSql(question, context, request.getConnection(), schemaHints(connector));
            if (sql == null || sql.getSql() == null || sql.getSql().isBlank()) {
                throw new QueryExecutionException("Text-to-SQL engine returned no SQL");
            }
            update(id, r -> r.toBuilder().sql(sql).build());

            QueryResult result = connector.executeQuery(sql.getSql(), null, request.getTimeoutSeconds());
            List<PanelSpec> panels = visualization.recommendVisualization(result, question, context);
            String summary = semantic != null ? semantic.summarizeResults(question, panels, context) : null;

            OffsetDateTime done = OffsetDateTime.now();
            QuestionRun completed = update(id, r -> r.toBuilder()
                    .status(QuestionStatus.COMPLETED)
                    .result(result)
                    .panels(List.copyOf(panels))
                    .summary(summary)
                    .completedAt(done)
                    .build());
            log.info("Question completed: question_id={}, rows={}, panels={}, duration_ms={}",
                    id, result.getRowCount(), panels.size(), (System.nanoTime() - start) / 1_000_000);
            evictFinishedRuns(id);
            return completed;
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            if (e instanceof KurobeException) {
                log.warn("Question failed: question_id={}, error={}", id, message);
            } else {
                log.error("Question failed: question_id={}", id, e);
            }
            QuestionRun failed = update(id, r -> r.toBuilder()
                    .status(QuestionStatus.FAILED)
                    .error(message)
                    .completedAt(OffsetDateTime.now())
                    .build());
            evictFinishedRuns(id);
            return failed;
        }
    }

    private synchronized void evictFinishedRuns(String justFinished) {
        int excess = runs.size() - maxRetained;
        if (excess <= 0) {
            return;
        }
        List<QuestionRun> finished = new ArrayList<>();
        for (QuestionRun run : runs.values()) {
            if (isFinished(run) && !run.getId().equals(justFinished)) {
                finished.add(run);
            }
        }
        finished.sort(Comparator.comparing(QuestionRun::getUpdatedAt));
        int evicted = 0;
        for (QuestionRun run : finished) {
            if (evicted == excess) {
                break;
            }
            // a retry may have reset the run since the snapshot
            if (runs.remove(run.getId(), run)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("Evicted finished questions: count={}, retained={}", evicted, runs.size());
        }
    }

    private static boolean isFinished(QuestionRun run) {
        return run.getStatus() == QuestionStatus.COMPLETED || run.getStatus() == QuestionStatus.FAILED;
    }

    private Map<String, Map<String, List<ColumnInfo>>> schemaHints(DataConnector connector) {
        try {
            return connector.getSchemaInfo(null);
        } catch (KurobeException e) {
            log.warn("Schema hints unavailable: connection={}, error={}", connector.getConfig().getName(), e.getMessage());
            return null;
        }
    }

    private QuestionRun update(String id, UnaryOperator<QuestionRun> change) {
        QuestionRun updated = runs.computeIfPresent(id, (k, run) -> change.apply(run).toBuilder()
                .updatedAt(OffsetDateTime.now())
                .build());
        if (updated == null) {
            throw new NotFoundException("Question not found: " + id);
        }
        return updated;
    }

    private static String nameOrDefault(String name) {
        return name != null && !name.isBlank() ? name : DEFAULT_ENGINE;
    }
}
