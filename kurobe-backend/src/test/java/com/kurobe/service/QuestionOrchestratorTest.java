package com.kurobe.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kurobe.connector.ConnectionPool;
import com.kurobe.connector.ConnectorFactory;
import com.kurobe.connector.QueryTimeouts;
import com.kurobe.engine.AbstractEngine;
import com.kurobe.engine.EngineRegistry;
import com.kurobe.engine.SemanticEngine;
import com.kurobe.engine.StubTextToSqlEngine;
import com.kurobe.engine.visualization.HeuristicVisualizationProvider;
import com.kurobe.exception.ConfigurationException;
import com.kurobe.exception.NotFoundException;
import com.kurobe.exception.QuestionStateException;
import com.kurobe.model.ChartType;
import com.kurobe.model.Complexity;
import com.kurobe.model.ConnectionConfig;
import com.kurobe.model.ConnectionType;
import com.kurobe.model.EngineConfig;
import com.kurobe.model.EngineType;
import com.kurobe.model.ExecutionPlan;
import com.kurobe.model.PanelSpec;
import com.kurobe.model.QuestionAnalysis;
import com.kurobe.model.QuestionRequest;
import com.kurobe.model.QuestionRun;
import com.kurobe.model.QuestionStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuestionOrchestratorTest {

    private ConnectionPool pool;
    private EngineRegistry registry;
    private QuestionOrchestrator orchestrator;

    static class KeywordSemanticEngine extends AbstractEngine implements SemanticEngine {

        KeywordSemanticEngine(EngineConfig config) {
            super(config);
        }

        @Override
        public QuestionAnalysis analyzeQuestion(String question, Map<String, Object> context) {
            requireReady();
            return QuestionAnalysis.builder()
                    .intent(question.contains(" by ") ? "breakdown" : "lookup")
                    .complexity(Complexity.SIMPLE)
                    .build();
        }

        @Override
        public ExecutionPlan generatePlan(String question, QuestionAnalysis analysis, List<String> availableConnections) {
            requireReady();
            return ExecutionPlan.builder()
                    .step(Map.of("action", "query", "connection", availableConnections.get(0)))
                    .requiredEngine("text_to_sql")
                    .estimatedTime(1.0)
                    .build();
        }

        @Override
        public String summarizeResults(String question, List<PanelSpec> panels, Map<String, Object> context) {
            requireReady();
            return panels.size() + " panels for: " + question;
        }
    }

    @BeforeEach
    void setUp() {
        pool = new ConnectionPool(new ConnectorFactory(QueryTimeouts.DEFAULTS, new ObjectMapper()));
        pool.addConnection(ConnectionConfig.builder().name("local").type(ConnectionType.EMBEDDED).build());

        registry = new EngineRegistry();
        registry.registerTextToSqlEngine(StubTextToSqlEngine.PROVIDER, StubTextToSqlEngine::new);
        registry.registerSemanticEngine("keyword", KeywordSemanticEngine::new);
        registry.registerProvider(new HeuristicVisualizationProvider());
        registry.createEngine(EngineType.TEXT_TO_SQL, EngineConfig.builder()
                .name("default")
                .provider(StubTextToSqlEngine.PROVIDER)
                .setting("sql", "SELECT 'EU' AS region, 10 AS revenue UNION ALL SELECT 'US', 7 ORDER BY region")
                .build());
        registry.createEngine(EngineType.TEXT_TO_SQL, EngineConfig.builder()
                .name("orders")
                .provider(StubTextToSqlEngine.PROVIDER)
                .setting("sql", "SELECT COUNT(*) AS n FROM orders")
                .build());
        registry.createEngine(EngineType.VISUALIZATION, EngineConfig.builder()
                .name("default")
                .provider("heuristic")
                .build());
        registry.createEngine(EngineType.SEMANTIC, EngineConfig.builder()
                .name("keyword")
                .provider("keyword")
                .build());

        orchestrator = new QuestionOrchestrator(pool, registry);
    }

    @AfterEach
    void tearDown() {
        registry.shutdownAll();
        pool.closeAll();
    }

    @Test
    void answersQuestionEndToEnd() {
        QuestionRun run = orchestrator.ask(QuestionRequest.builder()
                .question("revenue by region")
                .connection("local")
                .semanticEngine("keyword")
                .build());

        assertThat(run.getStatus()).isEqualTo(QuestionStatus.COMPLETED);
        assertThat(run.getAttempts()).isEqualTo(1);
        assertThat(run.getAnalysis().getIntent()).isEqualTo("breakdown");
        assertThat(run.getPlan().getSteps()).singleElement().satisfies(s -> assertThat(s).containsEntry("connection", "local"));
        assertThat(run.getSql().getConnectionId()).isEqualTo("local");
        assertThat(run.getResult().getRows()).containsExactly(List.of("EU", 10), List.of("US", 7));
        assertThat(run.getPanels()).extracting(PanelSpec::getType)
                .containsExactly(ChartType.BAR, ChartType.PIE, ChartType.TABLE);
        assertThat(run.getSummary()).isEqualTo("3 panels for: revenue by region");
        assertThat(run.getError()).isNull();
        assertThat(run.getCompletedAt()).isNotNull();
        assertThat(orchestrator.get(run.getId())).isEqualTo(run);
    }

    @Test
    void semanticEngineIsOptional() {
        QuestionRun run = orchestrator.ask(QuestionRequest.builder()
                .question("revenue by region")
                .connection("local")
                .build());

        assertThat(run.getStatus()).isEqualTo(QuestionStatus.COMPLETED);
        assertThat(run.getAnalysis()).isNull();
        assertThat(run.getSummary()).isNull();
    }

    @Test
    void failingQueryMarksRunFailedAndRetryStartsOver() {
        QuestionRun failed = orchestrator.ask(QuestionRequest.builder()
                .question("how many orders")
                .connection("local")
                .textToSqlEngine("orders")
                .build());

        assertThat(failed.getStatus()).isEqualTo(QuestionStatus.FAILED);
        assertThat(failed.getError()).contains("orders");
        assertThat(failed.getSql().getSql()).isEqualTo("SELECT COUNT(*) AS n FROM orders");
        assertThat(failed.getResult()).isNull();

        pool.getConnection("local").executeQuery("CREATE TABLE orders AS SELECT 1 AS id");
        QuestionRun retried = orchestrator.retry(failed.getId());

        assertThat(retried.getStatus()).isEqualTo(QuestionStatus.COMPLETED);
        assertThat(retried.getAttempts()).isEqualTo(2);
        assertThat(retried.getError()).isNull();
        assertThat(retried.getResult().getRows()).containsExactly(List.of(1L));
        assertThat(retried.getPanels()).extracting(PanelSpec::getType).containsExactly(ChartType.METRIC, ChartType.TABLE);
    }

    @Test
    void missingEngineFailsTheRun() {
        QuestionRun run = orchestrator.ask(QuestionRequest.builder()
                .question("anything")
                .connection("local")
                .textToSqlEngine("nope")
                .build());

        assertThat(run.getStatus()).isEqualTo(QuestionStatus.FAILED);
        assertThat(run.getError()).isEqualTo("Text-to-SQL engine not found: nope");
    }

    @Test
    void missingConnectionFailsTheRun() {
        QuestionRun run = orchestrator.ask(QuestionRequest.builder()
                .question("anything")
                .connection("warehouse")
                .build());

        assertThat(run.getStatus()).isEqualTo(QuestionStatus.FAILED);
        assertThat(run.getError()).isEqualTo("Connection not found: warehouse");
    }

    @Test
    void onlyFailedRunsCanBeRetried() {
        QuestionRun run = orchestrator.ask(QuestionRequest.builder()
                .question("revenue by region")
                .connection("local")
                .build());

        assertThatThrownBy(() -> orchestrator.retry(run.getId())).isInstanceOf(QuestionStateException.class);
        assertThatThrownBy(() -> orchestrator.retry("unknown")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void rejectsIncompleteRequests() {
        assertThatThrownBy(() -> orchestrator.ask(QuestionRequest.builder().question(" ").connection("local").build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> orchestrator.ask(QuestionRequest.builder().question("q").build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(orchestrator.list()).isEmpty();
    }

    @Test
    void listsRunsInCreationOrder() {
        QuestionRun first = orchestrator.ask(QuestionRequest.builder().question("one").connection("local").build());
        QuestionRun second = orchestrator.ask(QuestionRequest.builder().question("two").connection("local").build());

        assertThat(orchestrator.list()).extracting(QuestionRun::getId).containsExactly(first.getId(), second.getId());
    }

    @Test
    void oldestFinishedRunsAreEvictedBeyondRetention() {
        QuestionOrchestrator bounded = new QuestionOrchestrator(pool, registry, 2);
        QuestionRun first = bounded.ask(QuestionRequest.builder().question("one").connection("local").build());
        QuestionRun failed = bounded.ask(QuestionRequest.builder()
                .question("two").connection("local").textToSqlEngine("orders").build());
        QuestionRun third = bounded.ask(QuestionRequest.builder().question("three").connection("local").build());

        assertThat(bounded.list()).extracting(QuestionRun::getId).containsExactly(failed.getId(), third.getId());
        assertThatThrownBy(() -> bounded.get(first.getId())).isInstanceOf(NotFoundException.class);

        pool.getConnection("local").executeQuery("CREATE TABLE orders AS SELECT 1 AS id");
        QuestionRun retried = bounded.retry(failed.getId());
        QuestionRun fourth = bounded.ask(QuestionRequest.builder().question("four").connection("local").build());

        assertThat(retried.getStatus()).isEqualTo(QuestionStatus.COMPLETED);
        assertThat(bounded.list()).extracting(QuestionRun::getId).containsExactly(failed.getId(), fourth.getId());
    }

    @Test
    void retentionMustBePositive() {
        assertThatThrownBy(() -> new QuestionOrchestrator(pool, registry, 0)).isInstanceOf(ConfigurationException.class);
    }
}
