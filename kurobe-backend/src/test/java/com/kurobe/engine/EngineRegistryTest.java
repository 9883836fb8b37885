package com.kurobe.engine;

import com.kurobe.engine.visualization.HeuristicVisualizationEngine;
import com.kurobe.engine.visualization.HeuristicVisualizationProvider;
import com.kurobe.exception.ConfigurationException;
import com.kurobe.exception.UnknownProviderException;
import com.kurobe.model.EngineConfig;
import com.kurobe.model.EngineType;
import com.kurobe.model.SqlGenerationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class EngineRegistryTest {

    private EngineRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new EngineRegistry();
        registry.registerTextToSqlEngine(StubTextToSqlEngine.PROVIDER, StubTextToSqlEngine::new);
    }

    private static EngineConfig stub(String name) {
        return EngineConfig.builder().name(name).provider(StubTextToSqlEngine.PROVIDER).build();
    }

    @Test
    void createdStubEngineGeneratesSql() {
        Engine engine = registry.createEngine(EngineType.TEXT_TO_SQL, stub("default"));

        assertThat(engine.isReady()).isTrue();
        TextToSqlEngine textToSql = registry.getTextToSqlEngine("default").orElseThrow();
        assertThat(textToSql).isSameAs(engine);

        SqlGenerationResult result = textToSql.generateSql("count customers");
        assertThat(result.getSql()).isNotBlank();
        assertThat(result.getConfidence()).isBetween(0.0, 1.0);
    }

    @Test
    void unknownProviderIsRejectedAndNothingIsRegistered() {
        EngineConfig config = EngineConfig.builder().name("gpt").provider("openai").build();

        assertThatThrownBy(() -> registry.createEngine(EngineType.TEXT_TO_SQL, config))
                .isInstanceOfSatisfying(UnknownProviderException.class, e -> {
                    assertThat(e.getEngineType()).isEqualTo(EngineType.TEXT_TO_SQL);
                    assertThat(e.getProvider()).isEqualTo("openai");
                });
        assertThat(registry.getEngine(EngineType.TEXT_TO_SQL, "gpt")).isEmpty();
    }

    @Test
    void providersAreScopedByType() {
        assertThatThrownBy(() -> registry.createEngine(EngineType.SEMANTIC, stub("default")))
                .isInstanceOf(UnknownProviderException.class);
        assertThat(registry.registeredProviders(EngineType.TEXT_TO_SQL)).containsExactly("stub");
        assertThat(registry.registeredProviders(EngineType.SEMANTIC)).isEmpty();
    }

    @Test
    void failedInitializeIsNotRegistered() {
        EngineConfig config = stub("broken").toBuilder().setting("fail_initialize", true).build();

        assertThatThrownBy(() -> registry.createEngine(EngineType.TEXT_TO_SQL, config))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("model endpoint unreachable");
        assertThat(registry.getTextToSqlEngine("broken")).isEmpty();
        assertThat(registry.listEngines()).isEmpty();
    }

    @Test
    void recreatingUnderSameKeyShutsDownPreviousInstance() {
        StubTextToSqlEngine first = (StubTextToSqlEngine) registry.createEngine(EngineType.TEXT_TO_SQL, stub("default"));
        StubTextToSqlEngine second = (StubTextToSqlEngine) registry.createEngine(EngineType.TEXT_TO_SQL, stub("default"));

        assertThat(registry.getTextToSqlEngine("default")).containsSame(second);
        assertThat(first.isReady()).isFalse();
        assertThat(first.shutdowns()).isEqualTo(1);
        assertThat(second.isReady()).isTrue();
    }

    @Test
    void shutdownAllEmptiesTheTable() {
        StubTextToSqlEngine a = (StubTextToSqlEngine) registry.createEngine(EngineType.TEXT_TO_SQL, stub("a"));
        registry.registerProvider(new HeuristicVisualizationProvider());
        registry.createEngine(EngineType.VISUALIZATION,
                EngineConfig.builder().name("default").provider(HeuristicVisualizationEngine.PROVIDER).build());

        registry.shutdownAll();

        assertThat(registry.listEngines()).isEmpty();
        assertThat(registry.getEngine(EngineType.TEXT_TO_SQL, "a")).isEmpty();
        assertThat(a.shutdowns()).isEqualTo(1);
    }

    @Test
    void validateAllReportsEveryEngineByKey() {
        registry.createEngine(EngineType.TEXT_TO_SQL, stub("healthy"));
        registry.createEngine(EngineType.TEXT_TO_SQL, stub("sick").toBuilder().setting("unhealthy", true).build());

        assertThat(registry.validateAll())
                .containsExactly(
                        entry("text_to_sql:healthy", true),
                        entry("text_to_sql:sick", false));
    }

    @Test
    void shutdownEngineRemovesOneKey() {
        registry.createEngine(EngineType.TEXT_TO_SQL, stub("a"));

        assertThat(registry.shutdownEngine(EngineType.TEXT_TO_SQL, "a")).isTrue();
        assertThat(registry.shutdownEngine(EngineType.TEXT_TO_SQL, "a")).isFalse();
        assertThat(registry.getEngine(EngineType.TEXT_TO_SQL, "a")).isEmpty();
    }

    @Test
    void providerMustProduceTheRequestedRole() {
        registry.registerProvider(EngineType.SEMANTIC, "confused", StubTextToSqlEngine::new);

        assertThatThrownBy(() -> registry.createEngine(EngineType.SEMANTIC,
                EngineConfig.builder().name("x").provider("confused").build()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("did not produce a semantic engine");
    }

    @Test
    void engineNameIsRequired() {
        assertThatThrownBy(() -> registry.createEngine(EngineType.TEXT_TO_SQL,
                EngineConfig.builder().provider(StubTextToSqlEngine.PROVIDER).build()))
                .isInstanceOf(ConfigurationException.class);
    }
}
