package com.kurobe.config;

import com.kurobe.connector.ConnectionPool;
import com.kurobe.engine.EngineRegistry;
import com.kurobe.engine.visualization.HeuristicVisualizationProvider;
import com.kurobe.exception.DataConnectionException;
import com.kurobe.model.ConnectionConfig;
import com.kurobe.model.ConnectionType;
import com.kurobe.model.EngineConfig;
import com.kurobe.model.EngineType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class KurobeBootstrapTest {

    private final ConnectionPool pool = mock(ConnectionPool.class);
    private final EngineRegistry registry = new EngineRegistry();
    private final KurobeBootstrap bootstrap = new KurobeBootstrap(
            pool, registry, List.of(new HeuristicVisualizationProvider()), new BootstrapConfigLoader(null));

    @AfterEach
    void tearDown() {
        registry.shutdownAll();
    }

    private static ConnectionConfig connection(String name) {
        return ConnectionConfig.builder().name(name).type(ConnectionType.RELATIONAL).host("db").build();
    }

    private static BootstrapConfig.EngineDefinition visualization(String name, String provider, boolean enabled) {
        return new BootstrapConfig.EngineDefinition(EngineType.VISUALIZATION,
                EngineConfig.builder().name(name).provider(provider).enabled(enabled).build());
    }

    @Test
    void failuresAreSkippedAndTheRestStarts() {
        when(pool.addConnection(argThat(c -> c != null && "down".equals(c.getName()))))
                .thenThrow(new DataConnectionException("down", "refused"));
        registry.registerProvider(new HeuristicVisualizationProvider());

        int started = bootstrap.apply(new BootstrapConfig(
                List.of(connection("down"), connection("up")),
                List.of(
                        visualization("default", "heuristic", true),
                        visualization("fancy", "vega", true),
                        visualization("off", "heuristic", false))));

        assertThat(started).isEqualTo(2);
        verify(pool).addConnection(argThat(c -> c != null && "up".equals(c.getName())));
        assertThat(registry.getVisualizationEngine("default")).isPresent();
        assertThat(registry.getVisualizationEngine("fancy")).isEmpty();
        assertThat(registry.getVisualizationEngine("off")).isEmpty();
    }

    @Test
    void startRegistersProvidersAndReadsTheBootstrapFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("kurobe.yaml");
        Files.writeString(file, """
                engines:
                  - type: visualization
                    name: default
                    provider: heuristic
                """);
        ReflectionTestUtils.setField(bootstrap, "configPath", file.toString());

        bootstrap.start();

        assertThat(registry.registeredProviders(EngineType.VISUALIZATION)).containsExactly("heuristic");
        assertThat(registry.getVisualizationEngine("default")).get().satisfies(e -> assertThat(e.isReady()).isTrue());
    }

    @Test
    void missingBootstrapFileStartsEmpty(@TempDir Path dir) {
        ReflectionTestUtils.setField(bootstrap, "configPath", dir.resolve("absent.yaml").toString());

        bootstrap.start();

        assertThat(registry.listEngines()).isEmpty();
        assertThat(registry.registeredProviders(EngineType.VISUALIZATION)).containsExactly("heuristic");
    }
}
