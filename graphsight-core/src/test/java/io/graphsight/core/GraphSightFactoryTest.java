package io.graphsight.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.graphsight.core.engine.FrontierOrder;
import io.graphsight.core.engine.TraversalEvent;
import io.graphsight.core.graph.DiagramImage;
import io.graphsight.core.graph.Focus;
import io.graphsight.core.graph.OutputFormat;
import io.graphsight.core.oracle.OracleConfig;
import io.graphsight.core.oracle.VisionOracle;
import io.graphsight.core.oracle.spi.OracleProvider;
import io.graphsight.core.oracle.stub.StubOracleProvider;
import io.graphsight.core.oracle.stub.StubVisionOracle;
import io.graphsight.core.testing.ScriptedResponseParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class GraphSightFactoryTest {

    private String savedStubProperty;
    private final List<GraphSight> built = new ArrayList<>();

    @BeforeEach
    void setUp() {
        savedStubProperty = System.getProperty(StubOracleProvider.ENABLED_PROPERTY);
        System.clearProperty(StubOracleProvider.ENABLED_PROPERTY);
    }

    @AfterEach
    void tearDown() {
        built.forEach(GraphSight::close);
        if (savedStubProperty == null) {
            System.clearProperty(StubOracleProvider.ENABLED_PROPERTY);
        } else {
            System.setProperty(StubOracleProvider.ENABLED_PROPERTY, savedStubProperty);
        }
    }

    private GraphSight keep(GraphSight graphSight) {
        built.add(graphSight);
        return graphSight;
    }

    @Nested
    class Credentials {

        @Test
        void shouldLoadPrefixedAndDirectKeys() {
            Properties properties = new Properties();
            properties.setProperty("graphsight.credentials.OPENAI_API_KEY", "sk-prefixed");
            properties.setProperty("ANTHROPIC_API_KEY", "sk-direct");
            properties.setProperty("GITHUB_TOKEN", "ghp");
            properties.setProperty("graphsight.stub.enabled", "true");
            properties.setProperty("graphsight.oracle.model", "gpt-4o");
            properties.setProperty("EMPTY_KEY", "");

            Map<String, String> credentials = GraphSightFactory.loadCredentialsFromProperties(properties);

            assertThat(credentials)
                    .containsEntry("OPENAI_API_KEY", "sk-prefixed")
                    .containsEntry("ANTHROPIC_API_KEY", "sk-direct")
                    .containsEntry("GITHUB_TOKEN", "ghp")
                    .containsEntry("graphsight.stub.enabled", "true")
                    .doesNotContainKey("graphsight.oracle.model")
                    .doesNotContainKey("EMPTY_KEY");
        }

        @Test
        void shouldLetPropertiesOverrideEnvironment() {
            Properties properties = new Properties();
            properties.setProperty("GRAPHSIGHT_TEST_API_KEY", "from-properties");

            Map<String, String> credentials = GraphSightFactory.loadCredentials(properties);

            assertThat(credentials).containsEntry("GRAPHSIGHT_TEST_API_KEY", "from-properties");
        }
    }

    @Nested
    class Build {

        @Test
        void shouldRequireResponseParser() {
            assertThatThrownBy(() -> GraphSightFactory.builder().oracle(new StubVisionOracle()).build())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("response parser");
        }

        @Test
        void shouldCreateStubOracleInStubMode() {
            GraphSight graphSight =
                    keep(
                            GraphSightFactory.builder()
                                    .config(GraphSightConfig.builder().model("gpt-4o-mini").build())
                                    .responseParser(new ScriptedResponseParser())
                                    .stubMode(true)
                                    .build());

            assertThat(graphSight.getOracle()).isInstanceOf(StubVisionOracle.class);
            assertThat(graphSight.getOracle().modelName()).isEqualTo("gpt-4o-mini");
            assertThat(System.getProperty(StubOracleProvider.ENABLED_PROPERTY)).isEqualTo("true");
        }

        @Test
        void shouldFailWhenNoProviderSupportsModel() {
            assertThatThrownBy(
                            () ->
                                    GraphSightFactory.builder()
                                            .config(GraphSightConfig.builder().model("mystery-model").build())
                                            .responseParser(new ScriptedResponseParser())
                                            .stubMode(false)
                                            .build())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("mystery-model");
        }

        @Test
        void shouldUseExplicitProviderWithCredentials() {
            VisionOracle oracle = mock(VisionOracle.class);
            OracleProvider provider = mock(OracleProvider.class);
            when(provider.getName()).thenReturn("custom");
            when(provider.supportsModel("custom-vision")).thenReturn(true);
            when(provider.createOracle(any(OracleConfig.class), anyMap())).thenReturn(oracle);

            GraphSight graphSight =
                    keep(
                            GraphSightFactory.builder()
                                    .config(GraphSightConfig.builder().model("custom-vision").build())
                                    .openAiApiKey("sk-test")
                                    .oracleProvider(provider)
                                    .responseParser(new ScriptedResponseParser())
                                    .build());

            assertThat(graphSight.getOracle()).isSameAs(oracle);
            verify(provider).createOracle(any(OracleConfig.class), eq(Map.of("OPENAI_API_KEY", "sk-test")));
        }

        @Test
        void shouldApplyConfigurationToEngine() {
            GraphSight graphSight =
                    keep(
                            GraphSightFactory.builder()
                                    .config(GraphSightConfig.builder().maxIterations(7).maxCostUsd(0.5).build())
                                    .oracle(new StubVisionOracle())
                                    .responseParser(new ScriptedResponseParser())
                                    .build());

            assertThat(graphSight.getEngine().getBudget().maxIterations()).isEqualTo(7);
            assertThat(graphSight.getEngine().getBudget().maxCostUsd()).isEqualTo(0.5);
            assertThat(graphSight.getStrategies().supportedTypes()).hasSize(3);
        }

        @Test
        void shouldApplyExplorationPolicyToEngine() {
            GraphSight graphSight =
                    keep(
                            GraphSightFactory.builder()
                                    .config(
                                            GraphSightConfig.builder()
                                                    .frontierOrder(FrontierOrder.DEPTH_FIRST)
                                                    .auditRounds(2)
                                                    .build())
                                    .oracle(new StubVisionOracle())
                                    .responseParser(new ScriptedResponseParser())
                                    .build());

            assertThat(graphSight.getEngine().getFrontierOrder()).isEqualTo(FrontierOrder.DEPTH_FIRST);
            assertThat(graphSight.getEngine().getAuditRounds()).isEqualTo(2);
        }

        @Test
        void shouldRegisterObservers() throws Exception {
            List<TraversalEvent> events = new ArrayList<>();
            GraphSight graphSight =
                    keep(
                            GraphSightFactory.builder()
                                    .oracle(new StubVisionOracle())
                                    .responseParser(new ScriptedResponseParser().start(Focus.of("Start")))
                                    .observer(events::add)
                                    .build());

            graphSight.interpret(
                    new DiagramImage("d.png", new byte[] {1}, "image/png", 0, 0), OutputFormat.MERMAID);

            assertThat(events).isNotEmpty();
        }

        @Test
        void shouldLeaveSuppliedExecutorRunningOnClose() {
            ExecutorService pool = Executors.newSingleThreadExecutor();
            try {
                GraphSight graphSight =
                        GraphSightFactory.builder()
                                .oracle(new StubVisionOracle())
                                .responseParser(new ScriptedResponseParser())
                                .executorService(pool)
                                .build();

                graphSight.close();

                assertThat(pool.isShutdown()).isFalse();
            } finally {
                pool.shutdownNow();
            }
        }
    }
}
