package io.graphsight.core;

import io.graphsight.core.detect.DiagramTypeDetector;
import io.graphsight.core.detect.OracleDiagramTypeDetector;
import io.graphsight.core.engine.GraphInterpreterEngine;
import io.graphsight.core.engine.TraversalObserver;
import io.graphsight.core.identity.SpatialFingerprintMatcher;
import io.graphsight.core.oracle.OracleFactory;
import io.graphsight.core.oracle.OracleResponseParser;
import io.graphsight.core.oracle.VisionOracle;
import io.graphsight.core.oracle.spi.OracleProvider;
import io.graphsight.core.oracle.stub.StubOracleProvider;
import io.graphsight.core.strategy.DefaultStrategyRegistry;
import io.graphsight.core.strategy.StrategyRegistry;
import io.graphsight.core.validation.SyntaxValidator;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/// Factory for creating and wiring {@link GraphSight} instances.
///
/// Handles credential discovery, oracle provider selection and component wiring. The
/// response parser is the one collaborator without a core default: it lives in the
/// serialization module.
///
/// ### Usage
/// {@snippet :
/// var graphSight = GraphSightFactory.builder()
///     .config(GraphSightConfig.builder().model("gpt-4o-mini").build())
///     .loadCredentials(properties)
///     .oracleProvider(new LangChain4jOracleProvider())
///     .responseParser(new JacksonOracleResponseParser())
///     .syntaxValidator(new NodeMermaidSyntaxValidator())
///     .build();
/// }
///
/// @implNote Utility class with only static methods.
///
/// @see GraphSight
/// @see GraphSightConfig
public final class GraphSightFactory {

    static final String CREDENTIALS_PREFIX = "graphsight.credentials.";

    private GraphSightFactory() {}

    /// Discovers API credentials from environment variables.
    ///
    /// Picks up variables ending in `_API_KEY`, `_KEY`, `_SECRET` or `_TOKEN`.
    ///
    /// @return discovered credentials, never null (may be empty)
    public static Map<String, String> loadCredentialsFromEnvironment() {
        Map<String, String> credentials = new HashMap<>();
        System.getenv()
                .forEach(
                        (key, value) -> {
                            if (value != null && !value.isEmpty() && isApiKeyPattern(key)) {
                                credentials.put(key, value);
                            }
                        });
        return credentials;
    }

    /// Loads credentials from properties.
    ///
    /// Supports:
    /// - prefixed keys (`graphsight.credentials.OPENAI_API_KEY=...`), prefix stripped
    /// - direct API key names (`OPENAI_API_KEY=...`)
    /// - stub mode: `graphsight.stub.enabled=true`
    ///
    /// @param properties source properties, not null
    /// @return credentials, never null (may be empty)
    public static Map<String, String> loadCredentialsFromProperties(Properties properties) {
        Map<String, String> credentials = new HashMap<>();
        properties.forEach(
                (key, value) -> {
                    String keyStr = key.toString();
                    String valueStr = value.toString();
                    if (valueStr.isEmpty()) {
                        return;
                    }
                    if (keyStr.startsWith(CREDENTIALS_PREFIX)) {
                        credentials.put(keyStr.substring(CREDENTIALS_PREFIX.length()), valueStr);
                    } else if (keyStr.equals(StubOracleProvider.ENABLED_PROPERTY)) {
                        credentials.put(StubOracleProvider.ENABLED_PROPERTY, valueStr);
                    } else if (isApiKeyPattern(keyStr)) {
                        credentials.put(keyStr, valueStr);
                    }
                });
        return credentials;
    }

    /// Loads credentials from the environment and properties; properties win on conflicts.
    ///
    /// @param properties source properties, not null
    /// @return merged credentials, never null
    public static Map<String, String> loadCredentials(Properties properties) {
        Map<String, String> credentials = loadCredentialsFromEnvironment();
        credentials.putAll(loadCredentialsFromProperties(properties));
        return credentials;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean isApiKeyPattern(String key) {
        String upperKey = key.toUpperCase(Locale.ROOT);
        return upperKey.endsWith("_API_KEY")
                || upperKey.endsWith("_KEY")
                || upperKey.endsWith("_SECRET")
                || upperKey.endsWith("_TOKEN");
    }

    /// Sets the `graphsight.stub.enabled` system property if enabled in credentials.
    ///
    /// @apiNote **Side effects**: modifies JVM system properties when stub mode is enabled.
    private static void applyStubModeSetting(Map<String, String> credentials) {
        if ("true".equalsIgnoreCase(credentials.get(StubOracleProvider.ENABLED_PROPERTY))) {
            System.setProperty(StubOracleProvider.ENABLED_PROPERTY, "true");
        }
    }

    /// Fluent builder for {@link GraphSight}.
    ///
    /// The oracle comes either from {@link #oracle(VisionOracle)} or from the
    /// highest-priority provider supporting the configured model. The built-in
    /// {@link StubOracleProvider} is always included.
    ///
    /// @implNote **Not thread-safe**. Configure on one thread, then call {@link #build()}.
    public static class Builder {
        private GraphSightConfig config = new GraphSightConfig();
        private Map<String, String> credentials = new HashMap<>();
        private final List<OracleProvider> oracleProviders = new ArrayList<>();
        private final List<TraversalObserver> observers = new ArrayList<>();
        private VisionOracle oracle;
        private OracleResponseParser responseParser;
        private SyntaxValidator syntaxValidator;
        private StrategyRegistry strategyRegistry;
        private DiagramTypeDetector detector;
        private ExecutorService executorService;

        public Builder config(GraphSightConfig config) {
            this.config = config;
            return this;
        }

        public Builder credential(String key, String value) {
            this.credentials.put(key, value);
            return this;
        }

        public Builder credentials(Map<String, String> credentials) {
            this.credentials.putAll(credentials);
            return this;
        }

        public Builder openAiApiKey(String apiKey) {
            this.credentials.put("OPENAI_API_KEY", apiKey);
            return this;
        }

        public Builder anthropicApiKey(String apiKey) {
            this.credentials.put("ANTHROPIC_API_KEY", apiKey);
            return this;
        }

        public Builder googleApiKey(String apiKey) {
            this.credentials.put("GOOGLE_API_KEY", apiKey);
            return this;
        }

        public Builder loadCredentials(Properties properties) {
            this.credentials.putAll(GraphSightFactory.loadCredentials(properties));
            return this;
        }

        /// Replaces the explicit oracle providers.
        ///
        /// @param providers providers, not null; do not include the stub provider
        public Builder oracleProviders(List<OracleProvider> providers) {
            this.oracleProviders.clear();
            this.oracleProviders.addAll(providers);
            return this;
        }

        public Builder oracleProvider(OracleProvider provider) {
            this.oracleProviders.add(provider);
            return this;
        }

        /// Uses a ready oracle instead of provider selection.
        ///
        /// @param oracle the oracle, may be null to select by provider
        public Builder oracle(VisionOracle oracle) {
            this.oracle = oracle;
            return this;
        }

        /// Sets the parser for oracle replies. Required.
        public Builder responseParser(OracleResponseParser responseParser) {
            this.responseParser = responseParser;
            return this;
        }

        /// @param syntaxValidator Mermaid validator, may be null to skip validation
        public Builder syntaxValidator(SyntaxValidator syntaxValidator) {
            this.syntaxValidator = syntaxValidator;
            return this;
        }

        /// @param strategyRegistry registry, may be null for the built-in strategies
        public Builder strategyRegistry(StrategyRegistry strategyRegistry) {
            this.strategyRegistry = strategyRegistry;
            return this;
        }

        /// @param detector detector, may be null for oracle-based classification
        public Builder detector(DiagramTypeDetector detector) {
            this.detector = detector;
            return this;
        }

        public Builder observer(TraversalObserver observer) {
            this.observers.add(observer);
            return this;
        }

        /// @param executorService pool for batch runs, may be null for a fixed pool
        ///     sized by the configuration; a supplied pool stays open when the facade
        ///     is closed
        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        /// Enables or disables the stub oracle.
        public Builder stubMode(boolean enabled) {
            this.credentials.put(StubOracleProvider.ENABLED_PROPERTY, String.valueOf(enabled));
            return this;
        }

        /// Builds the configured {@link GraphSight}.
        ///
        /// @apiNote **Side effects**:
        /// - auto-loads environment credentials if none were provided
        /// - sets `graphsight.stub.enabled` if stub mode is enabled
        /// - creates a thread pool if none was provided
        ///
        /// @return the facade, never null
        /// @throws IllegalStateException if no response parser is set or no provider
        ///     supports the configured model
        public GraphSight build() {
            if (responseParser == null) {
                throw new IllegalStateException("A response parser is required");
            }
            if (credentials.isEmpty()) {
                credentials = GraphSightFactory.loadCredentialsFromEnvironment();
            }
            applyStubModeSetting(credentials);

            VisionOracle resolvedOracle = oracle;
            if (resolvedOracle == null) {
                List<OracleProvider> providers = new ArrayList<>(oracleProviders);
                providers.add(new StubOracleProvider());
                resolvedOracle =
                        new OracleFactory(credentials, providers).createOracle(config.toOracleConfig());
            }

            StrategyRegistry registry =
                    strategyRegistry != null
                            ? strategyRegistry
                            : DefaultStrategyRegistry.withDefaults(responseParser, config.isUseGrid());
            DiagramTypeDetector typeDetector =
                    detector != null
                            ? detector
                            : new OracleDiagramTypeDetector(
                                    responseParser, config.getDetectorMinConfidence());

            GraphInterpreterEngine engine =
                    new GraphInterpreterEngine(
                            config.toBudget(),
                            new SpatialFingerprintMatcher(config.getSpatialTolerance()),
                            config.getFrontierOrder(),
                            config.getAuditRounds());
            observers.forEach(engine::addObserver);

            boolean ownsPool = executorService == null;
            ExecutorService pool =
                    ownsPool ? Executors.newFixedThreadPool(config.getThreadPoolSize()) : executorService;

            return new GraphSight(
                    config,
                    resolvedOracle,
                    typeDetector,
                    registry,
                    engine,
                    syntaxValidator,
                    pool,
                    ownsPool);
        }
    }
}
