package io.graphsight.core;

import io.graphsight.core.engine.FrontierOrder;
import io.graphsight.core.engine.TraversalBudget;
import io.graphsight.core.graph.DiagramType;
import io.graphsight.core.identity.SpatialFingerprintMatcher;
import io.graphsight.core.oracle.OracleConfig;
import io.graphsight.core.oracle.RetryPolicy;
import java.time.Duration;
import java.util.Properties;

/// Configuration options for a GraphSight environment.
///
/// Controls traversal limits and order, the connection audit, identity tolerance, oracle retry behavior, diagram-type
/// fallback and threading. Use the {@link Builder} for fluent configuration, setters for
/// mutable configuration, or {@link #fromProperties(Properties)} to read `graphsight.*`
/// keys.
///
/// ### Default Values
/// - `maxIterations`: `30`
/// - `maxCostUsd`: `0` (unlimited)
/// - `maxDuration`: 10 minutes
/// - `frontierOrder`: `BREADTH_FIRST`
/// - `auditRounds`: `0` (no connection audit)
/// - `spatialTolerance`: `60.0` on the 0-1000 grid
/// - `oracleMaxAttempts`: `3`, `initialBackoff`: 500 ms, `backoffMultiplier`: `2.0`,
///   `maxBackoff`: 8 s
/// - `fallbackDiagramType`: `FLOWCHART` (null surfaces detector failures)
/// - `detectorMinConfidence`: `0.5`
/// - `useGrid`: `false`
/// - `model`: `gpt-4o`
/// - `threadPoolSize`: `4`
///
/// @implNote **Not thread-safe**. Configure before passing to {@link GraphSightFactory}
/// and do not modify afterwards.
public class GraphSightConfig {

    static final String PREFIX = "graphsight.";

    private int maxIterations = TraversalBudget.DEFAULT_MAX_ITERATIONS;
    private double maxCostUsd = 0.0;
    private Duration maxDuration = TraversalBudget.DEFAULT_MAX_DURATION;
    private FrontierOrder frontierOrder = FrontierOrder.BREADTH_FIRST;
    private int auditRounds = 0;
    private double spatialTolerance = SpatialFingerprintMatcher.DEFAULT_TOLERANCE;
    private int oracleMaxAttempts = 3;
    private Duration initialBackoff = Duration.ofMillis(500);
    private double backoffMultiplier = 2.0;
    private Duration maxBackoff = Duration.ofSeconds(8);
    private DiagramType fallbackDiagramType = DiagramType.FLOWCHART;
    private double detectorMinConfidence = 0.5;
    private boolean useGrid = false;
    private String model = "gpt-4o";
    private int threadPoolSize = 4;

    /// Creates a configuration with default values.
    public GraphSightConfig() {}

    /// Reads configuration from properties, keeping defaults for absent keys.
    ///
    /// Recognized keys: `graphsight.traversal.max-iterations`,
    /// `graphsight.traversal.max-cost-usd`, `graphsight.traversal.max-duration-seconds`,
    /// `graphsight.traversal.frontier-order` (`bfs` or `dfs`), `graphsight.audit.max-rounds`,
    /// `graphsight.identity.spatial-tolerance`, `graphsight.oracle.max-attempts`,
    /// `graphsight.oracle.initial-backoff-ms`, `graphsight.oracle.backoff-multiplier`,
    /// `graphsight.oracle.max-backoff-ms`, `graphsight.oracle.model`,
    /// `graphsight.detector.fallback-type` (`none` disables the fallback),
    /// `graphsight.detector.min-confidence`, `graphsight.prompt.use-grid`,
    /// `graphsight.thread-pool-size`.
    ///
    /// @param properties source properties, not null
    /// @return the configuration, never null
    /// @throws IllegalArgumentException if a value cannot be parsed
    public static GraphSightConfig fromProperties(Properties properties) {
        GraphSightConfig config = new GraphSightConfig();
        String value;
        if ((value = get(properties, "traversal.max-iterations")) != null) {
            config.setMaxIterations(parseInt("traversal.max-iterations", value));
        }
        if ((value = get(properties, "traversal.max-cost-usd")) != null) {
            config.setMaxCostUsd(parseDouble("traversal.max-cost-usd", value));
        }
        if ((value = get(properties, "traversal.max-duration-seconds")) != null) {
            config.setMaxDuration(
                    Duration.ofSeconds(parseInt("traversal.max-duration-seconds", value)));
        }
        if ((value = get(properties, "traversal.frontier-order")) != null) {
            config.setFrontierOrder(FrontierOrder.fromName(value));
        }
        if ((value = get(properties, "audit.max-rounds")) != null) {
            config.setAuditRounds(parseInt("audit.max-rounds", value));
        }
        if ((value = get(properties, "identity.spatial-tolerance")) != null) {
            config.setSpatialTolerance(parseDouble("identity.spatial-tolerance", value));
        }
        if ((value = get(properties, "oracle.max-attempts")) != null) {
            config.setOracleMaxAttempts(parseInt("oracle.max-attempts", value));
        }
        if ((value = get(properties, "oracle.initial-backoff-ms")) != null) {
            config.setInitialBackoff(Duration.ofMillis(parseInt("oracle.initial-backoff-ms", value)));
        }
        if ((value = get(properties, "oracle.backoff-multiplier")) != null) {
            config.setBackoffMultiplier(parseDouble("oracle.backoff-multiplier", value));
        }
        if ((value = get(properties, "oracle.max-backoff-ms")) != null) {
            config.setMaxBackoff(Duration.ofMillis(parseInt("oracle.max-backoff-ms", value)));
        }
        if ((value = get(properties, "oracle.model")) != null) {
            config.setModel(value);
        }
        if ((value = get(properties, "detector.fallback-type")) != null) {
            config.setFallbackDiagramType(
                    value.equalsIgnoreCase("none") ? null : parseType(value));
        }
        if ((value = get(properties, "detector.min-confidence")) != null) {
            config.setDetectorMinConfidence(parseDouble("detector.min-confidence", value));
        }
        if ((value = get(properties, "prompt.use-grid")) != null) {
            config.setUseGrid(Boolean.parseBoolean(value));
        }
        if ((value = get(properties, "thread-pool-size")) != null) {
            config.setThreadPoolSize(parseInt("thread-pool-size", value));
        }
        return config;
    }

    /// Returns the traversal limits described by this configuration.
    public TraversalBudget toBudget() {
        return new TraversalBudget(maxIterations, maxCostUsd, maxDuration);
    }

    /// Returns the oracle retry policy described by this configuration.
    public RetryPolicy toRetryPolicy() {
        return new RetryPolicy(oracleMaxAttempts, initialBackoff, backoffMultiplier, maxBackoff);
    }

    /// Returns oracle settings for the configured model with provider defaults.
    public OracleConfig toOracleConfig() {
        return OracleConfig.forModel(model);
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public double getMaxCostUsd() {
        return maxCostUsd;
    }

    /// Sets the approximate cost cap; `0` disables it.
    public void setMaxCostUsd(double maxCostUsd) {
        this.maxCostUsd = maxCostUsd;
    }

    public Duration getMaxDuration() {
        return maxDuration;
    }

    public void setMaxDuration(Duration maxDuration) {
        this.maxDuration = maxDuration;
    }

    public FrontierOrder getFrontierOrder() {
        return frontierOrder;
    }

    /// Sets where newly found foci join the frontier: behind pending ones
    /// (breadth-first) or ahead of them (depth-first).
    public void setFrontierOrder(FrontierOrder frontierOrder) {
        this.frontierOrder = frontierOrder;
    }

    public int getAuditRounds() {
        return auditRounds;
    }

    /// Sets how many rounds of connection audit follow a completed exploration; `0`
    /// disables the audit.
    public void setAuditRounds(int auditRounds) {
        this.auditRounds = auditRounds;
    }

    public double getSpatialTolerance() {
        return spatialTolerance;
    }

    /// Sets the maximum centroid distance, in 0-1000 grid units, at which two mentions
    /// still denote the same node.
    public void setSpatialTolerance(double spatialTolerance) {
        this.spatialTolerance = spatialTolerance;
    }

    public int getOracleMaxAttempts() {
        return oracleMaxAttempts;
    }

    public void setOracleMaxAttempts(int oracleMaxAttempts) {
        this.oracleMaxAttempts = oracleMaxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
        this.initialBackoff = initialBackoff;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
    }

    /// Returns the type used when detection fails, or null when failures are surfaced.
    public DiagramType getFallbackDiagramType() {
        return fallbackDiagramType;
    }

    public void setFallbackDiagramType(DiagramType fallbackDiagramType) {
        this.fallbackDiagramType = fallbackDiagramType;
    }

    public double getDetectorMinConfidence() {
        return detectorMinConfidence;
    }

    public void setDetectorMinConfidence(double detectorMinConfidence) {
        this.detectorMinConfidence = detectorMinConfidence;
    }

    public boolean isUseGrid() {
        return useGrid;
    }

    public void setUseGrid(boolean useGrid) {
        this.useGrid = useGrid;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public void setThreadPoolSize(int threadPoolSize) {
        this.threadPoolSize = threadPoolSize;
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static String get(Properties properties, String key) {
        String value = properties.getProperty(PREFIX + key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + PREFIX + key + ": " + value, e);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + PREFIX + key + ": " + value, e);
        }
    }

    private static DiagramType parseType(String value) {
        DiagramType type = DiagramType.fromWireName(value);
        if (type == DiagramType.UNKNOWN) {
            throw new IllegalArgumentException("Unknown diagram type: " + value);
        }
        return type;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link GraphSightConfig}.
    ///
    /// @implNote Mutates a single config instance and returns it on {@link #build()}.
    public static class Builder {
        private final GraphSightConfig config = new GraphSightConfig();

        public Builder maxIterations(int maxIterations) {
            config.maxIterations = maxIterations;
            return this;
        }

        public Builder maxCostUsd(double maxCostUsd) {
            config.maxCostUsd = maxCostUsd;
            return this;
        }

        public Builder maxDuration(Duration maxDuration) {
            config.maxDuration = maxDuration;
            return this;
        }

        public Builder frontierOrder(FrontierOrder frontierOrder) {
            config.frontierOrder = frontierOrder;
            return this;
        }

        public Builder auditRounds(int auditRounds) {
            config.auditRounds = auditRounds;
            return this;
        }

        public Builder spatialTolerance(double spatialTolerance) {
            config.spatialTolerance = spatialTolerance;
            return this;
        }

        public Builder oracleMaxAttempts(int oracleMaxAttempts) {
            config.oracleMaxAttempts = oracleMaxAttempts;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            config.initialBackoff = initialBackoff;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            config.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            config.maxBackoff = maxBackoff;
            return this;
        }

        /// @param type type used when detection fails, null to surface failures
        public Builder fallbackDiagramType(DiagramType type) {
            config.fallbackDiagramType = type;
            return this;
        }

        public Builder detectorMinConfidence(double minConfidence) {
            config.detectorMinConfidence = minConfidence;
            return this;
        }

        public Builder useGrid(boolean useGrid) {
            config.useGrid = useGrid;
            return this;
        }

        public Builder model(String model) {
            config.model = model;
            return this;
        }

        public Builder threadPoolSize(int threadPoolSize) {
            config.threadPoolSize = threadPoolSize;
            return this;
        }

        public GraphSightConfig build() {
            return config;
        }
    }
}
