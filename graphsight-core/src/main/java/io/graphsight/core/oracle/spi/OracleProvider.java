package io.graphsight.core.oracle.spi;

import io.graphsight.core.oracle.OracleConfig;
import io.graphsight.core.oracle.VisionOracle;
import java.util.Map;

/// Provider interface for pluggable vision oracles.
///
/// Implement this interface to back the traversal with a new model family. Providers
/// are passed explicitly to {@link io.graphsight.core.GraphSightFactory.Builder} or
/// discovered through `META-INF/services`.
///
/// ### Priority System
/// When several providers support a model, the one with the highest
/// {@link #getPriority()} wins. The stub provider uses 1000 when enabled so it can
/// intercept every model in tests.
///
/// @implNote Implementations should be stateless and thread-safe.
///
/// @see io.graphsight.core.oracle.OracleFactory for provider selection
public interface OracleProvider {

    /// @return provider name for logging, never null
    String getName();

    /// Checks if this provider can build an oracle for the model.
    ///
    /// @param modelName model identifier such as `gpt-4o`, may be null
    /// @return `true` if {@link #createOracle} would succeed for this model
    boolean supportsModel(String modelName);

    /// Builds an oracle.
    ///
    /// @param config model settings, not null
    /// @param credentials API keys and flags, not null
    /// @return configured oracle, never null
    /// @throws IllegalStateException if required credentials are missing
    VisionOracle createOracle(OracleConfig config, Map<String, String> credentials);

    /// @return selection priority, higher is preferred (default 0)
    default int getPriority() {
        return 0;
    }
}
