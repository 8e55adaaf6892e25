package io.graphsight.core.strategy;

import io.graphsight.core.graph.DiagramType;
import io.graphsight.core.graph.OutputFormat;
import java.util.Optional;
import java.util.Set;

/// Selects a strategy for a diagram type and output format.
///
/// @see DefaultStrategyRegistry
public interface StrategyRegistry {

    /// Looks up a strategy.
    ///
    /// @param type detected diagram type, not null
    /// @param format requested output format, not null
    /// @return the strategy, or empty when the type is not supported
    Optional<Strategy> find(DiagramType type, OutputFormat format);

    /// Returns the diagram types with a registered strategy.
    Set<DiagramType> supportedTypes();
}
