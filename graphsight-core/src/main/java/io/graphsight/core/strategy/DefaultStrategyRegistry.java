package io.graphsight.core.strategy;

import io.graphsight.core.graph.DiagramType;
import io.graphsight.core.graph.OutputFormat;
import io.graphsight.core.oracle.OracleResponseParser;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Logger;

/// Map-based strategy registry keyed by diagram type.
///
/// Each registration is a factory from output format to strategy, so one registry
/// serves every format. {@link #withDefaults} registers the flowchart, sequence and
/// state strategies.
///
/// @implNote Registration is not thread-safe; register before sharing. Lookups are
/// safe once registration is complete.
public class DefaultStrategyRegistry implements StrategyRegistry {

    private static final Logger logger = Logger.getLogger(DefaultStrategyRegistry.class.getName());

    private final Map<DiagramType, Function<OutputFormat, Strategy>> factories =
            new EnumMap<>(DiagramType.class);

    /// Creates a registry with the built-in strategies.
    ///
    /// @param parser parser for oracle replies, not null
    /// @param useGrid whether prompts ask the oracle for grid-cell references
    /// @return populated registry, never null
    public static DefaultStrategyRegistry withDefaults(OracleResponseParser parser, boolean useGrid) {
        Objects.requireNonNull(parser, "parser must not be null");
        DefaultStrategyRegistry registry = new DefaultStrategyRegistry();
        registry.register(DiagramType.FLOWCHART, format -> new FlowchartStrategy(parser, format, useGrid));
        registry.register(DiagramType.SEQUENCE, format -> new SequenceDiagramStrategy(parser, format, useGrid));
        registry.register(DiagramType.STATE, format -> new StateDiagramStrategy(parser, format, useGrid));
        return registry;
    }

    /// Registers or replaces the strategy factory for a type.
    ///
    /// @param type diagram type, not null
    /// @param factory creates the strategy for a format, not null
    public void register(DiagramType type, Function<OutputFormat, Strategy> factory) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
        Function<OutputFormat, Strategy> previous = factories.put(type, factory);
        if (previous != null) {
            logger.fine("Replaced strategy for " + type);
        }
    }

    @Override
    public Optional<Strategy> find(DiagramType type, OutputFormat format) {
        Function<OutputFormat, Strategy> factory = factories.get(type);
        return factory != null ? Optional.of(factory.apply(format)) : Optional.empty();
    }

    @Override
    public Set<DiagramType> supportedTypes() {
        return Collections.unmodifiableSet(factories.keySet());
    }
}
