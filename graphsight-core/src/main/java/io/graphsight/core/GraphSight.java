package io.graphsight.core;

import io.graphsight.core.detect.DetectorFailure;
import io.graphsight.core.detect.DiagramTypeDetector;
import io.graphsight.core.engine.CancellationToken;
import io.graphsight.core.engine.GraphInterpreterEngine;
import io.graphsight.core.engine.InterpretationException;
import io.graphsight.core.graph.DiagramImage;
import io.graphsight.core.graph.DiagramType;
import io.graphsight.core.graph.OutputFormat;
import io.graphsight.core.oracle.OracleGateway;
import io.graphsight.core.oracle.VisionOracle;
import io.graphsight.core.strategy.Strategy;
import io.graphsight.core.strategy.StrategyRegistry;
import io.graphsight.core.validation.DiagramStructure;
import io.graphsight.core.validation.SyntaxValidationException;
import io.graphsight.core.validation.SyntaxValidator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.logging.Logger;

/// Entry point for interpreting diagram images.
///
/// Each interpretation classifies the diagram, selects the matching strategy, runs a
/// traversal through the {@link GraphInterpreterEngine}, and optionally checks Mermaid
/// output with a {@link SyntaxValidator}.
///
/// ### Contracts
/// - **Precondition**: collaborators are non-null, except the validator which is optional
/// - **Postcondition**: every run meters its own oracle calls; results never share counters
///
/// @implNote Thread-safe. Per-run state lives in the engine's traversal state and in a
/// gateway created for each run. {@link #close()} shuts down the pool used by
/// {@link #interpretAll} when this facade owns it; a pool supplied by the caller is
/// left running.
///
/// @apiNote Create instances via {@link GraphSightFactory.Builder}.
public final class GraphSight implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(GraphSight.class.getName());

    private final GraphSightConfig config;
    private final VisionOracle oracle;
    private final DiagramTypeDetector detector;
    private final StrategyRegistry strategies;
    private final GraphInterpreterEngine engine;
    private final SyntaxValidator syntaxValidator;
    private final ExecutorService executorService;
    private final boolean ownsExecutor;

    /// Creates a facade over wired collaborators.
    ///
    /// @param config configuration, not null
    /// @param oracle shared vision oracle, not null
    /// @param detector diagram type detector, not null
    /// @param strategies strategy registry, not null
    /// @param engine traversal engine, not null
    /// @param syntaxValidator Mermaid validator, may be null to skip validation
    /// @param executorService pool for batch interpretation, not null
    /// @param ownsExecutor whether {@link #close()} shuts the pool down
    public GraphSight(
            GraphSightConfig config,
            VisionOracle oracle,
            DiagramTypeDetector detector,
            StrategyRegistry strategies,
            GraphInterpreterEngine engine,
            SyntaxValidator syntaxValidator,
            ExecutorService executorService,
            boolean ownsExecutor) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.strategies = Objects.requireNonNull(strategies, "strategies must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.syntaxValidator = syntaxValidator;
        this.executorService =
                Objects.requireNonNull(executorService, "executorService must not be null");
        this.ownsExecutor = ownsExecutor;
    }

    /// Interprets a diagram without a cancellation signal.
    ///
    /// @see #interpret(DiagramImage, OutputFormat, CancellationToken)
    public InterpretationResult interpret(DiagramImage image, OutputFormat format)
            throws InterpretationException {
        return interpret(image, format, CancellationToken.create());
    }

    /// Reads an image file and interprets it.
    ///
    /// @param path image file, not null
    /// @param format requested output format, not null
    /// @return the result, never null
    /// @throws InterpretationException if the file cannot be read or the run cannot start
    public InterpretationResult interpret(Path path, OutputFormat format)
            throws InterpretationException {
        DiagramImage image;
        try {
            image = DiagramImage.load(path);
        } catch (IOException e) {
            throw new InterpretationException("Cannot read image " + path + ": " + e.getMessage(), e);
        }
        return interpret(image, format);
    }

    /// Interprets a diagram.
    ///
    /// @param image the diagram, may be null (rejected with an exception)
    /// @param format requested output format, not null
    /// @param cancellation cancellation signal, not null
    /// @return the result, possibly partial, never null
    /// @throws InterpretationException if no image was given, the token was cancelled
    ///     before the run started, the diagram type is unsupported, or the oracle failed
    ///     before exploration began
    public InterpretationResult interpret(
            DiagramImage image, OutputFormat format, CancellationToken cancellation)
            throws InterpretationException {
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");
        if (image == null) {
            throw new InterpretationException("No image supplied");
        }

        if (cancellation.isCancelled()) {
            throw new InterpretationException("Interpretation of " + image.name() + " was cancelled");
        }

        OracleGateway gateway = new OracleGateway(oracle, config.toRetryPolicy());
        DiagramType type = detect(image, gateway);
        Strategy strategy = strategyFor(type, format);

        InterpretationResult result = engine.run(image, strategy, gateway, cancellation);
        logger.info(
                "Interpreted "
                        + image.name()
                        + " as "
                        + type.wireName()
                        + ": "
                        + result.graph().nodes().size()
                        + " nodes, "
                        + result.graph().edges().size()
                        + " edges, "
                        + result.callCount()
                        + " oracle calls"
                        + (result.partial() ? " (partial)" : ""));
        return validate(result);
    }

    /// Interprets several diagrams concurrently on the configured thread pool.
    ///
    /// Traversals are independent; a failure of one completes only its own future
    /// exceptionally, with the {@link InterpretationException} as cause.
    ///
    /// @param images diagrams to interpret, not null
    /// @param format requested output format, not null
    /// @return one future per image in input order, never null
    public List<CompletableFuture<InterpretationResult>> interpretAll(
            List<DiagramImage> images, OutputFormat format) {
        Objects.requireNonNull(images, "images must not be null");
        Objects.requireNonNull(format, "format must not be null");
        List<CompletableFuture<InterpretationResult>> futures = new ArrayList<>(images.size());
        for (DiagramImage image : images) {
            futures.add(
                    CompletableFuture.supplyAsync(
                            () -> {
                                try {
                                    return interpret(image, format);
                                } catch (InterpretationException e) {
                                    throw new CompletionException(e);
                                }
                            },
                            executorService));
        }
        return futures;
    }

    public GraphSightConfig getConfig() {
        return config;
    }

    public VisionOracle getOracle() {
        return oracle;
    }

    public GraphInterpreterEngine getEngine() {
        return engine;
    }

    public StrategyRegistry getStrategies() {
        return strategies;
    }

    /// Shuts down the batch thread pool if this facade created it.
    ///
    /// @apiNote **Side effects**: for an owned pool, running batch interpretations
    /// continue and new batches are rejected. A caller-supplied pool is untouched.
    @Override
    public void close() {
        if (ownsExecutor) {
            executorService.shutdown();
        }
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private DiagramType detect(DiagramImage image, OracleGateway gateway)
            throws InterpretationException {
        try {
            return detector.classify(image, gateway);
        } catch (DetectorFailure e) {
            DiagramType fallback = config.getFallbackDiagramType();
            if (fallback == null) {
                throw new InterpretationException(
                        "Cannot determine diagram type of " + image.name() + ": " + e.getMessage(), e);
            }
            logger.warning(
                    "Diagram type detection failed for "
                            + image.name()
                            + " ("
                            + e.getMessage()
                            + "), falling back to "
                            + fallback.wireName());
            return fallback;
        }
    }

    private Strategy strategyFor(DiagramType type, OutputFormat format)
            throws InterpretationException {
        Optional<Strategy> strategy = strategies.find(type, format);
        if (strategy.isPresent()) {
            return strategy.get();
        }
        DiagramType fallback = config.getFallbackDiagramType();
        if (fallback != null && fallback != type) {
            Optional<Strategy> fallbackStrategy = strategies.find(fallback, format);
            if (fallbackStrategy.isPresent()) {
                logger.warning(
                        "No strategy for "
                                + type.wireName()
                                + ", interpreting as "
                                + fallback.wireName());
                return fallbackStrategy.get();
            }
        }
        throw new InterpretationException(
                "No strategy for diagram type " + type.wireName() + " with format " + format);
    }

    private InterpretationResult validate(InterpretationResult result) {
        if (result.outputFormat() != OutputFormat.MERMAID
                || syntaxValidator == null
                || result.content().isBlank()) {
            return result;
        }
        if (!syntaxValidator.isAvailable()) {
            logger.fine("Syntax validator not available, skipping validation");
            return result;
        }
        try {
            DiagramStructure structure = syntaxValidator.validate(result.content());
            return result.withStructure(structure);
        } catch (SyntaxValidationException e) {
            logger.warning("Generated Mermaid failed validation: " + e.getMessage());
            return result;
        }
    }
}
