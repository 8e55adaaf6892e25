package io.graphsight.core;

import io.graphsight.core.engine.TraversalPhase;
import io.graphsight.core.graph.DiagramType;
import io.graphsight.core.graph.OutputFormat;
import io.graphsight.core.oracle.TokenUsage;
import io.graphsight.core.synthesis.RawGraph;
import io.graphsight.core.validation.DiagramStructure;
import java.util.Objects;

/// Final payload of one interpretation.
///
/// ### Flags
/// - `partial`: exploration stopped before the frontier was exhausted (cancellation,
///   budget, or oracle failure); `content` covers only what was gathered
/// - `degraded`: refinement failed and `content` is the raw mechanical rendering
///
/// @param diagramType diagram family interpreted, not null
/// @param outputFormat format of `content`, not null
/// @param content final content, never null
/// @param rawContent mechanical rendering before refinement, never null
/// @param graph merged graph, not null
/// @param callCount oracle calls that returned a reply, including detection
/// @param usage tokens consumed, not null
/// @param approximateCost approximate USD cost
/// @param partial see above
/// @param degraded see above
/// @param phase terminal traversal phase, `DONE` or `FAILED`
/// @param steps number of oracle-backed visits
/// @param modelName oracle model, not null
/// @param terminationReason why exploration stopped, not null
/// @param structure syntax-validation structure, null when not validated
public record InterpretationResult(
        DiagramType diagramType,
        OutputFormat outputFormat,
        String content,
        String rawContent,
        RawGraph graph,
        int callCount,
        TokenUsage usage,
        double approximateCost,
        boolean partial,
        boolean degraded,
        TraversalPhase phase,
        int steps,
        String modelName,
        String terminationReason,
        DiagramStructure structure) {

    public InterpretationResult {
        Objects.requireNonNull(diagramType, "diagramType must not be null");
        Objects.requireNonNull(outputFormat, "outputFormat must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(phase, "phase must not be null");
        content = content != null ? content : "";
        rawContent = rawContent != null ? rawContent : "";
        usage = usage != null ? usage : TokenUsage.zero();
        modelName = modelName != null ? modelName : "unknown";
        terminationReason = terminationReason != null ? terminationReason : "";
    }

    /// Returns a copy carrying the syntax-validation structure.
    public InterpretationResult withStructure(DiagramStructure structure) {
        return new InterpretationResult(
                diagramType,
                outputFormat,
                content,
                rawContent,
                graph,
                callCount,
                usage,
                approximateCost,
                partial,
                degraded,
                phase,
                steps,
                modelName,
                terminationReason,
                structure);
    }

    public boolean isComplete() {
        return !partial && phase == TraversalPhase.DONE;
    }
}
