package io.graphsight.core.synthesis;

import java.util.Objects;

/// Output of the synthesis phase.
///
/// @param graph merged graph, not null
/// @param rawContent mechanical rendering of `graph`, not null
/// @param content refined content, or `rawContent` when refinement was skipped or failed
/// @param refined `true` when `content` came from the oracle
/// @param degraded `true` when refinement was attempted and failed
public record SynthesisOutcome(
        RawGraph graph, String rawContent, String content, boolean refined, boolean degraded) {

    public SynthesisOutcome {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(rawContent, "rawContent must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    static SynthesisOutcome rawOnly(RawGraph graph, String rawContent) {
        return new SynthesisOutcome(graph, rawContent, rawContent, false, false);
    }
}
