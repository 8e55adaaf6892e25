package io.graphsight.core.detect;

import io.graphsight.core.graph.DiagramType;
import java.util.Objects;

/// Diagram-type verdict reported by the oracle.
///
/// @param type reported family, not null
/// @param confidence self-reported confidence in `[0, 1]`
/// @param reasoning short justification, never null
public record Classification(DiagramType type, double confidence, String reasoning) {

    public Classification {
        Objects.requireNonNull(type, "type must not be null");
        if (Double.isNaN(confidence)) {
            confidence = 0.0;
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        reasoning = reasoning != null ? reasoning : "";
    }
}
