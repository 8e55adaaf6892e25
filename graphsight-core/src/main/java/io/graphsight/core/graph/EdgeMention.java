package io.graphsight.core.graph;

import java.util.Objects;

/// A directed connection as mentioned by the oracle in one step.
///
/// Endpoints are oracle-local references: a node ref from the same step, the current
/// focus ref, or the display name of a node from the context payload.
///
/// @param sourceRef reference of the source node, not null
/// @param targetRef reference of the target node, not null
/// @param label edge text such as `yes`, never null (empty when unlabeled)
public record EdgeMention(String sourceRef, String targetRef, String label) {

    public EdgeMention {
        Objects.requireNonNull(sourceRef, "sourceRef must not be null");
        Objects.requireNonNull(targetRef, "targetRef must not be null");
        sourceRef = sourceRef.trim();
        targetRef = targetRef.trim();
        label = label != null ? label.trim() : "";
    }

    public static EdgeMention of(String sourceRef, String targetRef) {
        return new EdgeMention(sourceRef, targetRef, "");
    }
}
