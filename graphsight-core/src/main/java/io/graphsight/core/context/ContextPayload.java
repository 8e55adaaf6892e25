package io.graphsight.core.context;

import io.graphsight.core.graph.BoundingBox;
import java.util.List;
import java.util.Objects;

/// Format-agnostic summary of a traversal's history, handed to a strategy for one
/// step request.
///
/// The payload names nodes by display name only. It carries no output-format syntax:
/// strategies decide how to phrase it for the oracle.
///
/// @param visitedNodes explored nodes in visit order, never null
/// @param knownEdges edges found in the recent window, deduplicated, never null
/// @param recentReasoning reasoning of recent visits, oldest first, never null
/// @param visitCount number of visits in the history
/// @param skipCount number of skip markers in the history
public record ContextPayload(
        List<VisitedNode> visitedNodes,
        List<KnownEdge> knownEdges,
        List<String> recentReasoning,
        int visitCount,
        int skipCount) {

    private static final ContextPayload EMPTY = new ContextPayload(List.of(), List.of(), List.of(), 0, 0);

    public ContextPayload {
        visitedNodes = visitedNodes != null ? List.copyOf(visitedNodes) : List.of();
        knownEdges = knownEdges != null ? List.copyOf(knownEdges) : List.of();
        recentReasoning = recentReasoning != null ? List.copyOf(recentReasoning) : List.of();
    }

    public static ContextPayload empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return visitedNodes.isEmpty() && knownEdges.isEmpty();
    }

    public List<String> visitedNames() {
        return visitedNodes.stream().map(VisitedNode::name).toList();
    }

    /// An explored node.
    ///
    /// @param name display name, not null
    /// @param label node text, not null
    /// @param box location hint, null unless spatial hints were requested
    public record VisitedNode(String name, String label, BoundingBox box) {
        public VisitedNode {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(label, "label must not be null");
        }
    }

    /// An edge already known to the traversal.
    ///
    /// @param source display name of the source node, not null
    /// @param target display name of the target node, not null
    /// @param label edge text, never null
    public record KnownEdge(String source, String target, String label) {
        public KnownEdge {
            Objects.requireNonNull(source, "source must not be null");
            Objects.requireNonNull(target, "target must not be null");
            label = label != null ? label : "";
        }
    }
}
