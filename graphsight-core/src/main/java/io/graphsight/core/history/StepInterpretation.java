package io.graphsight.core.history;

import io.graphsight.core.graph.EdgeMention;
import io.graphsight.core.graph.Focus;
import io.graphsight.core.graph.NodeKey;
import io.graphsight.core.graph.NodeMention;
import java.util.List;
import java.util.Objects;

/// Structured result of interpreting one focus.
///
/// Produced by a {@link io.graphsight.core.strategy.Strategy} from the oracle's reply.
/// The strategy does not know which identity the focus resolved to; the engine attaches
/// it afterwards through {@link #withSource(NodeKey)}, which returns a copy. Instances
/// are never mutated after construction.
///
/// @param focus the focus that was explored, not null
/// @param source key of the explored node, null until the engine attaches it
/// @param nodes nodes mentioned in this step, never null
/// @param edges connections mentioned in this step, never null
/// @param reasoning oracle's reasoning trace, never null (may be empty)
/// @param nextFoci candidate foci for further exploration, never null
/// @param terminal `true` when the oracle reports the node has no outgoing flow
public record StepInterpretation(
        Focus focus,
        NodeKey source,
        List<NodeMention> nodes,
        List<EdgeMention> edges,
        String reasoning,
        List<Focus> nextFoci,
        boolean terminal) {

    public StepInterpretation {
        Objects.requireNonNull(focus, "focus must not be null");
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
        reasoning = reasoning != null ? reasoning : "";
        nextFoci = nextFoci != null ? List.copyOf(nextFoci) : List.of();
    }

    /// Creates the no-op interpretation recorded when the oracle's reply was unusable.
    ///
    /// @param focus the focus that was explored, not null
    /// @return an interpretation with no nodes, edges or candidates, never null
    public static StepInterpretation empty(Focus focus) {
        return new StepInterpretation(focus, null, List.of(), List.of(), "", List.of(), false);
    }

    /// Returns a copy attached to the resolved source identity.
    ///
    /// @param sourceKey key of the explored node, not null
    /// @return new interpretation, never null
    public StepInterpretation withSource(NodeKey sourceKey) {
        Objects.requireNonNull(sourceKey, "sourceKey must not be null");
        return new StepInterpretation(focus, sourceKey, nodes, edges, reasoning, nextFoci, terminal);
    }

    public boolean isEmpty() {
        return nodes.isEmpty() && edges.isEmpty() && nextFoci.isEmpty();
    }
}
