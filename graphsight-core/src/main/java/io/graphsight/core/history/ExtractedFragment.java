package io.graphsight.core.history;

import io.graphsight.core.graph.NodeKey;
import java.util.List;
import java.util.Objects;

/// Node and edge data contributed by one visit or one audit correction.
///
/// Fragments are keyed by {@link NodeKey} only: they carry no fingerprints, oracle
/// references or traversal bookkeeping, so merging them never depends on how the nodes
/// were found. Visits only add; an audit correction may also retract edges that earlier
/// fragments contributed.
///
/// @param step 1-based visit number that produced the fragment; for a correction, the
///     number of visits made before it
/// @param nodes nodes in first-mention order, never null
/// @param edges edges in mention order, never null
/// @param retractedEdges earlier edges this fragment withdraws, never null
public record ExtractedFragment(
        int step, List<FragmentNode> nodes, List<FragmentEdge> edges, List<FragmentEdge> retractedEdges) {

    public ExtractedFragment {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
        retractedEdges = retractedEdges != null ? List.copyOf(retractedEdges) : List.of();
    }

    /// Creates a purely additive fragment.
    public ExtractedFragment(int step, List<FragmentNode> nodes, List<FragmentEdge> edges) {
        this(step, nodes, edges, List.of());
    }

    /// Returns `true` when the fragment neither adds nor retracts anything.
    public boolean isEmpty() {
        return nodes.isEmpty() && edges.isEmpty() && retractedEdges.isEmpty();
    }

    /// A node seen in one visit.
    ///
    /// @param key resolved identity key, not null
    /// @param shape shape hint, may be null
    public record FragmentNode(NodeKey key, String shape) {
        public FragmentNode {
            Objects.requireNonNull(key, "key must not be null");
        }
    }

    /// A directed edge seen in one visit.
    ///
    /// @param source source identity key, not null
    /// @param target target identity key, not null
    /// @param label edge text, never null
    public record FragmentEdge(NodeKey source, NodeKey target, String label) {
        public FragmentEdge {
            Objects.requireNonNull(source, "source must not be null");
            Objects.requireNonNull(target, "target must not be null");
            label = label != null ? label : "";
        }
    }
}
