package io.graphsight.core.synthesis;

import io.graphsight.core.graph.NodeKey;
import io.graphsight.core.graph.NodeNaming;
import io.graphsight.core.history.ExtractedFragment;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Deterministic merge of the fragments of one traversal.
///
/// Nodes are deduplicated by key and edges by (source, target, label); both keep the
/// order in which they were first discovered. Edge endpoints that never appeared as a
/// fragment node are added as nodes at the point the edge is merged. Edges retracted
/// by a fragment are dropped from what earlier fragments contributed; their endpoints
/// stay in the graph.
///
/// @param nodes merged nodes in discovery order, never null
/// @param edges merged edges in discovery order, never null
public record RawGraph(List<GraphNode> nodes, List<GraphEdge> edges) {

    public RawGraph {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }

    public static RawGraph empty() {
        return new RawGraph(List.of(), List.of());
    }

    /// Merges fragments in the order given.
    ///
    /// @param fragments fragments in discovery order, not null
    /// @return the merged graph, never null
    public static RawGraph merge(List<ExtractedFragment> fragments) {
        Map<NodeKey, String> shapes = new LinkedHashMap<>();
        Set<EdgeKey> edgeKeys = new LinkedHashSet<>();

        for (ExtractedFragment fragment : fragments) {
            for (ExtractedFragment.FragmentEdge retracted : fragment.retractedEdges()) {
                edgeKeys.remove(new EdgeKey(retracted.source(), retracted.target(), retracted.label()));
            }
            for (ExtractedFragment.FragmentNode node : fragment.nodes()) {
                addNode(shapes, node.key(), node.shape());
            }
            for (ExtractedFragment.FragmentEdge edge : fragment.edges()) {
                addNode(shapes, edge.source(), null);
                addNode(shapes, edge.target(), null);
                edgeKeys.add(new EdgeKey(edge.source(), edge.target(), edge.label()));
            }
        }

        NodeNaming naming = NodeNaming.of(shapes.keySet());
        List<GraphNode> nodes = new ArrayList<>();
        shapes.forEach((key, shape) -> nodes.add(new GraphNode(key, naming.nameOf(key), shape)));

        List<GraphEdge> edges = new ArrayList<>();
        for (EdgeKey edge : edgeKeys) {
            edges.add(
                    new GraphEdge(
                            edge.source(),
                            edge.target(),
                            naming.nameOf(edge.source()),
                            naming.nameOf(edge.target()),
                            edge.label()));
        }
        return new RawGraph(nodes, edges);
    }

    private static void addNode(Map<NodeKey, String> shapes, NodeKey key, String shape) {
        if (!shapes.containsKey(key)) {
            shapes.put(key, shape);
        } else if (shapes.get(key) == null && shape != null) {
            shapes.put(key, shape);
        }
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public List<String> nodeNames() {
        return nodes.stream().map(GraphNode::name).toList();
    }

    /// Looks up a node by display name.
    ///
    /// @param name display name, not null
    /// @return the node, or empty when no node carries that name
    public Optional<GraphNode> nodeNamed(String name) {
        for (GraphNode node : nodes) {
            if (node.name().equals(name)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    /// Returns the display name of a node, or its suffixed name when it is not in the graph.
    public String nameOf(NodeKey key) {
        for (GraphNode node : nodes) {
            if (node.key().equals(key)) {
                return node.name();
            }
        }
        return key.suffixedName();
    }

    /// A merged node.
    ///
    /// @param key identity key, not null
    /// @param name display name, unique within the graph, not null
    /// @param shape shape hint, may be null
    public record GraphNode(NodeKey key, String name, String shape) {
        public GraphNode {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(name, "name must not be null");
        }

        public String label() {
            return key.label();
        }
    }

    /// A merged edge.
    ///
    /// @param source source key, not null
    /// @param target target key, not null
    /// @param sourceName display name of the source, not null
    /// @param targetName display name of the target, not null
    /// @param label edge text, never null (empty when unlabeled)
    public record GraphEdge(
            NodeKey source, NodeKey target, String sourceName, String targetName, String label) {
        public GraphEdge {
            Objects.requireNonNull(source, "source must not be null");
            Objects.requireNonNull(target, "target must not be null");
            label = label != null ? label : "";
        }

        public boolean isLabeled() {
            return !label.isBlank();
        }
    }

    private record EdgeKey(NodeKey source, NodeKey target, String label) {}
}
