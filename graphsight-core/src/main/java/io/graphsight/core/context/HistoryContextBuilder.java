package io.graphsight.core.context;

import io.graphsight.core.graph.NodeKey;
import io.graphsight.core.graph.NodeNaming;
import io.graphsight.core.history.ExtractedFragment;
import io.graphsight.core.history.HistoryEntry;
import io.graphsight.core.history.HistoryRecord;
import io.graphsight.core.strategy.Strategy;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Builds the context payload for the next step request from the history.
///
/// A pure function of its inputs: the same history and requirements always produce an
/// equal payload, and building never changes the history.
///
/// ### Payload contents
/// - every visited node, in visit order, named over all nodes seen so far
/// - edges from the fragments of the last `historyWindow` visits, deduplicated
/// - reasoning of the same visits, when requested
/// - bounding boxes of visited nodes, when requested
///
/// @implNote Stateless and thread-safe.
public class HistoryContextBuilder {

    /// Builds the payload using the strategy's requirements.
    ///
    /// @param history traversal history, not null
    /// @param strategy strategy that will phrase the payload, not null
    /// @return the payload, never null
    public ContextPayload build(HistoryRecord history, Strategy strategy) {
        return build(history, strategy.contextRequirements());
    }

    /// Builds the payload.
    ///
    /// @param history traversal history, not null
    /// @param requirements what to include, not null
    /// @return the payload, never null
    public ContextPayload build(HistoryRecord history, ContextRequirements requirements) {
        if (history.isEmpty()) {
            return ContextPayload.empty();
        }

        List<HistoryEntry.Visit> visits = history.visits();
        NodeNaming naming = NodeNaming.of(keysOf(visits));

        List<ContextPayload.VisitedNode> visited = new ArrayList<>();
        for (HistoryEntry.Visit visit : visits) {
            NodeKey key = visit.source().key();
            visited.add(
                    new ContextPayload.VisitedNode(
                            naming.nameOf(key),
                            key.label(),
                            requirements.includeSpatialHints()
                                    ? visit.source().fingerprint().box()
                                    : null));
        }

        List<HistoryEntry.Visit> recent =
                visits.subList(Math.max(0, visits.size() - requirements.historyWindow()), visits.size());

        Set<ContextPayload.KnownEdge> edges = new LinkedHashSet<>();
        List<String> reasoning = new ArrayList<>();
        for (HistoryEntry.Visit visit : recent) {
            for (ExtractedFragment.FragmentEdge edge : visit.fragment().edges()) {
                edges.add(
                        new ContextPayload.KnownEdge(
                                naming.nameOf(edge.source()),
                                naming.nameOf(edge.target()),
                                edge.label()));
            }
            String trace = visit.interpretation().reasoning();
            if (requirements.includeReasoning() && !trace.isBlank()) {
                reasoning.add(naming.nameOf(visit.source().key()) + ": " + trace.trim());
            }
        }

        return new ContextPayload(
                visited,
                new ArrayList<>(edges),
                reasoning,
                visits.size(),
                history.size() - visits.size());
    }

    private static List<NodeKey> keysOf(List<HistoryEntry.Visit> visits) {
        List<NodeKey> keys = new ArrayList<>();
        for (HistoryEntry.Visit visit : visits) {
            keys.add(visit.source().key());
            for (ExtractedFragment.FragmentNode node : visit.fragment().nodes()) {
                keys.add(node.key());
            }
        }
        return keys;
    }
}
