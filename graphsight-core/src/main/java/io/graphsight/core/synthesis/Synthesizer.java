package io.graphsight.core.synthesis;

import io.graphsight.core.graph.NodeKey;
import io.graphsight.core.graph.NodeNaming;
import io.graphsight.core.history.ExtractedFragment;
import io.graphsight.core.history.HistoryEntry;
import io.graphsight.core.history.HistoryRecord;
import io.graphsight.core.oracle.OracleGateway;
import io.graphsight.core.oracle.OracleUnavailableException;
import io.graphsight.core.strategy.Strategy;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/// Merges traversal fragments into the final artifact.
///
/// ### Phases
/// 1. **Merge**: fragments become a {@link RawGraph} and the strategy renders it. This
///    phase never calls the oracle and always succeeds.
/// 2. **Refine**: the raw content and the investigation log go to the oracle for one
///    coherent rewrite. Any failure here, an unreachable oracle or a reply that stays
///    malformed, falls back to the raw content and marks the outcome degraded.
///
/// @implNote Stateless and thread-safe.
public class Synthesizer {

    private static final Logger logger = Logger.getLogger(Synthesizer.class.getName());

    /// Runs the merge phase only.
    ///
    /// @param history traversal history, not null
    /// @param strategy renderer, not null
    /// @return outcome with `content` equal to `rawContent`, never null
    public SynthesisOutcome merge(HistoryRecord history, Strategy strategy) {
        RawGraph graph = RawGraph.merge(history.fragments());
        String raw = strategy.renderRaw(graph);
        logger.fine(
                "Merged "
                        + history.fragments().size()
                        + " fragments into "
                        + graph.nodes().size()
                        + " nodes and "
                        + graph.edges().size()
                        + " edges");
        return SynthesisOutcome.rawOnly(graph, raw);
    }

    /// Runs both phases.
    ///
    /// @param history traversal history, not null
    /// @param strategy renderer and refinement protocol, not null
    /// @param oracle gateway of the current run, not null
    /// @return outcome, never null
    public SynthesisOutcome synthesize(HistoryRecord history, Strategy strategy, OracleGateway oracle) {
        SynthesisOutcome merged = merge(history, strategy);
        if (merged.graph().isEmpty()) {
            logger.info("Nothing to refine, graph is empty");
            return merged;
        }
        try {
            String refined = refine(merged.rawContent(), history, strategy, oracle);
            return new SynthesisOutcome(merged.graph(), merged.rawContent(), refined, true, false);
        } catch (SynthesisFailure e) {
            logger.warning("Refinement failed, using raw content: " + e.getMessage());
            return new SynthesisOutcome(
                    merged.graph(), merged.rawContent(), merged.rawContent(), false, true);
        }
    }

    private String refine(
            String rawContent, HistoryRecord history, Strategy strategy, OracleGateway oracle)
            throws SynthesisFailure {
        String trace = investigationLog(history);
        Optional<String> refined;
        try {
            refined = oracle.ask(strategy.refinementRequest(rawContent, trace), strategy::extractRefined);
        } catch (OracleUnavailableException e) {
            throw new SynthesisFailure("Oracle unavailable during refinement", e);
        }
        return refined.orElseThrow(() -> new SynthesisFailure("Refinement reply stayed malformed"));
    }

    /// Writes the history as a plain-text investigation log.
    ///
    /// @param history traversal history, not null
    /// @return one line per history entry, never null
    public String investigationLog(HistoryRecord history) {
        List<NodeKey> keys = new ArrayList<>();
        for (HistoryEntry.Visit visit : history.visits()) {
            keys.add(visit.source().key());
            visit.fragment().nodes().forEach(node -> keys.add(node.key()));
        }
        for (HistoryEntry.Audit audit : history.audits()) {
            keys.add(audit.subject());
            audit.correction().nodes().forEach(node -> keys.add(node.key()));
            audit.correction().edges().forEach(edge -> {
                keys.add(edge.source());
                keys.add(edge.target());
            });
        }
        NodeNaming naming = NodeNaming.of(keys);

        StringBuilder log = new StringBuilder();
        for (HistoryEntry entry : history.entries()) {
            if (entry instanceof HistoryEntry.Visit visit) {
                log.append("Step ")
                        .append(visit.step())
                        .append(" examined ")
                        .append(naming.nameOf(visit.source().key()))
                        .append(": ");
                String reasoning = visit.interpretation().reasoning().trim();
                log.append(reasoning.isEmpty() ? "(no observations)" : reasoning);
                List<String> found = describe(visit.fragment().edges(), naming);
                if (!found.isEmpty()) {
                    log.append(" Found: ").append(String.join("; ", found)).append('.');
                }
            } else if (entry instanceof HistoryEntry.Skip skip) {
                log.append("Skipped ")
                        .append(skip.focus().label())
                        .append(", already examined as ")
                        .append(naming.nameOf(skip.key()))
                        .append('.');
            } else if (entry instanceof HistoryEntry.Audit audit) {
                log.append("Audit ")
                        .append(audit.round())
                        .append(" of ")
                        .append(naming.nameOf(audit.subject()))
                        .append(": ");
                String notes = audit.verdict().notes();
                log.append(notes.isEmpty() ? "(no notes)" : notes);
                List<String> added = describe(audit.correction().edges(), naming);
                List<String> retracted = describe(audit.correction().retractedEdges(), naming);
                if (added.isEmpty() && retracted.isEmpty()) {
                    log.append(" Confirmed as recorded.");
                }
                if (!added.isEmpty()) {
                    log.append(" Added: ").append(String.join("; ", added)).append('.');
                }
                if (!retracted.isEmpty()) {
                    log.append(" Retracted: ").append(String.join("; ", retracted)).append('.');
                }
            }
            log.append('\n');
        }
        return log.toString().trim();
    }

    private static List<String> describe(List<ExtractedFragment.FragmentEdge> edges, NodeNaming naming) {
        List<String> described = new ArrayList<>();
        for (ExtractedFragment.FragmentEdge edge : edges) {
            String connection = naming.nameOf(edge.source()) + " -> " + naming.nameOf(edge.target());
            described.add(edge.label().isBlank() ? connection : connection + " (" + edge.label() + ")");
        }
        return described;
    }
}
