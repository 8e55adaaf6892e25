package io.graphsight.core.history;

import io.graphsight.core.graph.Focus;
import io.graphsight.core.graph.NodeIdentity;
import io.graphsight.core.graph.NodeKey;
import java.util.Objects;

/// One entry of a traversal's history.
///
/// - {@link Visit} - a focus was explored through the oracle
/// - {@link Skip} - a focus was popped from the frontier but its identity had already
///   been visited, so no oracle call was made
/// - {@link Audit} - after exploration, the oracle confirmed or corrected one node's
///   connections
///
/// Entries hold structured data only. Output-format text is produced later by strategies.
public sealed interface HistoryEntry
        permits HistoryEntry.Visit, HistoryEntry.Skip, HistoryEntry.Audit {

    /// Position of the entry in the history, 1-based.
    int sequence();

    Focus focus();

    /// An explored focus.
    ///
    /// @param sequence position in history, 1-based
    /// @param step 1-based visit number (skips do not count)
    /// @param source resolved identity of the explored node, not null
    /// @param interpretation interpretation attached to `source`, not null
    /// @param fragment nodes and edges this visit contributed, not null
    record Visit(
            int sequence,
            int step,
            NodeIdentity source,
            StepInterpretation interpretation,
            ExtractedFragment fragment)
            implements HistoryEntry {

        public Visit {
            Objects.requireNonNull(source, "source must not be null");
            Objects.requireNonNull(interpretation, "interpretation must not be null");
            Objects.requireNonNull(fragment, "fragment must not be null");
        }

        @Override
        public Focus focus() {
            return interpretation.focus();
        }
    }

    /// Marker for a focus whose identity was already visited.
    ///
    /// @param sequence position in history, 1-based
    /// @param focus the skipped focus, not null
    /// @param key identity key the focus resolved to, not null
    record Skip(int sequence, Focus focus, NodeKey key) implements HistoryEntry {

        public Skip {
            Objects.requireNonNull(focus, "focus must not be null");
            Objects.requireNonNull(key, "key must not be null");
        }
    }

    /// A confirmation pass over one explored node.
    ///
    /// @param sequence position in history, 1-based
    /// @param round 1-based audit round
    /// @param focus the audited node as presented to the oracle, not null
    /// @param subject identity key of the audited node, not null
    /// @param verdict what the oracle confirmed, not null
    /// @param correction edges added or retracted as a result, not null (may be empty)
    record Audit(
            int sequence,
            int round,
            Focus focus,
            NodeKey subject,
            AuditVerdict verdict,
            ExtractedFragment correction)
            implements HistoryEntry {

        public Audit {
            Objects.requireNonNull(focus, "focus must not be null");
            Objects.requireNonNull(subject, "subject must not be null");
            Objects.requireNonNull(verdict, "verdict must not be null");
            Objects.requireNonNull(correction, "correction must not be null");
        }
    }
}
