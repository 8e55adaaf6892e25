package io.graphsight.core.history;

import io.graphsight.core.graph.Focus;
import io.graphsight.core.graph.NodeIdentity;
import io.graphsight.core.graph.NodeKey;
import java.util.ArrayList;
import java.util.List;

/// Ordered, append-only record of one traversal.
///
/// Each append returns a new record; existing records never change, so a context
/// payload built from a record stays valid for as long as it is held. Entries appear in
/// discovery order and are never reordered.
///
/// @implNote Immutable and thread-safe. Appending copies the entry list, which is
/// acceptable for traversals bounded by an iteration budget.
public final class HistoryRecord {

    private static final HistoryRecord EMPTY = new HistoryRecord(List.of());

    private final List<HistoryEntry> entries;

    private HistoryRecord(List<HistoryEntry> entries) {
        this.entries = entries;
    }

    public static HistoryRecord empty() {
        return EMPTY;
    }

    /// Appends a visit.
    ///
    /// @param source resolved identity of the explored node, not null
    /// @param interpretation interpretation already attached to `source`, not null
    /// @param fragment contribution of this visit, not null
    /// @return new record with the visit appended, never null
    public HistoryRecord appendVisit(
            NodeIdentity source, StepInterpretation interpretation, ExtractedFragment fragment) {
        return append(
                new HistoryEntry.Visit(
                        entries.size() + 1, visitCount() + 1, source, interpretation, fragment));
    }

    /// Appends a skip marker.
    ///
    /// @param focus the skipped focus, not null
    /// @param key identity the focus resolved to, not null
    /// @return new record with the marker appended, never null
    public HistoryRecord appendSkip(Focus focus, NodeKey key) {
        return append(new HistoryEntry.Skip(entries.size() + 1, focus, key));
    }

    /// Appends the outcome of auditing one node.
    ///
    /// @param round 1-based audit round
    /// @param focus the audited node as presented to the oracle, not null
    /// @param subject identity key of the audited node, not null
    /// @param verdict what the oracle confirmed, not null
    /// @param correction resulting additions and retractions, not null
    /// @return new record with the audit appended, never null
    public HistoryRecord appendAudit(
            int round, Focus focus, NodeKey subject, AuditVerdict verdict, ExtractedFragment correction) {
        return append(new HistoryEntry.Audit(entries.size() + 1, round, focus, subject, verdict, correction));
    }

    private HistoryRecord append(HistoryEntry entry) {
        List<HistoryEntry> next = new ArrayList<>(entries.size() + 1);
        next.addAll(entries);
        next.add(entry);
        return new HistoryRecord(List.copyOf(next));
    }

    /// Returns all entries in discovery order.
    public List<HistoryEntry> entries() {
        return entries;
    }

    public List<HistoryEntry.Visit> visits() {
        List<HistoryEntry.Visit> visits = new ArrayList<>();
        for (HistoryEntry entry : entries) {
            if (entry instanceof HistoryEntry.Visit visit) {
                visits.add(visit);
            }
        }
        return visits;
    }

    public List<HistoryEntry.Skip> skips() {
        List<HistoryEntry.Skip> skips = new ArrayList<>();
        for (HistoryEntry entry : entries) {
            if (entry instanceof HistoryEntry.Skip skip) {
                skips.add(skip);
            }
        }
        return skips;
    }

    public List<HistoryEntry.Audit> audits() {
        List<HistoryEntry.Audit> audits = new ArrayList<>();
        for (HistoryEntry entry : entries) {
            if (entry instanceof HistoryEntry.Audit audit) {
                audits.add(audit);
            }
        }
        return audits;
    }

    /// Returns the fragments of all visits and audit corrections in history order.
    public List<ExtractedFragment> fragments() {
        List<ExtractedFragment> fragments = new ArrayList<>();
        for (HistoryEntry entry : entries) {
            if (entry instanceof HistoryEntry.Visit visit) {
                fragments.add(visit.fragment());
            } else if (entry instanceof HistoryEntry.Audit audit && !audit.correction().isEmpty()) {
                fragments.add(audit.correction());
            }
        }
        return fragments;
    }

    public int visitCount() {
        int count = 0;
        for (HistoryEntry entry : entries) {
            if (entry instanceof HistoryEntry.Visit) {
                count++;
            }
        }
        return count;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
