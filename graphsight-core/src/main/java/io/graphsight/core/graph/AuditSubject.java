package io.graphsight.core.graph;

import java.util.List;
import java.util.Objects;

/// A node whose recorded connections are put to the oracle for confirmation.
///
/// @param focus the node's label and location, with its display name as reference, not null
/// @param name display name of the node in the current graph, not null
/// @param claimedIncoming display names of the nodes currently linked into this one, never null
/// @param claimedOutgoing display names of the nodes this one currently links to, never null
public record AuditSubject(
        Focus focus, String name, List<String> claimedIncoming, List<String> claimedOutgoing) {

    public AuditSubject {
        Objects.requireNonNull(focus, "focus must not be null");
        Objects.requireNonNull(name, "name must not be null");
        claimedIncoming = claimedIncoming != null ? List.copyOf(claimedIncoming) : List.of();
        claimedOutgoing = claimedOutgoing != null ? List.copyOf(claimedOutgoing) : List.of();
    }
}
