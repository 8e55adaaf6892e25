package io.graphsight.core.history;

import java.util.ArrayList;
import java.util.List;

/// The oracle's confirmation of one node's connections.
///
/// A `null` list means the oracle could not check that direction; an empty list means it
/// checked and found no connection.
///
/// @param confirmedIncoming names of the nodes linking into the subject, may be null
/// @param confirmedOutgoing names of the nodes the subject links to, may be null
/// @param notes what the oracle changed and why, never null
public record AuditVerdict(
        List<String> confirmedIncoming, List<String> confirmedOutgoing, String notes) {

    public AuditVerdict {
        confirmedIncoming = clean(confirmedIncoming);
        confirmedOutgoing = clean(confirmedOutgoing);
        notes = notes != null ? notes.trim() : "";
    }

    /// Returns a verdict that confirms nothing and rejects nothing.
    public static AuditVerdict undecided(String notes) {
        return new AuditVerdict(null, null, notes);
    }

    public boolean checkedIncoming() {
        return confirmedIncoming != null;
    }

    public boolean checkedOutgoing() {
        return confirmedOutgoing != null;
    }

    private static List<String> clean(List<String> names) {
        if (names == null) {
            return null;
        }
        List<String> present = new ArrayList<>(names.size());
        for (String name : names) {
            if (name != null && !name.isBlank() && !present.contains(name.trim())) {
                present.add(name.trim());
            }
        }
        return List.copyOf(present);
    }
}
