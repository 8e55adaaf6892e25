package io.graphsight.core.graph;

import java.util.Objects;

/// Region-of-interest descriptor produced by the oracle.
///
/// A focus names one node the oracle wants explored next: its oracle-local reference,
/// the text it reads inside the shape, a short description that helps the oracle find
/// it again, and the spatial fingerprint of the shape.
///
/// ### Contracts
/// - `ref` and `label` are never blank; `ref` defaults to the label
/// - `revisitOf` is set only when the oracle explicitly says the focus is a node it has
///   already seen, naming that node as it appeared in the context payload
///
/// @param ref oracle-local reference, not blank
/// @param label node text, not blank
/// @param description locating hint, never null (may be empty)
/// @param fingerprint spatial signature, never null
/// @param revisitOf display name of an already-known node, may be null
public record Focus(
        String ref, String label, String description, Fingerprint fingerprint, String revisitOf) {

    public Focus {
        Objects.requireNonNull(label, "label must not be null");
        if (label.isBlank()) {
            throw new IllegalArgumentException("label must not be blank");
        }
        label = label.trim();
        ref = ref == null || ref.isBlank() ? label : ref.trim();
        description = description != null ? description : "";
        fingerprint = fingerprint != null ? fingerprint : Fingerprint.empty();
        revisitOf = revisitOf == null || revisitOf.isBlank() ? null : revisitOf.trim();
    }

    public static Focus of(String label) {
        return new Focus(label, label, "", Fingerprint.empty(), null);
    }

    public static Focus of(String label, BoundingBox box) {
        return new Focus(label, label, "", Fingerprint.of(box), null);
    }

    /// Views this focus as a node mention for identity resolution.
    ///
    /// @return mention carrying the same reference, label, fingerprint and revisit flag
    public NodeMention asMention() {
        return new NodeMention(ref, label, null, fingerprint, revisitOf);
    }
}
