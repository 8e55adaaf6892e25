package io.graphsight.core.graph;

import java.util.Locale;
import java.util.Objects;

/// A node as mentioned by the oracle in one step, before identity resolution.
///
/// @param ref oracle-local reference used by edges of the same step, defaults to the label
/// @param label node text, not blank
/// @param shape shape hint such as `decision` or `terminal`, may be null
/// @param fingerprint spatial signature, never null
/// @param revisitOf display name of a known node the oracle says this is, may be null
public record NodeMention(
        String ref, String label, String shape, Fingerprint fingerprint, String revisitOf) {

    public NodeMention {
        Objects.requireNonNull(label, "label must not be null");
        if (label.isBlank()) {
            throw new IllegalArgumentException("label must not be blank");
        }
        label = label.trim();
        ref = ref == null || ref.isBlank() ? label : ref.trim();
        shape = shape == null || shape.isBlank() ? null : shape.trim().toLowerCase(Locale.ROOT);
        fingerprint = fingerprint != null ? fingerprint : Fingerprint.empty();
        revisitOf = revisitOf == null || revisitOf.isBlank() ? null : revisitOf.trim();
    }

    public static NodeMention of(String label) {
        return new NodeMention(label, label, null, Fingerprint.empty(), null);
    }

    public static NodeMention of(String label, BoundingBox box) {
        return new NodeMention(label, label, null, Fingerprint.of(box), null);
    }
}
