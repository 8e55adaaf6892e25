package io.graphsight.core.graph;

import java.util.Objects;

/// Spatial-free handle of a resolved node identity.
///
/// Two keys are equal only when they refer to the same identity. The ordinal is the
/// 1-based position of the identity among all identities minted with the same label
/// during one traversal, so the second "Error" box becomes `(Error, 2)`.
///
/// @param label node text, not blank
/// @param ordinal 1-based ordinal among identities sharing the label
/// @see NodeNaming for display names
public record NodeKey(String label, int ordinal) implements Comparable<NodeKey> {

    public NodeKey {
        Objects.requireNonNull(label, "label must not be null");
        if (ordinal < 1) {
            throw new IllegalArgumentException("ordinal must be >= 1, got " + ordinal);
        }
    }

    public static NodeKey of(String label) {
        return new NodeKey(label, 1);
    }

    /// Name with the ordinal suffix, used when a label is shared.
    public String suffixedName() {
        return label + "_" + ordinal;
    }

    @Override
    public int compareTo(NodeKey other) {
        int byLabel = label.compareTo(other.label);
        return byLabel != 0 ? byLabel : Integer.compare(ordinal, other.ordinal);
    }

    @Override
    public String toString() {
        return suffixedName();
    }
}
