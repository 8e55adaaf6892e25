package io.graphsight.core.graph;

import java.util.Objects;

/// Stable identifier for one real-world node in the diagram.
///
/// @param key spatial-free handle, not null
/// @param fingerprint spatial signature this identity was minted or enriched with, not null
public record NodeIdentity(NodeKey key, Fingerprint fingerprint) {

    public NodeIdentity {
        Objects.requireNonNull(key, "key must not be null");
        fingerprint = fingerprint != null ? fingerprint : Fingerprint.empty();
    }

    public String label() {
        return key.label();
    }
}
