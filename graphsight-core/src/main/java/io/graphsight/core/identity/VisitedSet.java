package io.graphsight.core.identity;

import io.graphsight.core.graph.NodeIdentity;
import io.graphsight.core.graph.NodeKey;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/// Identities already explored in one traversal.
///
/// The set only grows: there is no removal operation, so a node once visited is never
/// explored again within the same run.
///
/// @implNote **Not thread-safe**. Owned by one traversal.
public final class VisitedSet {

    private final Set<NodeKey> keys = new LinkedHashSet<>();

    /// Marks an identity visited.
    ///
    /// @param identity the identity, not null
    /// @return `true` if it was not visited before
    public boolean add(NodeIdentity identity) {
        return keys.add(identity.key());
    }

    public boolean contains(NodeIdentity identity) {
        return keys.contains(identity.key());
    }

    public boolean contains(NodeKey key) {
        return keys.contains(key);
    }

    public int size() {
        return keys.size();
    }

    /// Returns the visited keys in visit order.
    public Set<NodeKey> keys() {
        return Collections.unmodifiableSet(keys);
    }
}
