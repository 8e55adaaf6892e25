package io.graphsight.core.graph;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Display names for a set of node keys.
///
/// A key is named by its bare label when it is the only key in scope carrying that
/// label; otherwise every key sharing the label gets its ordinal suffix
/// (`Error_1`, `Error_2`). Naming is computed over a scope, so the same key can be
/// called `Error` early in a traversal and `Error_1` once a second "Error" appears.
///
/// Names are unique within a scope. When a suffixed name coincides with another
/// key's name (keys `(Error, 1)` and `(Error_1, 1)` both prefer `Error_1`), the key
/// earliest in scope keeps it and later ones get a further `_2`, `_3` suffix that no
/// other key in scope prefers.
///
/// @implNote Immutable and thread-safe once built.
public final class NodeNaming {

    private final Map<NodeKey, String> names;

    private NodeNaming(Map<NodeKey, String> names) {
        this.names = names;
    }

    /// Computes names for the given keys.
    ///
    /// @param keys keys in scope, not null, duplicates ignored
    /// @return naming over exactly these keys, never null
    public static NodeNaming of(Collection<NodeKey> keys) {
        Map<String, Integer> labelCounts = new HashMap<>();
        Map<NodeKey, Boolean> seen = new LinkedHashMap<>();
        for (NodeKey key : keys) {
            if (seen.putIfAbsent(key, Boolean.TRUE) == null) {
                labelCounts.merge(key.label(), 1, Integer::sum);
            }
        }

        Map<NodeKey, String> preferred = new LinkedHashMap<>();
        for (NodeKey key : seen.keySet()) {
            boolean shared = labelCounts.get(key.label()) > 1;
            preferred.put(key, shared ? key.suffixedName() : key.label());
        }

        Set<String> reserved = new HashSet<>(preferred.values());
        Set<String> assigned = new HashSet<>();
        Map<NodeKey, String> names = new LinkedHashMap<>();
        for (Map.Entry<NodeKey, String> entry : preferred.entrySet()) {
            String name = entry.getValue();
            if (!assigned.add(name)) {
                name = nextFreeName(name, reserved, assigned);
                assigned.add(name);
            }
            names.put(entry.getKey(), name);
        }
        return new NodeNaming(Map.copyOf(names));
    }

    /// Returns the display name of a key, falling back to the suffixed form for keys
    /// outside this naming's scope.
    ///
    /// @param key the key, not null
    /// @return display name, never null
    public String nameOf(NodeKey key) {
        String name = names.get(key);
        return name != null ? name : key.suffixedName();
    }

    /// Looks up a key by display name, then by suffixed name.
    ///
    /// @param name display name as it appeared in a context payload, not null
    /// @return the key, or empty when no key in scope carries that name
    public Optional<NodeKey> keyOf(String name) {
        for (Map.Entry<NodeKey, String> entry : names.entrySet()) {
            if (entry.getValue().equals(name)) {
                return Optional.of(entry.getKey());
            }
        }
        for (NodeKey key : names.keySet()) {
            if (key.suffixedName().equals(name)) {
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }

    public int size() {
        return names.size();
    }

    private static String nextFreeName(String base, Set<String> reserved, Set<String> assigned) {
        int suffix = 2;
        String candidate = base + "_" + suffix;
        while (reserved.contains(candidate) || assigned.contains(candidate)) {
            suffix++;
            candidate = base + "_" + suffix;
        }
        return candidate;
    }
}
