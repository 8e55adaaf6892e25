package io.graphsight.core.engine;

import io.graphsight.core.engine.TraversalState.FrontierEntry;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;
import java.util.Locale;

/// Order in which pending foci leave the frontier.
///
/// The frontier is always consumed from its head. The order decides where newly found
/// candidates go: behind everything pending (breadth-first) or ahead of it
/// (depth-first), keeping the oracle's own order among the candidates of one step.
public enum FrontierOrder {

    /// Explores level by level: all foci found by a step wait behind earlier ones.
    BREADTH_FIRST,

    /// Follows one branch to its end before returning to earlier foci.
    DEPTH_FIRST;

    /// Parses `bfs`, `dfs`, `breadth-first`, `depth-first` or the constant name.
    ///
    /// @param value order name, not null
    /// @return the order, never null
    /// @throws IllegalArgumentException if the name is not recognized
    public static FrontierOrder fromName(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return switch (normalized) {
            case "bfs", "breadth-first" -> BREADTH_FIRST;
            case "dfs", "depth-first" -> DEPTH_FIRST;
            default -> throw new IllegalArgumentException("Unknown frontier order: " + value);
        };
    }

    /// Adds entries to the frontier, in the order given, according to this order.
    void enqueue(Deque<FrontierEntry> frontier, List<FrontierEntry> entries) {
        if (this == BREADTH_FIRST) {
            entries.forEach(frontier::addLast);
            return;
        }
        ListIterator<FrontierEntry> reversed = entries.listIterator(entries.size());
        while (reversed.hasPrevious()) {
            frontier.addFirst(reversed.previous());
        }
    }
}
