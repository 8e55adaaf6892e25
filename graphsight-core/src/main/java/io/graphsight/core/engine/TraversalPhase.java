package io.graphsight.core.engine;

/// Lifecycle of one traversal.
///
/// ```
/// INIT -> EXPLORING -> [AUDITING] -> DRAINING -> DONE
///              |             |
///              +-------------+-> FAILED (oracle unavailable; fragments so far are still synthesized)
/// ```
public enum TraversalPhase {
    /// Seeding the frontier from the initial focus.
    INIT,
    /// Popping and exploring foci.
    EXPLORING,
    /// Frontier exhausted; confirming the recorded connections of visited nodes.
    AUDITING,
    /// Exploration stopped; merging fragments into the result.
    DRAINING,
    /// Finished normally, possibly truncated by budget or cancellation.
    DONE,
    /// Stopped by an unrecoverable oracle failure.
    FAILED
}
