package io.graphsight.core.engine;

import io.graphsight.core.graph.Focus;
import io.graphsight.core.graph.NodeKey;
import java.time.Instant;

/// Events emitted during a traversal for observability.
///
/// ```
/// PhaseChanged(EXPLORING) -> FocusVisited | FocusSkipped ...
///     -> [PhaseChanged(AUDITING) -> NodeAudited ...] -> PhaseChanged(DRAINING)
///     -> PhaseChanged(DONE | FAILED)
/// ```
///
/// @see TraversalObserver
public sealed interface TraversalEvent {

    Instant timestamp();

    /// Emitted when the traversal enters a new phase.
    ///
    /// @param phase the phase entered
    /// @param timestamp when it happened
    record PhaseChanged(TraversalPhase phase, Instant timestamp) implements TraversalEvent {
        public static PhaseChanged now(TraversalPhase phase) {
            return new PhaseChanged(phase, Instant.now());
        }
    }

    /// Emitted after a focus was explored through the oracle.
    ///
    /// @param step 1-based visit number
    /// @param focus the explored focus
    /// @param key identity of the explored node
    /// @param enqueued number of candidates added to the frontier
    /// @param timestamp when it happened
    record FocusVisited(int step, Focus focus, NodeKey key, int enqueued, Instant timestamp)
            implements TraversalEvent {
        public static FocusVisited now(int step, Focus focus, NodeKey key, int enqueued) {
            return new FocusVisited(step, focus, key, enqueued, Instant.now());
        }
    }

    /// Emitted when a popped focus resolved to an already-visited identity.
    ///
    /// @param focus the skipped focus
    /// @param key identity it resolved to
    /// @param timestamp when it happened
    record FocusSkipped(Focus focus, NodeKey key, Instant timestamp) implements TraversalEvent {
        public static FocusSkipped now(Focus focus, NodeKey key) {
            return new FocusSkipped(focus, key, Instant.now());
        }
    }

    /// Emitted after the oracle confirmed or corrected one node's connections.
    ///
    /// @param round 1-based audit round
    /// @param key identity of the audited node
    /// @param added number of edges the audit added
    /// @param retracted number of edges the audit retracted
    /// @param timestamp when it happened
    record NodeAudited(int round, NodeKey key, int added, int retracted, Instant timestamp)
            implements TraversalEvent {
        public static NodeAudited now(int round, NodeKey key, int added, int retracted) {
            return new NodeAudited(round, key, added, retracted, Instant.now());
        }
    }
}
