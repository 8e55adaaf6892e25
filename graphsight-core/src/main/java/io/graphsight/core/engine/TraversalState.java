package io.graphsight.core.engine;

import io.graphsight.core.graph.Focus;
import io.graphsight.core.graph.NodeIdentity;
import io.graphsight.core.history.HistoryRecord;
import io.graphsight.core.identity.NodeIdentityResolver;
import io.graphsight.core.identity.VisitedSet;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/// Mutable state of one traversal.
///
/// Created per run and never shared, which is what lets independent traversals run
/// concurrently on one engine.
///
/// @implNote **Not thread-safe**. Confined to the thread running the traversal.
final class TraversalState {

    private final NodeIdentityResolver resolver;
    private final VisitedSet visited = new VisitedSet();
    private final Deque<FrontierEntry> frontier = new ArrayDeque<>();
    private final Instant startedAt;

    private HistoryRecord history = HistoryRecord.empty();
    private TraversalPhase phase = TraversalPhase.INIT;
    private int iterations;

    TraversalState(NodeIdentityResolver resolver, Instant startedAt) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt must not be null");
    }

    NodeIdentityResolver resolver() {
        return resolver;
    }

    VisitedSet visited() {
        return visited;
    }

    Deque<FrontierEntry> frontier() {
        return frontier;
    }

    Instant startedAt() {
        return startedAt;
    }

    HistoryRecord history() {
        return history;
    }

    void history(HistoryRecord history) {
        this.history = Objects.requireNonNull(history, "history must not be null");
    }

    TraversalPhase phase() {
        return phase;
    }

    void phase(TraversalPhase phase) {
        this.phase = phase;
    }

    int iterations() {
        return iterations;
    }

    void countIteration() {
        iterations++;
    }

    /// A pending focus with the identity it resolved to when enqueued.
    record FrontierEntry(Focus focus, NodeIdentity identity) {
        FrontierEntry {
            Objects.requireNonNull(focus, "focus must not be null");
            Objects.requireNonNull(identity, "identity must not be null");
        }
    }
}
