package io.graphsight.core.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/// Cooperative cancellation signal for a traversal.
///
/// Once cancelled, the engine issues no further oracle calls, discards a step whose
/// call was in flight, and returns a partial result built from the fragments it already
/// holds.
///
/// @implNote Thread-safe. Typically cancelled from a thread other than the one running
/// the traversal.
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /// Returns a fresh token that has not been cancelled.
    public static CancellationToken create() {
        return new CancellationToken();
    }

    /// Requests cancellation. Idempotent.
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
