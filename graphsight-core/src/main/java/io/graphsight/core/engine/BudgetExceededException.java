package io.graphsight.core.engine;

import java.io.Serial;

/// Thrown when a traversal hits one of its budget limits.
///
/// Not an error: the engine moves to {@link TraversalPhase#DRAINING} and returns what it
/// gathered.
public class BudgetExceededException extends Exception {

    @Serial private static final long serialVersionUID = -1440392775207283106L;

    private final Limit limit;

    public BudgetExceededException(Limit limit, String message) {
        super(message);
        this.limit = limit;
    }

    public Limit getLimit() {
        return limit;
    }

    /// Which limit was reached.
    public enum Limit {
        ITERATIONS,
        COST,
        DURATION
    }
}
