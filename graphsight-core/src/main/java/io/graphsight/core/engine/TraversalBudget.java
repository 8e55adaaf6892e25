package io.graphsight.core.engine;

import java.time.Duration;
import java.util.Objects;

/// Limits that end a traversal regardless of the oracle's own termination signals.
///
/// @param maxIterations maximum number of oracle-backed visits, at least 1
/// @param maxCostUsd approximate cost cap in USD, 0 for unlimited
/// @param maxDuration wall-clock cap, not null
public record TraversalBudget(int maxIterations, double maxCostUsd, Duration maxDuration) {

    public static final int DEFAULT_MAX_ITERATIONS = 30;
    public static final Duration DEFAULT_MAX_DURATION = Duration.ofMinutes(10);

    public TraversalBudget {
        Objects.requireNonNull(maxDuration, "maxDuration must not be null");
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1, got " + maxIterations);
        }
        if (maxCostUsd < 0) {
            throw new IllegalArgumentException("maxCostUsd must not be negative");
        }
        if (maxDuration.isNegative() || maxDuration.isZero()) {
            throw new IllegalArgumentException("maxDuration must be positive");
        }
    }

    public static TraversalBudget defaults() {
        return new TraversalBudget(DEFAULT_MAX_ITERATIONS, 0.0, DEFAULT_MAX_DURATION);
    }

    public TraversalBudget withMaxIterations(int iterations) {
        return new TraversalBudget(iterations, maxCostUsd, maxDuration);
    }

    public TraversalBudget withMaxCostUsd(double cost) {
        return new TraversalBudget(maxIterations, cost, maxDuration);
    }

    public TraversalBudget withMaxDuration(Duration duration) {
        return new TraversalBudget(maxIterations, maxCostUsd, duration);
    }

    /// Checks every limit before the next visit.
    ///
    /// @param iterations visits made so far
    /// @param costUsd approximate cost so far
    /// @param elapsed time since the traversal started, not null
    /// @throws BudgetExceededException if any limit is reached
    public void enforce(int iterations, double costUsd, Duration elapsed)
            throws BudgetExceededException {
        if (iterations >= maxIterations) {
            throw new BudgetExceededException(
                    BudgetExceededException.Limit.ITERATIONS,
                    "Iteration limit of " + maxIterations + " reached");
        }
        enforceSpend(costUsd, elapsed);
    }

    /// Checks the cost and duration limits only, for oracle work that is not a visit.
    ///
    /// @param costUsd approximate cost so far
    /// @param elapsed time since the traversal started, not null
    /// @throws BudgetExceededException if the cost or duration limit is reached
    public void enforceSpend(double costUsd, Duration elapsed) throws BudgetExceededException {
        if (isCostExhausted(costUsd)) {
            throw new BudgetExceededException(
                    BudgetExceededException.Limit.COST,
                    "Cost limit of $" + maxCostUsd + " reached ($" + costUsd + ")");
        }
        if (elapsed.compareTo(maxDuration) >= 0) {
            throw new BudgetExceededException(
                    BudgetExceededException.Limit.DURATION,
                    "Duration limit of " + maxDuration + " reached");
        }
    }

    /// Returns `true` when a cost cap is set and `costUsd` has reached it.
    public boolean isCostExhausted(double costUsd) {
        return maxCostUsd > 0 && costUsd >= maxCostUsd;
    }
}
