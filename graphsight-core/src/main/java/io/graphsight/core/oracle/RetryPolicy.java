package io.graphsight.core.oracle;

import java.time.Duration;
import java.util.Objects;

/// Backoff settings for retryable oracle failures.
///
/// The delay before attempt `n` (2-based, since attempt 1 is never delayed) is
/// `initialBackoff * multiplier^(n-2)`, capped at `maxBackoff`.
///
/// @param maxAttempts total attempts per request including the first, at least 1
/// @param initialBackoff delay before the first retry, not negative
/// @param multiplier growth factor between retries, at least 1.0
/// @param maxBackoff upper bound of a single delay, not negative
public record RetryPolicy(
        int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {

    public RetryPolicy {
        Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
        Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got " + multiplier);
        }
        if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("backoff durations must not be negative");
        }
    }

    /// Three attempts, 500 ms initial delay, doubling, capped at 8 s.
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(500), 2.0, Duration.ofSeconds(8));
    }

    /// Policy that retries without waiting. Intended for tests.
    public static RetryPolicy immediate(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ZERO, 1.0, Duration.ZERO);
    }

    /// Returns the delay to wait before the given attempt.
    ///
    /// @param attempt 1-based attempt number
    /// @return delay, zero for the first attempt, never null
    public Duration delayBefore(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        double factor = Math.pow(multiplier, attempt - 2);
        long millis = (long) Math.min(initialBackoff.toMillis() * factor, maxBackoff.toMillis());
        return Duration.ofMillis(millis);
    }
}
