package io.graphsight.core.oracle;

import java.io.Serial;

/// Thrown when the oracle cannot be reached after retries, or failed in a way that is
/// not retryable.
///
/// Fatal for the current traversal: the engine stops exploring and returns whatever
/// it gathered so far.
public class OracleUnavailableException extends OracleException {

    @Serial private static final long serialVersionUID = 1907359245417761308L;

    private final int attempts;

    /// Creates exception with message, attempt count and cause.
    ///
    /// @param message description of the failure
    /// @param attempts number of calls made before giving up
    /// @param cause the last underlying failure, may be null
    public OracleUnavailableException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    /// Returns the number of calls attempted before giving up.
    public int getAttempts() {
        return attempts;
    }
}
