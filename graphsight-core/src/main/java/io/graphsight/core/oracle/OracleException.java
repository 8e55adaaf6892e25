package io.graphsight.core.oracle;

import java.io.Serial;

/// Base type of failures raised at the oracle boundary.
///
/// A plain `OracleException` is treated as fatal for the current run. Subtypes mark the
/// failures the {@link OracleGateway} knows how to recover from:
/// - {@link OracleTimeoutException} and {@link OracleRateLimitException} are retried
/// - {@link OracleMalformedResponseException} triggers one clarifying re-prompt
/// - {@link OracleUnavailableException} reports that recovery was exhausted
///
/// @see VisionOracle#query(OracleRequest)
public class OracleException extends Exception {

    @Serial private static final long serialVersionUID = 4127700916613043652L;

    /// Creates exception with message.
    ///
    /// @param message description of the failure
    public OracleException(String message) {
        super(message);
    }

    /// Creates exception with message and cause.
    ///
    /// @param message description of the failure
    /// @param cause the underlying exception
    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
