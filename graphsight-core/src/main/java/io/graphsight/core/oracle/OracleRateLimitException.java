package io.graphsight.core.oracle;

import java.io.Serial;

/// Thrown when the oracle's provider rejected a call for exceeding its rate limit.
/// Retried with backoff.
public class OracleRateLimitException extends OracleException {

    @Serial private static final long serialVersionUID = 6671032589184457212L;

    public OracleRateLimitException(String message) {
        super(message);
    }

    public OracleRateLimitException(String message, Throwable cause) {
        super(message, cause);
    }
}
