package io.graphsight.core.oracle;

import java.io.Serial;

/// Thrown when an oracle call did not complete in time. Retried with backoff.
public class OracleTimeoutException extends OracleException {

    @Serial private static final long serialVersionUID = -2315842771096645408L;

    public OracleTimeoutException(String message) {
        super(message);
    }

    public OracleTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
