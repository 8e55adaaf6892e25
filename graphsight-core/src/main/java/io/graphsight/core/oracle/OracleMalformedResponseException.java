package io.graphsight.core.oracle;

import java.io.Serial;

/// Thrown when an oracle reply cannot be turned into the structure a caller expects.
///
/// Raised by parsing, never by transport. The {@link OracleGateway} answers it with a
/// single re-prompt that carries this exception's message as a clarifying instruction.
public class OracleMalformedResponseException extends OracleException {

    @Serial private static final long serialVersionUID = -8853027334904610953L;

    public OracleMalformedResponseException(String message) {
        super(message);
    }

    public OracleMalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
