package io.graphsight.core.detect;

import java.io.Serial;

/// Thrown when the diagram type cannot be determined with enough confidence.
///
/// Callers either fall back to a default strategy or surface the failure.
public class DetectorFailure extends Exception {

    @Serial private static final long serialVersionUID = -5102483311692085712L;

    public DetectorFailure(String message) {
        super(message);
    }

    public DetectorFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
