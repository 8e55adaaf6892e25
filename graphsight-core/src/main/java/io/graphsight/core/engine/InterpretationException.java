package io.graphsight.core.engine;

import java.io.Serial;

/// Thrown when an interpretation cannot start or made no progress at all.
///
/// Covers setup failures only: no image, no strategy for the diagram, or an oracle that
/// was unavailable before the first focus was found. Failures after progress has been
/// made produce a partial result instead.
public class InterpretationException extends Exception {

    @Serial private static final long serialVersionUID = 2283960411179635220L;

    public InterpretationException(String message) {
        super(message);
    }

    public InterpretationException(String message, Throwable cause) {
        super(message, cause);
    }
}
