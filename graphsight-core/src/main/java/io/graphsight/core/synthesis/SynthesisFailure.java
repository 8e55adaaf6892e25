package io.graphsight.core.synthesis;

import java.io.Serial;

/// Thrown when the refinement pass cannot produce usable content.
///
/// Never escapes {@link Synthesizer}: the raw content is used instead and the result is
/// marked degraded.
public class SynthesisFailure extends Exception {

    @Serial private static final long serialVersionUID = 3348726169402718853L;

    public SynthesisFailure(String message) {
        super(message);
    }

    public SynthesisFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
