package io.graphsight.core.validation;

import java.io.Serial;

/// Thrown when diagram code is rejected by the notation parser, or the parser could not
/// be run.
public class SyntaxValidationException extends Exception {

    @Serial private static final long serialVersionUID = 7763310985230618842L;

    public SyntaxValidationException(String message) {
        super(message);
    }

    public SyntaxValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
