package io.graphsight.core.validation;

/// Checks generated diagram code with an external notation parser.
///
/// Optional collaborator: interpretation results are returned whether or not a validator
/// is configured.
public interface SyntaxValidator {

    /// Returns `true` when the external parser can be run in this environment.
    boolean isAvailable();

    /// Parses diagram code.
    ///
    /// @param code diagram code, not null
    /// @return the parsed structure, never null
    /// @throws SyntaxValidationException if the code is invalid or the parser failed
    DiagramStructure validate(String code) throws SyntaxValidationException;
}
