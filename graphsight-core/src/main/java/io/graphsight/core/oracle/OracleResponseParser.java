package io.graphsight.core.oracle;

import io.graphsight.core.detect.Classification;
import io.graphsight.core.graph.AuditSubject;
import io.graphsight.core.graph.Focus;
import io.graphsight.core.history.AuditVerdict;
import io.graphsight.core.history.StepInterpretation;
import java.util.List;

/// Parses the oracle's JSON replies into domain types.
///
/// Kept as an interface so the core stays free of a JSON library. The Jackson-backed
/// implementation lives in the `graphsight-serialization` module.
///
/// ### Reply shapes
/// - initial focus: `{"start_nodes": [{"ref", "label", "description", "bbox", "grid"}]}`
/// - step: `{"reasoning", "nodes": [...], "edges": [...], "next": [...], "done"}`
/// - classification: `{"diagram_type", "confidence", "reasoning"}`
/// - audit: `{"confirmed_incoming": [...], "confirmed_outgoing": [...], "notes"}`
///
/// Implementations must tolerate markdown code fences and surrounding prose.
public interface OracleResponseParser {

    /// Parses the list of foci the traversal starts from.
    ///
    /// @param content raw reply, not null
    /// @return start foci in the order given, never null (may be empty)
    /// @throws OracleMalformedResponseException if the reply is not the expected JSON
    List<Focus> parseInitialFoci(String content) throws OracleMalformedResponseException;

    /// Parses the interpretation of one focus.
    ///
    /// @param content raw reply, not null
    /// @param focus the focus that was asked about, not null
    /// @return interpretation without a source key attached, never null
    /// @throws OracleMalformedResponseException if the reply is not the expected JSON
    StepInterpretation parseStep(String content, Focus focus)
            throws OracleMalformedResponseException;

    /// Parses a diagram-type classification.
    ///
    /// @param content raw reply, not null
    /// @return the classification, never null
    /// @throws OracleMalformedResponseException if the reply is not the expected JSON
    Classification parseClassification(String content) throws OracleMalformedResponseException;

    /// Parses the confirmation of one node's connections.
    ///
    /// @param content raw reply, not null
    /// @param subject the node that was audited, not null
    /// @return the verdict, never null
    /// @throws OracleMalformedResponseException if the reply is not the expected JSON
    AuditVerdict parseAudit(String content, AuditSubject subject)
            throws OracleMalformedResponseException;
}
