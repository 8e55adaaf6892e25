package io.graphsight.core.strategy;

import io.graphsight.core.context.ContextPayload;
import io.graphsight.core.context.ContextRequirements;
import io.graphsight.core.graph.AuditSubject;
import io.graphsight.core.graph.DiagramImage;
import io.graphsight.core.graph.DiagramType;
import io.graphsight.core.graph.Focus;
import io.graphsight.core.graph.OutputFormat;
import io.graphsight.core.history.AuditVerdict;
import io.graphsight.core.history.StepInterpretation;
import io.graphsight.core.oracle.OracleGateway;
import io.graphsight.core.oracle.OracleMalformedResponseException;
import io.graphsight.core.oracle.OracleRequest;
import io.graphsight.core.oracle.OracleResponse;
import io.graphsight.core.oracle.OracleUnavailableException;
import io.graphsight.core.synthesis.RawGraph;
import java.util.List;

/// Diagram-family knowledge plugged into the traversal engine.
///
/// A strategy knows how to ask the oracle about one family of diagrams, how to read its
/// replies, and how to render the merged graph in the requested output format. The
/// engine owns everything else: frontier, identity, history and budget.
///
/// ### Contracts
/// - Strategies never see or change traversal state; they receive history only as a
///   {@link ContextPayload}
/// - {@link #interpretStep} returns interpretations without a source key; the engine
///   attaches it
/// - {@link #interpretAudit} only reports what the oracle confirmed; the engine turns the
///   verdict into corrections
/// - Rendering is deterministic: the same graph always renders to the same text
///
/// @implNote Implementations must be stateless and thread-safe. One instance may serve
/// concurrent traversals.
///
/// @see StrategyRegistry for selection by diagram type
/// @see AbstractOracleStrategy for the shared oracle protocol
public interface Strategy {

    DiagramType diagramType();

    OutputFormat outputFormat();

    /// Returns how much history the strategy wants in each step request.
    ContextRequirements contextRequirements();

    /// Asks the oracle for the node(s) where exploration starts.
    ///
    /// @param image the diagram, not null
    /// @param oracle gateway of the current run, not null
    /// @return start foci, empty when the oracle found none or replied unusably
    /// @throws OracleUnavailableException if the oracle cannot be reached
    List<Focus> findInitialFocus(DiagramImage image, OracleGateway oracle)
            throws OracleUnavailableException;

    /// Builds the request interpreting one focus.
    ///
    /// @param image the diagram, not null
    /// @param focus node to explore, not null
    /// @param context history summary, not null
    /// @return the request, never null
    OracleRequest stepRequest(DiagramImage image, Focus focus, ContextPayload context);

    /// Reads the oracle's reply to a step request.
    ///
    /// @param response raw reply, not null
    /// @param focus node that was explored, not null
    /// @param context history summary the request was built with, not null
    /// @return the interpretation, never null
    /// @throws OracleMalformedResponseException if the reply does not follow the format
    StepInterpretation interpretStep(OracleResponse response, Focus focus, ContextPayload context)
            throws OracleMalformedResponseException;

    /// Builds the request asking the oracle to confirm one node's recorded connections.
    ///
    /// @param image the diagram, not null
    /// @param subject node under audit with its currently recorded neighbours, not null
    /// @return the request, never null
    OracleRequest auditRequest(DiagramImage image, AuditSubject subject);

    /// Reads the oracle's reply to an audit request.
    ///
    /// @param response raw reply, not null
    /// @param subject node that was audited, not null
    /// @return the verdict, never null
    /// @throws OracleMalformedResponseException if the reply does not follow the format
    AuditVerdict interpretAudit(OracleResponse response, AuditSubject subject)
            throws OracleMalformedResponseException;

    /// Renders a merged graph mechanically, without the oracle.
    ///
    /// @param graph merged graph, not null
    /// @return content in this strategy's output format, never null
    String renderRaw(RawGraph graph);

    /// Builds the request asking the oracle to rewrite raw content coherently.
    ///
    /// @param rawContent output of {@link #renderRaw}, not null
    /// @param reasoningTrace investigation log of the traversal, not null
    /// @return the request, never null
    OracleRequest refinementRequest(String rawContent, String reasoningTrace);

    /// Reads the refined content from the oracle's reply.
    ///
    /// @param response raw reply, not null
    /// @return refined content, never blank
    /// @throws OracleMalformedResponseException if the reply holds no usable content
    String extractRefined(OracleResponse response) throws OracleMalformedResponseException;
}
