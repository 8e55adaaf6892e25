package io.graphsight.core.detect;

import io.graphsight.core.graph.DiagramImage;
import io.graphsight.core.graph.DiagramType;
import io.graphsight.core.oracle.OracleGateway;
import io.graphsight.core.oracle.OracleRequest;
import io.graphsight.core.oracle.OracleResponseParser;
import io.graphsight.core.oracle.OracleUnavailableException;
import io.graphsight.core.oracle.RequestPurpose;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Detector that asks the vision oracle which family a diagram belongs to.
///
/// Rejects `unknown` verdicts and verdicts below the minimum confidence.
public class OracleDiagramTypeDetector implements DiagramTypeDetector {

    private static final Logger logger = Logger.getLogger(OracleDiagramTypeDetector.class.getName());

    private static final String SYSTEM_PROMPT = "You are an expert in diagram notations.";

    private static final String CLASSIFY_PROMPT =
            """
            ## Task
            Identify the type of diagram in the image.

            Choose one of:
            - flowchart: process steps and decisions joined by arrows
            - sequenceDiagram: participants with vertical lifelines exchanging messages
            - stateDiagram: states joined by event transitions, often with a start dot
            - classDiagram: classes with attributes, methods and relationships
            - erDiagram: entities with attributes and cardinality relationships
            - unknown: none of the above

            ## Output
            Reply with JSON only:

            ```json
            {"diagram_type": "flowchart", "confidence": 0.9, "reasoning": "short justification"}
            ```
            """;

    private final OracleResponseParser parser;
    private final double minConfidence;

    /// @param parser parser for the classification reply, not null
    /// @param minConfidence verdicts below this are rejected, in `[0, 1]`
    public OracleDiagramTypeDetector(OracleResponseParser parser, double minConfidence) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence must be in [0, 1], got " + minConfidence);
        }
        this.minConfidence = minConfidence;
    }

    @Override
    public DiagramType classify(DiagramImage image, OracleGateway oracle) throws DetectorFailure {
        OracleRequest request =
                OracleRequest.of(RequestPurpose.CLASSIFY, image, SYSTEM_PROMPT, CLASSIFY_PROMPT);

        Optional<Classification> verdict;
        try {
            verdict = oracle.ask(request, response -> parser.parseClassification(response.content()));
        } catch (OracleUnavailableException e) {
            throw new DetectorFailure("Oracle unavailable during classification", e);
        }

        Classification classification =
                verdict.orElseThrow(() -> new DetectorFailure("Classification reply was malformed"));
        if (classification.type() == DiagramType.UNKNOWN) {
            throw new DetectorFailure("Diagram type not recognized: " + classification.reasoning());
        }
        if (classification.confidence() < minConfidence) {
            throw new DetectorFailure(
                    "Low confidence "
                            + classification.confidence()
                            + " for "
                            + classification.type().wireName());
        }
        logger.info(
                "Detected "
                        + classification.type().wireName()
                        + " (confidence "
                        + classification.confidence()
                        + ")");
        return classification.type();
    }
}
