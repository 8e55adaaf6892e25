package io.graphsight.serialization;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.graphsight.core.detect.Classification;
import io.graphsight.core.graph.AuditSubject;
import io.graphsight.core.graph.BoundingBox;
import io.graphsight.core.graph.DiagramType;
import io.graphsight.core.graph.EdgeMention;
import io.graphsight.core.graph.Fingerprint;
import io.graphsight.core.graph.Focus;
import io.graphsight.core.graph.NodeMention;
import io.graphsight.core.history.AuditVerdict;
import io.graphsight.core.history.StepInterpretation;
import io.graphsight.core.oracle.OracleMalformedResponseException;
import io.graphsight.core.oracle.OracleResponseParser;
import io.graphsight.core.util.ResponseText;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Jackson-based implementation of {@link OracleResponseParser}.
///
/// Parses the four JSON reply shapes the strategies ask for:
///
/// **Initial focus:**
/// ```json
/// {"start_nodes": [{"ref": "s", "label": "Start", "bbox": [40, 420, 90, 580]}]}
/// ```
///
/// **Step:**
/// ```json
/// {"reasoning": "...", "nodes": [...], "edges": [{"source": "s", "target": "c"}],
///  "next": [...], "done": false}
/// ```
///
/// **Classification:**
/// ```json
/// {"diagram_type": "flowchart", "confidence": 0.92, "reasoning": "..."}
/// ```
///
/// **Audit:**
/// ```json
/// {"confirmed_incoming": ["Start"], "confirmed_outgoing": ["Approve", "Reject"], "notes": "..."}
/// ```
///
/// The parser strips markdown code fences and surrounding prose before
/// deserialisation. Individual elements that cannot be used (blank labels, edges
/// without an endpoint, bounding boxes that are inverted or hold null coordinates)
/// are dropped with a warning rather than failing the whole reply; only a reply that
/// is not the expected JSON object is reported as malformed. No unchecked exception
/// from element conversion escapes a parse call.
///
/// @implNote Thread-safe if the supplied {@link ObjectMapper} is thread-safe
/// (Jackson's default mapper is).
///
/// @see OracleResponseParser for the interface contract
/// @see io.graphsight.core.strategy.AbstractOracleStrategy for the prompts producing these replies
public class JacksonOracleResponseParser implements OracleResponseParser {

    private static final Logger logger =
            Logger.getLogger(JacksonOracleResponseParser.class.getName());

    private final ObjectMapper objectMapper;

    /// Creates a parser with a lenient default mapper.
    public JacksonOracleResponseParser() {
        this(
                new ObjectMapper()
                        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                        .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY));
    }

    /// Creates a parser backed by the given Jackson mapper.
    ///
    /// @param objectMapper the mapper to use for JSON deserialisation, not null
    public JacksonOracleResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public List<Focus> parseInitialFoci(String content) throws OracleMalformedResponseException {
        InitialReply reply = read(content, InitialReply.class, "initial focus");
        if (reply.startNodes() == null) {
            throw new OracleMalformedResponseException("Reply has no 'start_nodes' array");
        }
        return toFoci(reply.startNodes());
    }

    @Override
    public StepInterpretation parseStep(String content, Focus focus)
            throws OracleMalformedResponseException {
        Objects.requireNonNull(focus, "focus must not be null");
        StepReply reply = read(content, StepReply.class, "step");

        List<NodeMention> nodes = new ArrayList<>();
        for (ElementDto dto : orEmpty(reply.nodes())) {
            if (isBlank(dto.label())) {
                logger.warning("Dropping node without label, ref=" + dto.ref());
                continue;
            }
            try {
                nodes.add(
                        new NodeMention(
                                dto.ref(), dto.label(), dto.shape(), fingerprint(dto), dto.revisitOf()));
            } catch (RuntimeException e) {
                logger.warning("Dropping unusable node '" + dto.label() + "': " + e);
            }
        }

        List<EdgeMention> edges = new ArrayList<>();
        for (EdgeDto dto : orEmpty(reply.edges())) {
            if (isBlank(dto.source()) || isBlank(dto.target())) {
                logger.warning(
                        "Dropping edge with missing endpoint: " + dto.source() + " -> " + dto.target());
                continue;
            }
            try {
                edges.add(new EdgeMention(dto.source(), dto.target(), dto.label()));
            } catch (RuntimeException e) {
                logger.warning(
                        "Dropping unusable edge " + dto.source() + " -> " + dto.target() + ": " + e);
            }
        }

        return new StepInterpretation(
                focus,
                null,
                nodes,
                edges,
                reply.reasoning(),
                toFoci(orEmpty(reply.next())),
                Boolean.TRUE.equals(reply.done()));
    }

    @Override
    public Classification parseClassification(String content)
            throws OracleMalformedResponseException {
        ClassificationReply reply = read(content, ClassificationReply.class, "classification");
        if (isBlank(reply.diagramType())) {
            throw new OracleMalformedResponseException("Reply has no 'diagram_type'");
        }
        double confidence = reply.confidence() != null ? reply.confidence() : 0.0;
        return new Classification(
                DiagramType.fromWireName(reply.diagramType()), confidence, reply.reasoning());
    }

    @Override
    public AuditVerdict parseAudit(String content, AuditSubject subject)
            throws OracleMalformedResponseException {
        Objects.requireNonNull(subject, "subject must not be null");
        AuditReply reply = read(content, AuditReply.class, "audit");
        return new AuditVerdict(reply.confirmedIncoming(), reply.confirmedOutgoing(), reply.notes());
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private <T> T read(String content, Class<T> type, String shape)
            throws OracleMalformedResponseException {
        Objects.requireNonNull(content, "content must not be null");
        String json = ResponseText.extractJsonObject(ResponseText.stripCodeFence(content));
        if (json == null) {
            json = ResponseText.extractJsonObject(content);
        }
        if (json == null) {
            throw new OracleMalformedResponseException(
                    "No JSON object in " + shape + " reply: " + ResponseText.abbreviate(content, 120));
        }

        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new OracleMalformedResponseException(
                    "Failed to parse " + shape + " JSON: " + e.getOriginalMessage(), e);
        }
    }

    private List<Focus> toFoci(List<ElementDto> dtos) {
        List<Focus> foci = new ArrayList<>(dtos.size());
        for (ElementDto dto : dtos) {
            if (isBlank(dto.label())) {
                logger.warning("Dropping focus without label, ref=" + dto.ref());
                continue;
            }
            try {
                foci.add(
                        new Focus(
                                dto.ref(),
                                dto.label(),
                                dto.description(),
                                fingerprint(dto),
                                dto.revisitOf()));
            } catch (RuntimeException e) {
                logger.warning("Dropping unusable focus '" + dto.label() + "': " + e);
            }
        }
        return foci;
    }

    private Fingerprint fingerprint(ElementDto dto) {
        BoundingBox box = null;
        if (dto.bbox() != null && !dto.bbox().isEmpty()) {
            try {
                box = BoundingBox.of(dto.bbox());
            } catch (IllegalArgumentException e) {
                logger.warning("Ignoring bbox of '" + dto.label() + "': " + e.getMessage());
            }
        }
        List<String> grid = orEmpty(dto.grid());
        return new Fingerprint(box, new LinkedHashSet<>(grid));
    }

    private static <T> List<T> orEmpty(List<T> values) {
        if (values == null) {
            return List.of();
        }
        List<T> present = new ArrayList<>(values.size());
        for (T value : values) {
            if (value != null) {
                present.add(value);
            }
        }
        return present;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // -----------------------------------------------------------------------
    // Wire DTOs
    // -----------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    record InitialReply(@JsonProperty("start_nodes") List<ElementDto> startNodes) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StepReply(
            @JsonProperty("reasoning") String reasoning,
            @JsonProperty("nodes") List<ElementDto> nodes,
            @JsonProperty("edges") List<EdgeDto> edges,
            @JsonProperty("next") @JsonAlias("next_nodes") List<ElementDto> next,
            @JsonProperty("done") Boolean done) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ElementDto(
            @JsonProperty("ref") @JsonAlias("id") String ref,
            @JsonProperty("label") @JsonAlias("text") String label,
            @JsonProperty("shape") String shape,
            @JsonProperty("description") String description,
            @JsonProperty("bbox") List<Double> bbox,
            @JsonProperty("grid") List<String> grid,
            @JsonProperty("revisit_of") String revisitOf) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EdgeDto(
            @JsonProperty("source") @JsonAlias({"from", "src"}) String source,
            @JsonProperty("target") @JsonAlias({"to", "dst"}) String target,
            @JsonProperty("label") String label) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AuditReply(
            @JsonProperty("confirmed_incoming") @JsonAlias("incoming") List<String> confirmedIncoming,
            @JsonProperty("confirmed_outgoing") @JsonAlias("outgoing") List<String> confirmedOutgoing,
            @JsonProperty("notes") @JsonAlias("audit_notes") String notes) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ClassificationReply(
            @JsonProperty("diagram_type") String diagramType,
            @JsonProperty("confidence") Double confidence,
            @JsonProperty("reasoning") String reasoning) {}
}
