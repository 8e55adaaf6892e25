package io.graphsight.core.strategy;

import io.graphsight.core.context.ContextPayload;
import io.graphsight.core.context.ContextRequirements;
import io.graphsight.core.graph.AuditSubject;
import io.graphsight.core.graph.BoundingBox;
import io.graphsight.core.graph.DiagramImage;
import io.graphsight.core.graph.Focus;
import io.graphsight.core.graph.NodeKey;
import io.graphsight.core.graph.OutputFormat;
import io.graphsight.core.history.AuditVerdict;
import io.graphsight.core.history.StepInterpretation;
import io.graphsight.core.oracle.OracleGateway;
import io.graphsight.core.oracle.OracleMalformedResponseException;
import io.graphsight.core.oracle.OracleRequest;
import io.graphsight.core.oracle.OracleResponse;
import io.graphsight.core.oracle.OracleResponseParser;
import io.graphsight.core.oracle.OracleUnavailableException;
import io.graphsight.core.oracle.RequestPurpose;
import io.graphsight.core.synthesis.RawGraph;
import io.graphsight.core.util.ResponseText;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Shared oracle protocol for the built-in strategies.
///
/// Subclasses supply the family vocabulary (what a "node" and an "edge" are called),
/// family-specific reading hints, and the two renderers. Prompt layout, JSON reply
/// format, context phrasing, connection audits and refinement handling live here.
///
/// @implNote Stateless and thread-safe provided subclasses are.
public abstract class AbstractOracleStrategy implements Strategy {

    private static final Logger logger = Logger.getLogger(AbstractOracleStrategy.class.getName());

    private static final String SYSTEM_PROMPT =
            """
            You are a meticulous diagram reader. You explore a %s one element at a time and \
            report exactly what is drawn, never what you expect to be drawn. Coordinates are \
            normalized to a 0-1000 grid as [ymin, xmin, ymax, xmax].""";

    private static final String INITIAL_FOCUS_TEMPLATE =
            """
            ## Task
            Find where reading this %1$s starts.
            %2$s

            ## Output
            Reply with JSON only:

            ```json
            {"start_nodes": [
              {"ref": "short id", "label": "exact text in the %3$s", "description": "where it is", \
            "bbox": [ymin, xmin, ymax, xmax]%4$s}
            ]}
            ```

            Rules:
            - List every %3$s with no incoming %5$s
            - Use the exact text as label
            """;

    private static final String STEP_TEMPLATE =
            """
            ## Current %1$s
            Label: %2$s
            Description: %3$s
            Location: %4$s

            ## Already Known
            %5$s

            ## Task
            Examine the current %1$s and every %6$s touching it.
            %7$s

            ## Output
            Reply with JSON only:

            ```json
            {
              "reasoning": "what you see around the current %1$s",
              "nodes": [{"ref": "short id", "label": "exact text", "shape": "shape name", \
            "bbox": [ymin, xmin, ymax, xmax]%8$s, "revisit_of": null}],
              "edges": [{"source": "ref or known name", "target": "ref or known name", "label": "text on the %6$s"}],
              "next": [{"ref": "short id", "label": "exact text", "description": "where it is", \
            "bbox": [ymin, xmin, ymax, xmax]%8$s, "revisit_of": null}],
              "done": false
            }
            ```

            Rules:
            - Use "%9$s" as the ref of the current %1$s
            - When an element is one of the known ones, set "revisit_of" to its known name
            - Put in "next" only elements that still need to be examined
            - Set "done" to true when nothing leaves the current %1$s
            """;

    private static final String AUDIT_TEMPLATE =
            """
            ## %1$s Under Audit
            Name: %2$s
            Label: %3$s
            Location: %4$s

            ## Recorded Connections
            Incoming %5$ss from: %6$s
            Outgoing %5$ss to: %7$s

            ## Task
            Check the recorded connections of this %8$s against the image. Trace every line \
            touching it from end to end, following it through crossings and bends.
            - Remove a connection when no drawn %5$s joins the two %8$ss, even when they sit \
            close together
            - Add a connection when a %5$s reaches a %8$s far away on the page
            - Name %8$ss exactly as listed under Recorded Connections, or by their exact \
            text when they are not listed

            ## Output
            Reply with JSON only:

            ```json
            {"confirmed_incoming": ["name"], "confirmed_outgoing": ["name"], \
            "notes": "what you changed and why"}
            ```

            Use null for a direction you could not check, and an empty list when there is \
            no %5$s in that direction.
            """;

    private static final String REFINE_TEMPLATE =
            """
            ## Task
            The %1$s below was assembled mechanically from a step-by-step investigation. \
            Rewrite it as one coherent %2$s. Keep every %3$s and %4$s that the investigation \
            confirmed; remove duplicates and fix obvious naming inconsistencies.

            ## Assembled %2$s
            ```
            %5$s
            ```

            ## Investigation Log
            %6$s

            ## Output
            %7$s
            """;

    private static final String GRID_FIELD = ", \"grid\": [\"B3\"]";
    /// No grid is drawn on the image, so the cells named in replies are estimates. They
    /// only decide identity when a mention carries no bounding box.
    private static final String GRID_NOTE =
            "Also name the grid cells each element covers on an imaginary 10x10 grid laid over the"
                    + " image (not drawn): columns A-J left to right, rows 1-10 top to bottom.";

    private final OracleResponseParser parser;
    private final OutputFormat outputFormat;
    private final boolean useGrid;
    private final ContextRequirements contextRequirements;

    /// @param parser parser for oracle replies, not null
    /// @param outputFormat rendering target, not null
    /// @param useGrid whether prompts ask for grid-cell references, which serve as
    ///     advisory location evidence next to bounding boxes
    /// @param contextRequirements history needs of this strategy, not null
    protected AbstractOracleStrategy(
            OracleResponseParser parser,
            OutputFormat outputFormat,
            boolean useGrid,
            ContextRequirements contextRequirements) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.outputFormat = Objects.requireNonNull(outputFormat, "outputFormat must not be null");
        this.useGrid = useGrid;
        this.contextRequirements =
                Objects.requireNonNull(contextRequirements, "contextRequirements must not be null");
    }

    /// Human name of the diagram family, such as `flowchart`.
    protected abstract String familyName();

    /// What a node is called in this family, such as `step` or `participant`.
    protected abstract String nodeNoun();

    /// What an edge is called in this family, such as `arrow` or `message`.
    protected abstract String edgeNoun();

    /// Extra guidance appended to the step task.
    protected abstract String stepGuidance();

    /// First line every Mermaid rendering of this family starts with.
    protected abstract String mermaidHeader();

    protected abstract String renderMermaid(RawGraph graph);

    protected abstract String renderNarrative(RawGraph graph);

    @Override
    public OutputFormat outputFormat() {
        return outputFormat;
    }

    @Override
    public ContextRequirements contextRequirements() {
        return contextRequirements;
    }

    @Override
    public List<Focus> findInitialFocus(DiagramImage image, OracleGateway oracle)
            throws OracleUnavailableException {
        String instructions =
                INITIAL_FOCUS_TEMPLATE.formatted(
                        familyName(),
                        useGrid ? GRID_NOTE : "",
                        nodeNoun(),
                        useGrid ? GRID_FIELD : "",
                        edgeNoun());
        OracleRequest request =
                OracleRequest.of(RequestPurpose.INITIAL_FOCUS, image, systemPrompt(), instructions);
        List<Focus> foci =
                oracle.ask(request, response -> parser.parseInitialFoci(response.content()))
                        .orElse(List.of());
        logger.info("Initial focus for " + familyName() + ": " + foci.stream().map(Focus::label).toList());
        return foci;
    }

    @Override
    public OracleRequest stepRequest(DiagramImage image, Focus focus, ContextPayload context) {
        String instructions =
                STEP_TEMPLATE.formatted(
                        nodeNoun(),
                        focus.label(),
                        focus.description().isBlank() ? "(none)" : focus.description(),
                        describeLocation(focus),
                        renderContext(context),
                        edgeNoun(),
                        stepGuidance() + (useGrid ? "\n" + GRID_NOTE : ""),
                        useGrid ? GRID_FIELD : "",
                        focus.ref());
        return new OracleRequest(
                RequestPurpose.STEP,
                image,
                focus.fingerprint().box(),
                systemPrompt(),
                instructions,
                context);
    }

    @Override
    public StepInterpretation interpretStep(
            OracleResponse response, Focus focus, ContextPayload context)
            throws OracleMalformedResponseException {
        if (response.isBlank()) {
            throw new OracleMalformedResponseException("Empty reply, expected a JSON object");
        }
        return parser.parseStep(response.content(), focus);
    }

    @Override
    public OracleRequest auditRequest(DiagramImage image, AuditSubject subject) {
        String noun = nodeNoun();
        String instructions =
                AUDIT_TEMPLATE.formatted(
                        Character.toUpperCase(noun.charAt(0)) + noun.substring(1),
                        subject.name(),
                        subject.focus().label(),
                        describeLocation(subject.focus()),
                        edgeNoun(),
                        listNames(subject.claimedIncoming()),
                        listNames(subject.claimedOutgoing()),
                        noun);
        return new OracleRequest(
                RequestPurpose.AUDIT,
                image,
                subject.focus().fingerprint().box(),
                systemPrompt(),
                instructions,
                null);
    }

    @Override
    public AuditVerdict interpretAudit(OracleResponse response, AuditSubject subject)
            throws OracleMalformedResponseException {
        if (response.isBlank()) {
            throw new OracleMalformedResponseException("Empty audit reply, expected a JSON object");
        }
        return parser.parseAudit(response.content(), subject);
    }

    @Override
    public String renderRaw(RawGraph graph) {
        return outputFormat == OutputFormat.MERMAID ? renderMermaid(graph) : renderNarrative(graph);
    }

    @Override
    public OracleRequest refinementRequest(String rawContent, String reasoningTrace) {
        String instructions =
                REFINE_TEMPLATE.formatted(
                        outputFormat == OutputFormat.MERMAID ? "Mermaid code" : "description",
                        outputFormat == OutputFormat.MERMAID
                                ? "Mermaid " + familyName()
                                : "plain-language description of the " + familyName(),
                        nodeNoun(),
                        edgeNoun(),
                        rawContent,
                        reasoningTrace.isBlank() ? "(empty)" : reasoningTrace,
                        outputFormat == OutputFormat.MERMAID
                                ? "Reply with the Mermaid code only, in a single code block starting with `"
                                        + mermaidHeader()
                                        + "`."
                                : "Reply with the description only, as plain prose.");
        return OracleRequest.textOnly(RequestPurpose.REFINE, systemPrompt(), instructions);
    }

    @Override
    public String extractRefined(OracleResponse response) throws OracleMalformedResponseException {
        String content = ResponseText.stripCodeFence(response.content());
        if (content.isBlank()) {
            throw new OracleMalformedResponseException("Empty refinement reply");
        }
        if (outputFormat == OutputFormat.MERMAID) {
            String keyword = mermaidHeader().split("\\s+")[0].toLowerCase(Locale.ROOT);
            if (!content.toLowerCase(Locale.ROOT).startsWith(keyword)) {
                throw new OracleMalformedResponseException(
                        "Refined code must start with '" + mermaidHeader() + "'");
            }
        }
        return content;
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    protected String systemPrompt() {
        return SYSTEM_PROMPT.formatted(familyName());
    }

    /// Phrases the context payload for the oracle.
    protected String renderContext(ContextPayload context) {
        if (context.isEmpty()) {
            return "Nothing yet. This is the first " + nodeNoun() + " examined.";
        }
        StringBuilder text = new StringBuilder();
        text.append("Examined ")
                .append(nodeNoun())
                .append("s (use these names in \"revisit_of\" and edges):\n");
        for (ContextPayload.VisitedNode node : context.visitedNodes()) {
            text.append("- ").append(node.name());
            if (!node.name().equals(node.label())) {
                text.append(" (text: \"").append(node.label()).append("\")");
            }
            if (node.box() != null) {
                text.append(" at ").append(formatBox(node.box()));
            }
            text.append('\n');
        }
        if (!context.knownEdges().isEmpty()) {
            text.append("\nRecorded ").append(edgeNoun()).append("s:\n");
            for (ContextPayload.KnownEdge edge : context.knownEdges()) {
                text.append("- ").append(edge.source()).append(" -> ").append(edge.target());
                if (!edge.label().isBlank()) {
                    text.append(" (").append(edge.label()).append(')');
                }
                text.append('\n');
            }
        }
        if (!context.recentReasoning().isEmpty()) {
            text.append("\nRecent observations:\n");
            for (String line : context.recentReasoning()) {
                text.append("- ").append(line).append('\n');
            }
        }
        return text.toString().trim();
    }

    private static String listNames(List<String> names) {
        return names.isEmpty() ? "(none)" : String.join(", ", names);
    }

    private String describeLocation(Focus focus) {
        StringBuilder location = new StringBuilder();
        if (focus.fingerprint().hasBox()) {
            location.append(formatBox(focus.fingerprint().box()));
        }
        if (!focus.fingerprint().gridCells().isEmpty()) {
            if (location.length() > 0) {
                location.append(", ");
            }
            location.append("cells ").append(String.join(" ", focus.fingerprint().gridCells()));
        }
        return location.length() > 0 ? location.toString() : "(unknown)";
    }

    private static String formatBox(BoundingBox box) {
        return String.format(
                Locale.ROOT,
                "[%.0f, %.0f, %.0f, %.0f]",
                box.ymin(),
                box.xmin(),
                box.ymax(),
                box.xmax());
    }

    /// Converts a display name into an identifier safe for Mermaid code.
    protected static String sanitizeId(String name) {
        String id = name.replaceAll("[^A-Za-z0-9_]", "_");
        if (id.isEmpty() || Character.isDigit(id.charAt(0))) {
            id = "n" + id;
        }
        return id;
    }

    /// Assigns each node a Mermaid identifier, unique within the graph.
    protected static Map<NodeKey, String> assignIds(RawGraph graph) {
        Map<NodeKey, String> ids = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();
        for (RawGraph.GraphNode node : graph.nodes()) {
            String base = sanitizeId(node.name());
            String id = base;
            int suffix = 2;
            while (!used.add(id)) {
                id = base + "_" + suffix++;
            }
            ids.put(node.key(), id);
        }
        return ids;
    }

    /// Escapes text placed inside a quoted Mermaid label.
    protected static String escapeLabel(String text) {
        return text.replace("\"", "#quot;").replace("|", "#124;").replace("\n", " ");
    }
}
