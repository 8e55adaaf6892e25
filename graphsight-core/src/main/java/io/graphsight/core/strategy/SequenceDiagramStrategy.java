package io.graphsight.core.strategy;

import io.graphsight.core.context.ContextRequirements;
import io.graphsight.core.graph.DiagramType;
import io.graphsight.core.graph.NodeKey;
import io.graphsight.core.graph.OutputFormat;
import io.graphsight.core.oracle.OracleResponseParser;
import io.graphsight.core.synthesis.RawGraph;
import java.util.Map;

/// Strategy for sequence diagrams: participants exchanging messages top to bottom.
///
/// Participants are the nodes and messages the edges, in discovery order. Messages are
/// long-range, so this strategy keeps a wider history window than the flowchart one.
public class SequenceDiagramStrategy extends AbstractOracleStrategy {

    private static final int HISTORY_WINDOW = 15;

    private static final String GUIDANCE =
            """
            Report the current participant in "nodes". Report every message arrow that \
            starts or ends at its lifeline as an edge, labeled with the message text, in \
            top-to-bottom order. Put participants you have not examined yet in "next".""";

    public SequenceDiagramStrategy(
            OracleResponseParser parser, OutputFormat outputFormat, boolean useGrid) {
        super(
                parser,
                outputFormat,
                useGrid,
                ContextRequirements.defaults().withHistoryWindow(HISTORY_WINDOW));
    }

    @Override
    public DiagramType diagramType() {
        return DiagramType.SEQUENCE;
    }

    @Override
    protected String familyName() {
        return "sequence diagram";
    }

    @Override
    protected String nodeNoun() {
        return "participant";
    }

    @Override
    protected String edgeNoun() {
        return "message";
    }

    @Override
    protected String stepGuidance() {
        return GUIDANCE;
    }

    @Override
    protected String mermaidHeader() {
        return "sequenceDiagram";
    }

    @Override
    protected String renderMermaid(RawGraph graph) {
        Map<NodeKey, String> ids = assignIds(graph);
        StringBuilder code = new StringBuilder(mermaidHeader()).append('\n');
        for (RawGraph.GraphNode node : graph.nodes()) {
            String id = ids.get(node.key());
            code.append("    participant ").append(id);
            if (!id.equals(node.label())) {
                code.append(" as ").append(node.label().replace("\n", " "));
            }
            code.append('\n');
        }
        for (RawGraph.GraphEdge edge : graph.edges()) {
            code.append("    ")
                    .append(ids.get(edge.source()))
                    .append("->>")
                    .append(ids.get(edge.target()))
                    .append(": ")
                    .append(edge.isLabeled() ? edge.label().replace("\n", " ") : " ")
                    .append('\n');
        }
        return code.toString().trim();
    }

    @Override
    protected String renderNarrative(RawGraph graph) {
        if (graph.isEmpty()) {
            return "The sequence diagram contains no readable participants.";
        }
        StringBuilder text = new StringBuilder();
        text.append("The sequence diagram shows ")
                .append(graph.edges().size())
                .append(graph.edges().size() == 1 ? " message" : " messages")
                .append(" between ")
                .append(graph.nodes().size())
                .append(graph.nodes().size() == 1 ? " participant: " : " participants: ")
                .append(String.join(", ", graph.nodeNames()))
                .append(".\n");
        int index = 1;
        for (RawGraph.GraphEdge edge : graph.edges()) {
            text.append(index++)
                    .append(". ")
                    .append(edge.sourceName())
                    .append(" sends ")
                    .append(edge.isLabeled() ? "\"" + edge.label() + "\"" : "a message")
                    .append(" to ")
                    .append(edge.targetName())
                    .append(".\n");
        }
        return text.toString().trim();
    }
}
