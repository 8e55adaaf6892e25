package io.graphsight.core.strategy;

import io.graphsight.core.context.ContextRequirements;
import io.graphsight.core.graph.DiagramType;
import io.graphsight.core.graph.NodeKey;
import io.graphsight.core.graph.OutputFormat;
import io.graphsight.core.oracle.OracleResponseParser;
import io.graphsight.core.synthesis.RawGraph;
import java.util.Map;

/// Strategy for state machines: states joined by labeled transitions.
///
/// Nodes with an `initial` or `final` shape hint render as Mermaid's `[*]` pseudo-state.
public class StateDiagramStrategy extends AbstractOracleStrategy {

    private static final String PSEUDO_STATE = "[*]";

    private static final String GUIDANCE =
            """
            Report the current state in "nodes"; use shape "initial" for the filled start \
            dot and "final" for the end marker. Report every transition leaving the current \
            state, labeled with its event or guard.""";

    public StateDiagramStrategy(OracleResponseParser parser, OutputFormat outputFormat, boolean useGrid) {
        super(parser, outputFormat, useGrid, ContextRequirements.defaults().withSpatialHints(true));
    }

    @Override
    public DiagramType diagramType() {
        return DiagramType.STATE;
    }

    @Override
    protected String familyName() {
        return "state diagram";
    }

    @Override
    protected String nodeNoun() {
        return "state";
    }

    @Override
    protected String edgeNoun() {
        return "transition";
    }

    @Override
    protected String stepGuidance() {
        return GUIDANCE;
    }

    @Override
    protected String mermaidHeader() {
        return "stateDiagram-v2";
    }

    @Override
    protected String renderMermaid(RawGraph graph) {
        Map<NodeKey, String> ids = assignIds(graph);
        StringBuilder code = new StringBuilder(mermaidHeader()).append('\n');
        for (RawGraph.GraphNode node : graph.nodes()) {
            if (isPseudo(node)) {
                ids.put(node.key(), PSEUDO_STATE);
                continue;
            }
            String id = ids.get(node.key());
            if (!id.equals(node.label())) {
                code.append("    state \"")
                        .append(escapeLabel(node.label()))
                        .append("\" as ")
                        .append(id)
                        .append('\n');
            }
        }
        for (RawGraph.GraphEdge edge : graph.edges()) {
            code.append("    ")
                    .append(ids.get(edge.source()))
                    .append(" --> ")
                    .append(ids.get(edge.target()));
            if (edge.isLabeled()) {
                code.append(" : ").append(edge.label().replace("\n", " "));
            }
            code.append('\n');
        }
        return code.toString().trim();
    }

    @Override
    protected String renderNarrative(RawGraph graph) {
        if (graph.isEmpty()) {
            return "The state diagram contains no readable states.";
        }
        StringBuilder text = new StringBuilder();
        long states = graph.nodes().stream().filter(n -> !isPseudo(n)).count();
        text.append("The state machine has ")
                .append(states)
                .append(states == 1 ? " state" : " states")
                .append(" and ")
                .append(graph.edges().size())
                .append(graph.edges().size() == 1 ? " transition.\n" : " transitions.\n");
        for (RawGraph.GraphEdge edge : graph.edges()) {
            String source = describe(graph, edge.source(), edge.sourceName(), "start");
            String target = describe(graph, edge.target(), edge.targetName(), "end");
            text.append("- ")
                    .append(Character.toUpperCase(source.charAt(0)))
                    .append(source.substring(1))
                    .append(" moves to ")
                    .append(target);
            if (edge.isLabeled()) {
                text.append(" on \"").append(edge.label()).append('"');
            }
            text.append(".\n");
        }
        return text.toString().trim();
    }

    private static String describe(RawGraph graph, NodeKey key, String name, String pseudoName) {
        for (RawGraph.GraphNode node : graph.nodes()) {
            if (node.key().equals(key) && isPseudo(node)) {
                return "the " + pseudoName;
            }
        }
        return "\"" + name + "\"";
    }

    private static boolean isPseudo(RawGraph.GraphNode node) {
        return "initial".equals(node.shape()) || "final".equals(node.shape());
    }
}
