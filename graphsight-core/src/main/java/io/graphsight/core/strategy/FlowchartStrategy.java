package io.graphsight.core.strategy;

import io.graphsight.core.context.ContextRequirements;
import io.graphsight.core.graph.DiagramType;
import io.graphsight.core.graph.NodeKey;
import io.graphsight.core.graph.OutputFormat;
import io.graphsight.core.oracle.OracleResponseParser;
import io.graphsight.core.synthesis.RawGraph;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Strategy for flowcharts: boxes joined by arrows, read top-down from the start node.
///
/// Mermaid output uses `flowchart TD` with shapes chosen from the oracle's shape hints.
/// Natural-language output describes every step and where the flow goes next.
public class FlowchartStrategy extends AbstractOracleStrategy {

    private static final String GUIDANCE =
            """
            Report the current step itself in "nodes" with its shape (process, decision, \
            terminal, io, database, subroutine). For a decision, report every outgoing arrow \
            with its condition as the edge label. Follow arrows to the end, including loops \
            back to earlier steps.""";

    public FlowchartStrategy(OracleResponseParser parser, OutputFormat outputFormat, boolean useGrid) {
        super(parser, outputFormat, useGrid, ContextRequirements.defaults());
    }

    @Override
    public DiagramType diagramType() {
        return DiagramType.FLOWCHART;
    }

    @Override
    protected String familyName() {
        return "flowchart";
    }

    @Override
    protected String nodeNoun() {
        return "step";
    }

    @Override
    protected String edgeNoun() {
        return "arrow";
    }

    @Override
    protected String stepGuidance() {
        return GUIDANCE;
    }

    @Override
    protected String mermaidHeader() {
        return "flowchart TD";
    }

    @Override
    protected String renderMermaid(RawGraph graph) {
        Map<NodeKey, String> ids = assignIds(graph);
        StringBuilder code = new StringBuilder(mermaidHeader()).append('\n');
        for (RawGraph.GraphNode node : graph.nodes()) {
            code.append("    ")
                    .append(ids.get(node.key()))
                    .append(shape(node.shape(), escapeLabel(node.label())))
                    .append('\n');
        }
        for (RawGraph.GraphEdge edge : graph.edges()) {
            code.append("    ").append(ids.get(edge.source()));
            if (edge.isLabeled()) {
                code.append(" -->|").append(escapeLabel(edge.label())).append("| ");
            } else {
                code.append(" --> ");
            }
            code.append(ids.get(edge.target())).append('\n');
        }
        return code.toString().trim();
    }

    @Override
    protected String renderNarrative(RawGraph graph) {
        if (graph.isEmpty()) {
            return "The flowchart contains no readable steps.";
        }
        StringBuilder text = new StringBuilder();
        text.append("The flowchart has ")
                .append(graph.nodes().size())
                .append(graph.nodes().size() == 1 ? " step" : " steps")
                .append(" and ")
                .append(graph.edges().size())
                .append(graph.edges().size() == 1 ? " connection.\n" : " connections.\n");

        Set<NodeKey> withIncoming = new HashSet<>();
        Set<NodeKey> withOutgoing = new HashSet<>();
        for (RawGraph.GraphEdge edge : graph.edges()) {
            withOutgoing.add(edge.source());
            withIncoming.add(edge.target());
        }
        List<String> starts =
                graph.nodes().stream()
                        .filter(n -> !withIncoming.contains(n.key()))
                        .map(n -> "\"" + n.name() + "\"")
                        .toList();
        if (!starts.isEmpty()) {
            text.append("It starts at ").append(String.join(", ", starts)).append(".\n");
        }

        for (RawGraph.GraphEdge edge : graph.edges()) {
            text.append("- From \"")
                    .append(edge.sourceName())
                    .append("\" the flow continues to \"")
                    .append(edge.targetName())
                    .append('"');
            if (edge.isLabeled()) {
                text.append(" when \"").append(edge.label()).append('"');
            }
            text.append(".\n");
        }

        List<String> ends =
                graph.nodes().stream()
                        .filter(n -> !withOutgoing.contains(n.key()))
                        .map(n -> "\"" + n.name() + "\"")
                        .toList();
        if (!ends.isEmpty()) {
            text.append("It ends at ").append(String.join(", ", ends)).append('.');
        }
        return text.toString().trim();
    }

    private static String shape(String hint, String label) {
        if (hint == null) {
            return "[\"" + label + "\"]";
        }
        return switch (hint) {
            case "decision", "diamond", "rhombus" -> "{\"" + label + "\"}";
            case "terminal", "start", "end", "stadium", "oval", "rounded" -> "([\"" + label + "\"])";
            case "circle" -> "((\"" + label + "\"))";
            case "io", "input", "output", "parallelogram", "data" -> "[/\"" + label + "\"/]";
            case "database", "cylinder" -> "[(\"" + label + "\")]";
            case "subroutine", "subprocess" -> "[[\"" + label + "\"]]";
            default -> "[\"" + label + "\"]";
        };
    }
}
