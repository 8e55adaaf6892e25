package io.graphsight.core.validation;

import java.util.List;

/// Structure of diagram code as seen by a real notation parser.
///
/// @param direction layout direction such as `TD`, may be null for notations without one
/// @param nodeIds node identifiers in parser order, never null
/// @param edgeCount number of edges the parser found
public record DiagramStructure(String direction, List<String> nodeIds, int edgeCount) {

    public DiagramStructure {
        nodeIds = nodeIds != null ? List.copyOf(nodeIds) : List.of();
        if (edgeCount < 0) {
            throw new IllegalArgumentException("edgeCount must not be negative");
        }
    }

    public int nodeCount() {
        return nodeIds.size();
    }
}
