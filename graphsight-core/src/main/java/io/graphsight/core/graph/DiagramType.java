package io.graphsight.core.graph;

import java.util.Locale;

/// Diagram families the detector can report.
///
/// Wire names follow the diagram keywords the oracle is asked to answer with.
public enum DiagramType {
    FLOWCHART("flowchart"),
    SEQUENCE("sequenceDiagram"),
    STATE("stateDiagram"),
    CLASS("classDiagram"),
    ER("erDiagram"),
    UNKNOWN("unknown");

    private final String wireName;

    DiagramType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /// Resolves a wire name or enum name, case-insensitively.
    ///
    /// Accepts the common aliases the oracle produces (`graph`, `sequence`, `state`,
    /// `stateDiagram-v2`, `class`, `er`).
    ///
    /// @param value name reported by the oracle, may be null
    /// @return matching type, or {@link #UNKNOWN} when unrecognized
    public static DiagramType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DiagramType type : values()) {
            if (type.wireName.toLowerCase(Locale.ROOT).equals(normalized)
                    || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        return switch (normalized) {
            case "graph", "flow" -> FLOWCHART;
            case "sequence" -> SEQUENCE;
            case "state", "statediagram-v2" -> STATE;
            case "class" -> CLASS;
            case "er", "entity-relationship" -> ER;
            default -> UNKNOWN;
        };
    }
}
