package io.graphsight.core.graph;

import java.util.Locale;

/// Target representation of an interpretation.
public enum OutputFormat {
    /// Mermaid diagram code.
    MERMAID,
    /// Plain-language narrative of the graph.
    NATURAL_LANGUAGE;

    /// Parses a format name such as `mermaid` or `natural-language`.
    ///
    /// @param value format name, not null
    /// @return the format, never null
    /// @throws IllegalArgumentException if the name is unknown
    public static OutputFormat fromName(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if (normalized.equals("NL") || normalized.equals("TEXT")) {
            return NATURAL_LANGUAGE;
        }
        return OutputFormat.valueOf(normalized);
    }
}
