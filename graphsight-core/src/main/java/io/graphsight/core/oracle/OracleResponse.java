package io.graphsight.core.oracle;

import java.util.Objects;

/// Raw reply of the vision oracle.
///
/// @param content reply text, never null (may be empty)
/// @param usage tokens consumed by the call, never null
/// @param modelName model that answered, never null
public record OracleResponse(String content, TokenUsage usage, String modelName) {

    public OracleResponse {
        content = content != null ? content : "";
        usage = usage != null ? usage : TokenUsage.zero();
        modelName = Objects.requireNonNullElse(modelName, "unknown");
    }

    public static OracleResponse of(String content) {
        return new OracleResponse(content, TokenUsage.zero(), null);
    }

    public boolean isBlank() {
        return content.isBlank();
    }
}
