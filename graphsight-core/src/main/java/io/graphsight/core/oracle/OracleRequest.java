package io.graphsight.core.oracle;

import io.graphsight.core.context.ContextPayload;
import io.graphsight.core.graph.BoundingBox;
import io.graphsight.core.graph.DiagramImage;
import java.util.Objects;

/// One question put to the vision oracle.
///
/// The instructions already contain everything the oracle should read, including the
/// rendered history context. The structured {@link ContextPayload} travels alongside so
/// that transports and test oracles can inspect it without parsing prompt text.
///
/// @param purpose what the request asks for, not null
/// @param image diagram to look at, null for text-only requests such as refinement
/// @param region area of the image the request concentrates on, may be null
/// @param systemPrompt role instructions, never null (may be empty)
/// @param instructions task instructions, not null
/// @param context structured history context, may be null
public record OracleRequest(
        RequestPurpose purpose,
        DiagramImage image,
        BoundingBox region,
        String systemPrompt,
        String instructions,
        ContextPayload context) {

    public OracleRequest {
        Objects.requireNonNull(purpose, "purpose must not be null");
        Objects.requireNonNull(instructions, "instructions must not be null");
        systemPrompt = systemPrompt != null ? systemPrompt : "";
    }

    /// Creates a request about a whole image.
    public static OracleRequest of(
            RequestPurpose purpose, DiagramImage image, String systemPrompt, String instructions) {
        return new OracleRequest(purpose, image, null, systemPrompt, instructions, null);
    }

    /// Creates a text-only request.
    public static OracleRequest textOnly(
            RequestPurpose purpose, String systemPrompt, String instructions) {
        return new OracleRequest(purpose, null, null, systemPrompt, instructions, null);
    }

    public boolean hasImage() {
        return image != null;
    }

    /// Returns a copy with a clarifying note appended to the instructions.
    ///
    /// @param clarification what was wrong with the previous reply, not null
    /// @return new request, never null
    public OracleRequest withClarification(String clarification) {
        String amended =
                instructions
                        + "\n\nYour previous reply could not be used: "
                        + clarification
                        + "\nReply again following the required format exactly.";
        return new OracleRequest(purpose, image, region, systemPrompt, amended, context);
    }
}
