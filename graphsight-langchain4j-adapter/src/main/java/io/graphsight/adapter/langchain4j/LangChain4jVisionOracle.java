package io.graphsight.adapter.langchain4j;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.Content;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.graphsight.core.graph.DiagramImage;
import io.graphsight.core.oracle.OracleException;
import io.graphsight.core.oracle.OracleRateLimitException;
import io.graphsight.core.oracle.OracleRequest;
import io.graphsight.core.oracle.OracleResponse;
import io.graphsight.core.oracle.OracleTimeoutException;
import io.graphsight.core.oracle.TokenUsage;
import io.graphsight.core.oracle.VisionOracle;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link VisionOracle}.
///
/// Wraps a {@link ChatModel} and sends each request as a single-turn exchange: an
/// optional system message followed by one user message carrying the instructions
/// and, for image requests, the diagram as base64 image content. No conversation
/// state is kept between requests; the traversal supplies its own context.
///
/// ### Failure mapping
/// - provider throttling (`RateLimitException`) → {@link OracleRateLimitException}
/// - timeouts anywhere in the cause chain → {@link OracleTimeoutException}
/// - a missing or empty reply and every other failure → {@link OracleException}
///
/// @implNote Thread-safe if the wrapped model is (LangChain4j's HTTP-backed models are).
///
/// @see LangChain4jOracleProvider for oracle creation
/// @see VisionOracle for the contract
public class LangChain4jVisionOracle implements VisionOracle {

    private static final Logger logger = Logger.getLogger(LangChain4jVisionOracle.class.getName());

    private final String modelName;
    private final ChatModel model;
    private final ModelPricing pricing;

    /// Creates an oracle wrapping the given chat model.
    ///
    /// @param modelName model identifier used for pricing and metadata, not null
    /// @param model the LangChain4j chat model to delegate to, not null
    /// @param pricing price table for cost estimates, not null
    public LangChain4jVisionOracle(String modelName, ChatModel model, ModelPricing pricing) {
        this.modelName = Objects.requireNonNull(modelName, "modelName must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.pricing = Objects.requireNonNull(pricing, "pricing must not be null");
    }

    @Override
    public OracleResponse query(OracleRequest request) throws OracleException {
        Objects.requireNonNull(request, "request must not be null");
        logger.fine("Sending " + request.purpose() + " request to " + modelName);

        ChatResponse response;
        try {
            response = model.chat(buildMessages(request));
        } catch (RateLimitException e) {
            throw new OracleRateLimitException("Rate limited by " + modelName + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            if (isTimeout(e)) {
                throw new OracleTimeoutException("Request to " + modelName + " timed out", e);
            }
            logger.severe("Oracle call to " + modelName + " failed: " + e.getMessage());
            throw new OracleException("Oracle call to " + modelName + " failed: " + e.getMessage(), e);
        }

        if (response == null || response.aiMessage() == null) {
            throw new OracleException("No response from model " + modelName);
        }
        String text = response.aiMessage().text();
        return new OracleResponse(text != null ? text : "", usageOf(response), modelName);
    }

    @Override
    public String modelName() {
        return modelName;
    }

    @Override
    public double estimateCost(TokenUsage usage) {
        return pricing.estimate(modelName, usage);
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    /// Builds the ordered message list: system prompt, then the user turn.
    List<ChatMessage> buildMessages(OracleRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.systemPrompt()));
        }

        List<Content> contents = new ArrayList<>();
        contents.add(TextContent.from(request.instructions()));
        if (request.hasImage()) {
            DiagramImage image = request.image();
            contents.add(ImageContent.from(image.base64(), image.mimeType()));
        }
        messages.add(UserMessage.from(contents));
        return messages;
    }

    private static TokenUsage usageOf(ChatResponse response) {
        if (response.metadata() == null || response.metadata().tokenUsage() == null) {
            return TokenUsage.zero();
        }
        var tokenUsage = response.metadata().tokenUsage();
        long in = tokenUsage.inputTokenCount() != null ? tokenUsage.inputTokenCount() : 0;
        long out = tokenUsage.outputTokenCount() != null ? tokenUsage.outputTokenCount() : 0;
        return new TokenUsage(in, out);
    }

    private static boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException
                    || t instanceof HttpTimeoutException
                    || t instanceof TimeoutException
                    || t.getClass().getSimpleName().equals("TimeoutException")) {
                return true;
            }
        }
        return false;
    }
}
