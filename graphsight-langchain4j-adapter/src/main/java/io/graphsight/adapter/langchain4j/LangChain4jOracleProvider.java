package io.graphsight.adapter.langchain4j;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.graphsight.core.oracle.OracleConfig;
import io.graphsight.core.oracle.VisionOracle;
import io.graphsight.core.oracle.spi.OracleProvider;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link OracleProvider}.
///
/// Creates vision-capable {@link ChatModel} instances for OpenAI (GPT/o1), Anthropic
/// (Claude) and Google (Gemini) and wraps them in {@link LangChain4jVisionOracle}.
/// Registered through `META-INF/services`, so adding this module to the classpath is
/// enough for {@link io.graphsight.core.oracle.OracleFactory} to find it.
///
/// @implNote Stateless and thread-safe. Each call to {@link #createOracle} creates
/// a new model instance.
///
/// @see LangChain4jVisionOracle for the oracle implementation
/// @see OracleProvider for the provider contract
public class LangChain4jOracleProvider implements OracleProvider {

    private static final Logger logger = Logger.getLogger(LangChain4jOracleProvider.class.getName());

    static final int DEFAULT_MAX_TOKENS = 4096;
    static final long DEFAULT_TIMEOUT_SECONDS = 60;
    static final double DEFAULT_TEMPERATURE = 0.7;

    private final ModelPricing pricing;

    public LangChain4jOracleProvider() {
        this(ModelPricing.defaults());
    }

    public LangChain4jOracleProvider(ModelPricing pricing) {
        this.pricing = Objects.requireNonNull(pricing, "pricing must not be null");
    }

    @Override
    public String getName() {
        return "langchain4j";
    }

    @Override
    public boolean supportsModel(String modelName) {
        if (modelName == null) return false;
        return modelName.startsWith("gpt")
                || modelName.startsWith("o1")
                || modelName.startsWith("claude")
                || modelName.startsWith("gemini");
    }

    @Override
    public VisionOracle createOracle(OracleConfig config, Map<String, String> credentials) {
        logger.info("Creating LangChain4j vision oracle for model: " + config.getModel());
        ChatModel model = createModel(config, credentials);
        return new LangChain4jVisionOracle(config.getModel(), model, pricing);
    }

    @Override
    public int getPriority() {
        return 100;
    }

    /// Creates the appropriate {@link ChatModel} based on model name prefix.
    ///
    /// @param config oracle configuration containing the model name, not null
    /// @param credentials API keys, not null
    /// @return configured chat model, never null
    /// @throws IllegalArgumentException if model name is not supported
    /// @throws IllegalStateException if required API key is missing
    ChatModel createModel(OracleConfig config, Map<String, String> credentials) {
        String modelName = config.getModel();

        if (modelName.startsWith("claude")) {
            return createAnthropicModel(config, credentials);
        } else if (modelName.startsWith("gpt") || modelName.startsWith("o1")) {
            return createOpenAiModel(config, credentials);
        } else if (modelName.startsWith("gemini")) {
            return createGoogleAiModel(config, credentials);
        }

        throw new IllegalArgumentException("Unsupported model: " + modelName);
    }

    private ChatModel createAnthropicModel(OracleConfig config, Map<String, String> credentials) {
        String apiKey = requireApiKey(credentials, "anthropic_api_key", "ANTHROPIC_API_KEY");

        return AnthropicChatModel.builder()
                .apiKey(apiKey)
                .modelName(config.getModel())
                .temperature(getTemperature(config))
                .maxTokens(getMaxTokens(config))
                .timeout(Duration.ofSeconds(getTimeout(config)))
                .build();
    }

    private ChatModel createOpenAiModel(OracleConfig config, Map<String, String> credentials) {
        String apiKey = requireApiKey(credentials, "openai_api_key", "OPENAI_API_KEY");

        return OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(config.getModel())
                .temperature(getTemperature(config))
                .maxTokens(getMaxTokens(config))
                .timeout(Duration.ofSeconds(getTimeout(config)))
                .build();
    }

    private ChatModel createGoogleAiModel(OracleConfig config, Map<String, String> credentials) {
        String apiKey = requireApiKey(credentials, "google_api_key", "GOOGLE_API_KEY");

        return GoogleAiGeminiChatModel.builder()
                .apiKey(apiKey)
                .modelName(config.getModel())
                .temperature(getTemperature(config))
                .maxOutputTokens(getMaxTokens(config))
                .timeout(Duration.ofSeconds(getTimeout(config)))
                .build();
    }

    /// Looks up an API key from credentials, trying each key name in order.
    ///
    /// @param credentials credential map to search, not null
    /// @param keyNames candidate key names in priority order
    /// @return the first non-blank value found, never null
    /// @throws IllegalStateException if no key name resolves to a value
    static String requireApiKey(Map<String, String> credentials, String... keyNames) {
        for (String keyName : keyNames) {
            String value = credentials.get(keyName);
            if (value != null && !value.isBlank()) return value;
        }
        throw new IllegalStateException(
                "API key not found. Provide one of: " + String.join(", ", keyNames));
    }

    private double getTemperature(OracleConfig config) {
        return config.getTemperature() != null ? config.getTemperature() : DEFAULT_TEMPERATURE;
    }

    private int getMaxTokens(OracleConfig config) {
        return config.getMaxTokens() != null ? config.getMaxTokens() : DEFAULT_MAX_TOKENS;
    }

    private long getTimeout(OracleConfig config) {
        return config.getTimeoutSeconds() != null
                ? config.getTimeoutSeconds()
                : DEFAULT_TIMEOUT_SECONDS;
    }
}
