package io.graphsight.adapter.langchain4j;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.graphsight.core.oracle.OracleConfig;
import io.graphsight.core.oracle.OracleFactory;
import io.graphsight.core.oracle.VisionOracle;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LangChain4jOracleProviderTest {

    private final LangChain4jOracleProvider provider = new LangChain4jOracleProvider();

    @Test
    void shouldSupportVisionModelFamilies() {
        assertThat(provider.supportsModel("gpt-4o")).isTrue();
        assertThat(provider.supportsModel("o1-preview")).isTrue();
        assertThat(provider.supportsModel("claude-sonnet-4-20250514")).isTrue();
        assertThat(provider.supportsModel("gemini-2.5-flash")).isTrue();
        assertThat(provider.supportsModel("llama-3")).isFalse();
        assertThat(provider.supportsModel(null)).isFalse();
    }

    @Test
    void shouldCreateOracleForOpenAiModel() {
        VisionOracle oracle =
                provider.createOracle(OracleConfig.forModel("gpt-4o"), Map.of("OPENAI_API_KEY", "sk-test"));

        assertThat(oracle).isInstanceOf(LangChain4jVisionOracle.class);
        assertThat(oracle.modelName()).isEqualTo("gpt-4o");
    }

    @Test
    void shouldPreferLowercaseCredentialName() {
        String key =
                LangChain4jOracleProvider.requireApiKey(
                        Map.of("openai_api_key", "first", "OPENAI_API_KEY", "second"),
                        "openai_api_key",
                        "OPENAI_API_KEY");

        assertThat(key).isEqualTo("first");
    }

    @Test
    void shouldFailWithoutApiKey() {
        assertThatThrownBy(
                        () -> provider.createOracle(OracleConfig.forModel("claude-sonnet-4"), Map.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ANTHROPIC_API_KEY");
    }

    @Test
    void shouldRejectUnsupportedModel() {
        assertThatThrownBy(
                        () -> provider.createModel(OracleConfig.forModel("llama-3"), Map.of("x", "y")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("llama-3");
    }

    @Test
    void shouldBeDiscoveredThroughServiceLoader() {
        OracleFactory factory = new OracleFactory(Map.of("OPENAI_API_KEY", "sk-test"), List.of());

        assertThat(factory.getProviders()).anyMatch(LangChain4jOracleProvider.class::isInstance);
        assertThat(factory.isModelSupported("gpt-4o-mini")).isTrue();
    }
}
