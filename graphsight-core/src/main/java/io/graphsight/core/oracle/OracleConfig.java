package io.graphsight.core.oracle;

import java.util.Objects;

/// Model settings used when an {@link io.graphsight.core.oracle.spi.OracleProvider}
/// builds a {@link VisionOracle}.
///
/// Immutable; use {@link #builder()} to construct. Unset numeric options are left to the
/// provider's defaults.
public final class OracleConfig {

    private final String model;
    private final Double temperature;
    private final Integer maxTokens;
    private final Long timeoutSeconds;

    private OracleConfig(Builder builder) {
        this.model = Objects.requireNonNull(builder.model, "model must not be null");
        this.temperature = builder.temperature;
        this.maxTokens = builder.maxTokens;
        this.timeoutSeconds = builder.timeoutSeconds;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static OracleConfig forModel(String model) {
        return builder().model(model).build();
    }

    public String getModel() {
        return model;
    }

    /// @return sampling temperature, or null for the provider default
    public Double getTemperature() {
        return temperature;
    }

    /// @return completion token limit, or null for the provider default
    public Integer getMaxTokens() {
        return maxTokens;
    }

    /// @return request timeout in seconds, or null for the provider default
    public Long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public static final class Builder {
        private String model;
        private Double temperature;
        private Integer maxTokens;
        private Long timeoutSeconds;

        private Builder() {}

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder timeoutSeconds(Long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public OracleConfig build() {
            return new OracleConfig(this);
        }
    }
}
