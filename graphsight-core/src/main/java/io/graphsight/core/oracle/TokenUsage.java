package io.graphsight.core.oracle;

/// Token counts reported for one or more oracle calls.
///
/// @param inputTokens prompt tokens, including image tokens, non-negative
/// @param outputTokens completion tokens, non-negative
public record TokenUsage(long inputTokens, long outputTokens) {

    private static final TokenUsage ZERO = new TokenUsage(0, 0);

    public TokenUsage {
        if (inputTokens < 0 || outputTokens < 0) {
            throw new IllegalArgumentException(
                    "token counts must not be negative: " + inputTokens + "/" + outputTokens);
        }
    }

    public static TokenUsage zero() {
        return ZERO;
    }

    public long totalTokens() {
        return inputTokens + outputTokens;
    }

    /// Returns the sum of this usage and another.
    ///
    /// @param other usage to add, may be null (treated as zero)
    /// @return combined usage, never null
    public TokenUsage plus(TokenUsage other) {
        if (other == null) {
            return this;
        }
        return new TokenUsage(inputTokens + other.inputTokens, outputTokens + other.outputTokens);
    }
}
