package io.graphsight.adapter.langchain4j;

import io.graphsight.core.oracle.TokenUsage;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Per-model token prices used to approximate run cost.
///
/// Prices are USD per one million tokens. A model name is matched against the longest
/// registered prefix, so `gpt-4o-mini-2024-07-18` resolves to `gpt-4o-mini` rather
/// than `gpt-4o`. Unknown models cost zero.
///
/// Figures are list prices at the time of writing and only feed the cost budget and
/// the reported approximation.
public final class ModelPricing {

    /// Price of one model family.
    ///
    /// @param inputPerMillion USD per million input tokens, not negative
    /// @param outputPerMillion USD per million output tokens, not negative
    public record Price(double inputPerMillion, double outputPerMillion) {
        public Price {
            if (inputPerMillion < 0 || outputPerMillion < 0) {
                throw new IllegalArgumentException("prices must not be negative");
            }
        }
    }

    private static final double MILLION = 1_000_000.0;

    private final Map<String, Price> prices;

    private ModelPricing(Map<String, Price> prices) {
        this.prices = Map.copyOf(prices);
    }

    /// Returns the built-in table for the model families the provider supports.
    public static ModelPricing defaults() {
        Map<String, Price> table = new LinkedHashMap<>();
        table.put("gpt-4o", new Price(2.50, 10.00));
        table.put("gpt-4o-mini", new Price(0.15, 0.60));
        table.put("gpt-4.1", new Price(2.00, 8.00));
        table.put("gpt-4.1-mini", new Price(0.40, 1.60));
        table.put("o1", new Price(15.00, 60.00));
        table.put("claude-3-5-sonnet", new Price(3.00, 15.00));
        table.put("claude-sonnet-4", new Price(3.00, 15.00));
        table.put("claude-3-5-haiku", new Price(0.80, 4.00));
        table.put("claude-opus-4", new Price(15.00, 75.00));
        table.put("gemini-1.5-pro", new Price(1.25, 5.00));
        table.put("gemini-1.5-flash", new Price(0.075, 0.30));
        table.put("gemini-2.0-flash", new Price(0.10, 0.40));
        table.put("gemini-2.5-pro", new Price(1.25, 10.00));
        table.put("gemini-2.5-flash", new Price(0.30, 2.50));
        return new ModelPricing(table);
    }

    /// Returns a table without any prices; every estimate is zero.
    public static ModelPricing none() {
        return new ModelPricing(Map.of());
    }

    /// Returns a copy of this table with one price added or replaced.
    ///
    /// @param modelPrefix model name prefix, not null
    /// @param price price for matching models, not null
    /// @return new table, never null
    public ModelPricing with(String modelPrefix, Price price) {
        Objects.requireNonNull(modelPrefix, "modelPrefix must not be null");
        Objects.requireNonNull(price, "price must not be null");
        Map<String, Price> table = new LinkedHashMap<>(prices);
        table.put(modelPrefix, price);
        return new ModelPricing(table);
    }

    /// Estimates the USD cost of a call.
    ///
    /// @param modelName model identifier, may be null
    /// @param usage token counts, may be null
    /// @return approximate cost, zero for unknown models
    public double estimate(String modelName, TokenUsage usage) {
        if (modelName == null || usage == null) {
            return 0.0;
        }
        Price price = priceFor(modelName);
        if (price == null) {
            return 0.0;
        }
        return usage.inputTokens() * price.inputPerMillion() / MILLION
                + usage.outputTokens() * price.outputPerMillion() / MILLION;
    }

    /// Finds the price registered under the longest prefix of the model name.
    ///
    /// @param modelName model identifier, not null
    /// @return matching price, or null when none matches
    public Price priceFor(String modelName) {
        String best = null;
        for (String prefix : prices.keySet()) {
            if (modelName.startsWith(prefix) && (best == null || prefix.length() > best.length())) {
                best = prefix;
            }
        }
        return best != null ? prices.get(best) : null;
    }
}
