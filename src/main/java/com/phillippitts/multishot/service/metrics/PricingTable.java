package com.phillippitts.multishot.service.metrics;

import java.util.Locale;
import java.util.Map;

/**
 * Per-engine prices used for cost estimates, in USD per 1K tokens.
 *
 * <p>Engines served locally are free. Unknown engines use {@link #DEFAULT}. When a response
 * carries no token usage its cost is estimated from the response length at 4 characters per
 * token, using a flat per-1K rate.
 */
public final class PricingTable {

    /**
     * Prompt and completion price per 1K tokens, plus the flat rate used for length-based estimates.
     */
    public record Price(double promptPer1k, double completionPer1k, double estimatePer1k) {
        public static final Price FREE = new Price(0, 0, 0);
    }

    public static final Price DEFAULT = new Price(0.001, 0.002, 0.002);

    static final int CHARS_PER_TOKEN = 4;

    private static final Map<String, Price> PRICES = Map.of(
            "gpt-4o", new Price(0.005, 0.015, 0.01),
            "gpt-4o-mini", new Price(0.00015, 0.0006, 0.0003),
            "claude-sonnet", new Price(0.003, 0.015, 0.002),
            "claude-haiku", new Price(0.00025, 0.00125, 0.002),
            "tinyllama", Price.FREE,
            "local", Price.FREE
    );

    private PricingTable() {
    }

    public static Price priceFor(String engineName) {
        return PRICES.getOrDefault(engineName.toLowerCase(Locale.ROOT), DEFAULT);
    }

    /**
     * Cost from reported token counts.
     */
    public static double cost(String engineName, long promptTokens, long completionTokens) {
        Price p = priceFor(engineName);
        return (promptTokens * p.promptPer1k() + completionTokens * p.completionPer1k()) / 1000;
    }

    /**
     * Cost estimated from response length when the backend reported no usage.
     */
    public static double estimate(String engineName, int responseChars) {
        long tokens = (responseChars + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
        return tokens * priceFor(engineName).estimatePer1k() / 1000;
    }
}
