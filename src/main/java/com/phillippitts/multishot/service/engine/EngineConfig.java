package com.phillippitts.multishot.service.engine;

import java.util.Objects;

/**
 * Static configuration of one engine.
 *
 * @param name        engine name used as the results key (e.g. "gpt-4o-mini")
 * @param model       backend model identifier
 * @param apiKey      provider credential (nullable; never logged)
 * @param baseUrl     endpoint for local or custom backends (nullable)
 * @param temperature sampling temperature
 * @param maxTokens   completion token cap
 * @param timeoutMs   backend-side timeout hint passed to the transport (0 = none)
 */
public record EngineConfig(
        String name,
        String model,
        String apiKey,
        String baseUrl,
        double temperature,
        int maxTokens,
        long timeoutMs
) {
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_TOKENS = 4000;

    public EngineConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(model, "model");
        if (maxTokens <= 0) {
            maxTokens = DEFAULT_MAX_TOKENS;
        }
        if (timeoutMs < 0) {
            timeoutMs = 0;
        }
    }

    /**
     * Minimal configuration where the engine name doubles as the model identifier.
     */
    public static EngineConfig of(String name) {
        return new EngineConfig(name, name, null, null, DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS, 0);
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public boolean hasBaseUrl() {
        return baseUrl != null && !baseUrl.isBlank();
    }

    public EngineConfig withApiKey(String key) {
        return new EngineConfig(name, model, key, baseUrl, temperature, maxTokens, timeoutMs);
    }

    public EngineConfig withBaseUrl(String url) {
        return new EngineConfig(name, model, apiKey, url, temperature, maxTokens, timeoutMs);
    }

    public EngineConfig withMaxTokens(int tokens) {
        return new EngineConfig(name, model, apiKey, baseUrl, temperature, tokens, timeoutMs);
    }

    /**
     * Copy without credentials, safe to hand to callers and loggers.
     */
    public EngineConfig sanitized() {
        return apiKey == null ? this : withApiKey(null);
    }

    @Override
    public String toString() {
        return "EngineConfig[name=" + name + ", model=" + model
                + ", apiKey=" + (hasApiKey() ? "****" : "none")
                + ", baseUrl=" + baseUrl + ", temperature=" + temperature
                + ", maxTokens=" + maxTokens + ", timeoutMs=" + timeoutMs + "]";
    }
}
