package com.phillippitts.multishot.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Engine registry configuration.
 *
 * <p>API keys are keyed by vendor ({@code openai}, {@code anthropic}), e.g.
 * {@code multishot.engines.api-keys.openai=${OPENAI_API_KEY:}}.
 */
@ConfigurationProperties(prefix = "multishot.engines")
@Validated
public class EngineProperties {

    /** Engines used when a request names none. */
    @NotEmpty(message = "At least one default engine must be configured")
    private List<String> defaults = new ArrayList<>(List.of("gpt-4o-mini", "claude-haiku"));

    /** Vendor to credential. Blank values count as missing. */
    private Map<String, String> apiKeys = new HashMap<>();

    /** Endpoint of the local model runtime. */
    private String localEndpoint = "http://localhost:11434";

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double temperature = 0.7;

    @Positive
    private int maxTokens = 4000;

    public List<String> getDefaults() {
        return defaults;
    }

    public void setDefaults(List<String> defaults) {
        this.defaults = defaults;
    }

    public Map<String, String> getApiKeys() {
        return apiKeys;
    }

    public void setApiKeys(Map<String, String> apiKeys) {
        this.apiKeys = apiKeys;
    }

    public String getLocalEndpoint() {
        return localEndpoint;
    }

    public void setLocalEndpoint(String localEndpoint) {
        this.localEndpoint = localEndpoint;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }
}
