package com.phillippitts.multishot.domain;

import java.util.Map;
import java.util.Objects;

/**
 * Immutable request dispatched to every engine of a run.
 *
 * <p>Constructed once per run and shared read-only across all engine dispatches.
 *
 * @param prompt       user prompt (must not be blank)
 * @param systemPrompt optional system instruction (nullable)
 * @param metadata     free-form key/value pairs carried alongside the prompt
 */
public record PromptRequest(
        String prompt,
        String systemPrompt,
        Map<String, String> metadata
) {

    /**
     * Compact constructor with validation.
     *
     * @throws NullPointerException if prompt is null
     * @throws IllegalArgumentException if prompt is blank
     */
    public PromptRequest {
        Objects.requireNonNull(prompt, "Prompt must not be null");
        if (prompt.isBlank()) {
            throw new IllegalArgumentException("Prompt must not be blank");
        }
        if (systemPrompt != null && systemPrompt.isBlank()) {
            systemPrompt = null;
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Creates a request with no system prompt and no metadata.
     *
     * @param prompt user prompt
     * @return new request
     */
    public static PromptRequest of(String prompt) {
        return new PromptRequest(prompt, null, Map.of());
    }

    /**
     * Creates a request with a system prompt and no metadata.
     *
     * @param prompt user prompt
     * @param systemPrompt system instruction (nullable)
     * @return new request
     */
    public static PromptRequest of(String prompt, String systemPrompt) {
        return new PromptRequest(prompt, systemPrompt, Map.of());
    }

    public boolean hasSystemPrompt() {
        return systemPrompt != null;
    }
}
