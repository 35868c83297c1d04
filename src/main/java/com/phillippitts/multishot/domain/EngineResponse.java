package com.phillippitts.multishot.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Terminal or intermediate outcome of a single engine call.
 *
 * <p>Exactly one of {@code content} (success) or {@code error} (failure) is meaningful.
 * A failed response carries empty content. {@code executionTimeMs} is always set and is
 * never negative (0 for failures detected before the backend was reached).
 *
 * @param content         generated text (empty on failure)
 * @param model           backend model identifier
 * @param engine          engine name that produced the response
 * @param timestamp       when the response was produced
 * @param executionTimeMs wall-clock duration of the call in milliseconds
 * @param tokenUsage      token accounting if the backend reported it (nullable)
 * @param error           failure description (null on success)
 */
public record EngineResponse(
        String content,
        String model,
        String engine,
        Instant timestamp,
        long executionTimeMs,
        TokenUsage tokenUsage,
        String error
) {

    public EngineResponse {
        content = content == null ? "" : content;
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(engine, "engine");
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        if (executionTimeMs < 0) {
            executionTimeMs = 0;
        }
    }

    public static EngineResponse success(String content, String model, String engine,
                                         long executionTimeMs, TokenUsage tokenUsage) {
        return new EngineResponse(content, model, engine, Instant.now(), executionTimeMs, tokenUsage, null);
    }

    public static EngineResponse failure(String error, String model, String engine, long executionTimeMs) {
        Objects.requireNonNull(error, "error");
        return new EngineResponse("", model, engine, Instant.now(), executionTimeMs, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean hasTokenUsage() {
        return tokenUsage != null;
    }
}
