package com.phillippitts.multishot.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Summary of a completed run.
 *
 * <p>{@code success} is true iff at least one engine produced a non-error response.
 * {@code results} preserves the caller-supplied engine order but consumers should treat it as
 * an unordered association. Every terminal failure appears both in {@code results} and in
 * {@code errors}.
 *
 * @param success         at least one engine succeeded
 * @param runId           run identifier
 * @param results         terminal response per engine name
 * @param executionTimeMs total wall-clock time of the run
 * @param errors          flat list of "engine: error" entries plus any sink failure
 * @param outputLocation  where the result sink stored the run (nullable)
 */
public record RunResult(
        boolean success,
        String runId,
        Map<String, EngineResponse> results,
        long executionTimeMs,
        List<String> errors,
        String outputLocation
) {
    public RunResult {
        Objects.requireNonNull(runId, "runId");
        results = results == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(results));
        errors = errors == null ? List.of() : List.copyOf(errors);
        if (executionTimeMs < 0) {
            executionTimeMs = 0;
        }
    }

    public long successCount() {
        return results.values().stream().filter(EngineResponse::isSuccess).count();
    }

    public long failureCount() {
        return results.size() - successCount();
    }
}
