package com.phillippitts.multishot.service.metrics;

import com.phillippitts.multishot.domain.TokenUsage;

import java.time.Instant;

/**
 * Derived metrics for one engine's terminal response within a run.
 *
 * @param engine          engine name
 * @param model           backend model identifier
 * @param executionTimeMs call duration
 * @param tokenUsage      reported token usage (nullable)
 * @param cost            estimated cost in USD
 * @param qualityScore    heuristic score 1-10, null for failed responses
 * @param success         whether the response carried no error
 * @param error           error text of a failed response (nullable)
 * @param timestamp       when the response was produced
 */
public record ModelPerformance(
        String engine,
        String model,
        long executionTimeMs,
        TokenUsage tokenUsage,
        double cost,
        Double qualityScore,
        boolean success,
        String error,
        Instant timestamp
) {
    /**
     * Label used to group statistics across runs, e.g. {@code "gpt-4o (gpt-4o)"}.
     */
    public String label() {
        return model + " (" + engine + ")";
    }
}
