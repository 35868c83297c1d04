package com.phillippitts.multishot.service.metrics;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Performance, cost and quality summary of one run.
 *
 * @param runId           run identifier
 * @param timestamp       when the record was derived
 * @param prompt          user prompt of the run
 * @param perEngine       one entry per engine with a terminal response, in result order
 * @param totalCost       sum of per-engine costs (USD)
 * @param totalTimeMs     wall-clock duration of the run
 * @param successRate     successful responses / responses, 0 when there are none
 * @param avgQualityScore mean quality of successful responses, null when none succeeded
 * @param taskComplexity  heuristic prompt complexity 1-10
 * @param context         execution policy of the run
 */
public record PerformanceRecord(
        String runId,
        Instant timestamp,
        String prompt,
        List<ModelPerformance> perEngine,
        double totalCost,
        long totalTimeMs,
        double successRate,
        Double avgQualityScore,
        int taskComplexity,
        RunContext context
) {
    public PerformanceRecord {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(timestamp, "timestamp");
        perEngine = perEngine == null ? List.of() : List.copyOf(perEngine);
    }
}
