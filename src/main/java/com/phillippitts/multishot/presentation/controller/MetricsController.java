package com.phillippitts.multishot.presentation.controller;

import com.phillippitts.multishot.service.metrics.PerformanceRecord;
import com.phillippitts.multishot.service.metrics.PerformanceTracker;
import com.phillippitts.multishot.service.runner.MultiShotService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Read-only views over recorded run performance.
 */
@RestController
@RequestMapping("/api/metrics")
class MetricsController {

    static final Duration DEFAULT_WINDOW = Duration.ofDays(30);

    private final PerformanceTracker tracker;

    MetricsController(MultiShotService service) {
        this.tracker = service.getPerformanceTracker();
    }

    /**
     * Summary, cost analysis, quality insights and daily trends for {@code [from, to]}
     * (default: the last 30 days).
     */
    @GetMapping("/summary")
    ResponseEntity<MetricsReport> summary(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        Instant end = to != null ? to : Instant.now();
        Instant start = from != null ? from : end.minus(DEFAULT_WINDOW);

        Map<PerformanceTracker.Metric, PerformanceTracker.Trend> trends = new EnumMap<>(PerformanceTracker.Metric.class);
        for (PerformanceTracker.Metric m : PerformanceTracker.Metric.values()) {
            trends.put(m, tracker.getTrend(m));
        }
        return ResponseEntity.ok(new MetricsReport(
                tracker.getPerformanceSummary(start, end),
                tracker.analyzeCostEfficiency(start, end),
                tracker.getQualityInsights(),
                trends));
    }

    @GetMapping("/runs/{runId}")
    ResponseEntity<PerformanceRecord> run(@PathVariable String runId) {
        return tracker.getRunMetrics(runId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    record MetricsReport(PerformanceTracker.PerformanceSummary summary,
                         PerformanceTracker.CostAnalysis costAnalysis,
                         PerformanceTracker.QualityInsights qualityInsights,
                         Map<PerformanceTracker.Metric, PerformanceTracker.Trend> trends) {}
}
