package com.phillippitts.multishot.service.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * In-memory history of performance records with aggregate views.
 *
 * <p>Records are append-only and keyed by run id. When an archive is configured each record is
 * also written to disk, and {@link #loadHistory()} reads earlier records back.
 *
 * <p><b>Thread Safety:</b> All public methods are synchronized on the tracker.
 */
public class PerformanceTracker {

    private static final Logger LOG = LogManager.getLogger(PerformanceTracker.class);

    /** Estimated cost of one run on a large hosted model, used as the savings baseline. */
    static final double BASELINE_COST_PER_RUN = 0.008;
    static final double HIGH_COST_PER_REQUEST = 0.01;
    static final double STABLE_BAND_PERCENT = 5.0;
    static final int TOP_MODELS = 5;

    public enum Metric { COST, RESPONSE_TIME, QUALITY_SCORE, SUCCESS_RATE }

    public enum Direction { IMPROVING, DECLINING, STABLE }

    public record ModelUsage(String model, int usage, double avgScore) {}

    public record PerformanceSummary(int totalRuns, double totalCost, double avgResponseTimeMs,
                                     double avgQualityScore, double successRate, List<ModelUsage> topModels) {}

    public record CostAnalysis(double totalSpent, Map<String, Double> costByModel, double avgCostPerRequest,
                               double costSavingsVsBaseline, double projectedMonthlyCost,
                               List<String> recommendations) {}

    public record QualityInsights(Map<String, Double> avgQualityByModel, List<String> recommendations) {}

    public record DataPoint(Instant timestamp, double value) {}

    public record Trend(Metric metric, Direction direction, double changePercentage, List<DataPoint> dataPoints) {}

    private final Map<String, PerformanceRecord> records = new LinkedHashMap<>();
    private final PerformanceArchive archive;
    private final Clock clock;

    public PerformanceTracker() {
        this(null, Clock.systemUTC());
    }

    /**
     * @param archive optional on-disk archive (nullable)
     * @param clock   time source for windows and projections
     */
    public PerformanceTracker(PerformanceArchive archive, Clock clock) {
        this.archive = archive;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized void record(PerformanceRecord record) {
        Objects.requireNonNull(record, "record");
        records.put(record.runId(), record);
        LOG.info("Performance recorded: {} ({} engines, {}ms, ${})", record.runId(), record.perEngine().size(),
                record.totalTimeMs(), String.format(Locale.ROOT, "%.4f", record.totalCost()));
        if (archive != null) {
            archive.write(record);
        }
    }

    /**
     * Loads archived records into memory. Records already present are kept.
     *
     * @return number of records added
     */
    public synchronized int loadHistory() {
        if (archive == null) {
            return 0;
        }
        int added = 0;
        for (PerformanceRecord r : archive.readAll()) {
            if (records.putIfAbsent(r.runId(), r) == null) {
                added++;
            }
        }
        LOG.info("Loaded {} archived performance record(s)", added);
        return added;
    }

    public synchronized Optional<PerformanceRecord> getRunMetrics(String runId) {
        return Optional.ofNullable(records.get(runId));
    }

    public synchronized int size() {
        return records.size();
    }

    /**
     * Aggregates runs whose timestamp lies in {@code [from, to]}.
     */
    public synchronized PerformanceSummary getPerformanceSummary(Instant from, Instant to) {
        List<PerformanceRecord> runs = inRange(from, to);
        if (runs.isEmpty()) {
            return new PerformanceSummary(0, 0, 0, 0, 0, List.of());
        }
        double totalCost = runs.stream().mapToDouble(PerformanceRecord::totalCost).sum();
        double avgTime = runs.stream().mapToLong(PerformanceRecord::totalTimeMs).average().orElse(0);
        double avgQuality = runs.stream().map(PerformanceRecord::avgQualityScore)
                .filter(Objects::nonNull).mapToDouble(Double::doubleValue).average().orElse(0);
        double successRate = (double) runs.stream().filter(r -> r.successRate() > 0).count() / runs.size();

        Map<String, List<ModelPerformance>> byModel = groupByLabel(runs);
        List<ModelUsage> top = byModel.entrySet().stream()
                .map(e -> new ModelUsage(e.getKey(), e.getValue().size(), averageQuality(e.getValue())))
                .sorted(Comparator.comparingInt(ModelUsage::usage).reversed())
                .limit(TOP_MODELS)
                .collect(Collectors.toList());
        return new PerformanceSummary(runs.size(), totalCost, avgTime, avgQuality, successRate, top);
    }

    /**
     * Cost breakdown and recommendations for runs in {@code [from, to]}; null bounds mean all runs.
     */
    public synchronized CostAnalysis analyzeCostEfficiency(Instant from, Instant to) {
        List<PerformanceRecord> runs = inRange(from, to);
        if (runs.isEmpty()) {
            return new CostAnalysis(0, Map.of(), 0, 0, 0, List.of("No data available for analysis"));
        }
        double totalSpent = runs.stream().mapToDouble(PerformanceRecord::totalCost).sum();
        Map<String, Double> costByModel = new LinkedHashMap<>();
        for (PerformanceRecord run : runs) {
            for (ModelPerformance m : run.perEngine()) {
                costByModel.merge(m.label(), m.cost(), Double::sum);
            }
        }
        double avgCost = totalSpent / runs.size();
        double savings = Math.max(0, runs.size() * BASELINE_COST_PER_RUN - totalSpent);

        Instant earliest = runs.stream().map(PerformanceRecord::timestamp).min(Comparator.naturalOrder()).orElseThrow();
        double days = Math.max(1.0, Duration.between(earliest, clock.instant()).toMillis() / 86_400_000.0);
        double projectedMonthly = totalSpent / days * 30;

        double localCost = costByModel.entrySet().stream()
                .filter(e -> e.getKey().contains("tinyllama") || e.getKey().contains("local"))
                .mapToDouble(Map.Entry::getValue).sum();
        double cloudCost = totalSpent - localCost;

        List<String> recommendations = new ArrayList<>();
        if (cloudCost > localCost * 5) {
            recommendations.add("Consider using local models more frequently for simple tasks");
        }
        if (avgCost > HIGH_COST_PER_REQUEST) {
            recommendations.add("Average cost per request is high - review model selection strategy");
        }
        if (savings > 0) {
            recommendations.add(String.format(Locale.ROOT,
                    "Saving $%.4f compared to running every request on a large hosted model", savings));
        }
        return new CostAnalysis(totalSpent, costByModel, avgCost, savings, projectedMonthly, recommendations);
    }

    public synchronized QualityInsights getQualityInsights() {
        Map<String, Double> avgByModel = new LinkedHashMap<>();
        groupByLabel(records.values()).forEach((label, perf) -> {
            List<ModelPerformance> scored = perf.stream().filter(m -> m.qualityScore() != null).toList();
            if (!scored.isEmpty()) {
                avgByModel.put(label, averageQuality(scored));
            }
        });

        List<String> recommendations = new ArrayList<>();
        if (!avgByModel.isEmpty()) {
            Map.Entry<String, Double> best = avgByModel.entrySet().stream().max(Map.Entry.comparingByValue()).orElseThrow();
            Map.Entry<String, Double> worst = avgByModel.entrySet().stream().min(Map.Entry.comparingByValue()).orElseThrow();
            if (best.getValue() - worst.getValue() > 2) {
                recommendations.add(String.format(Locale.ROOT, "Consider using %s more often (avg quality: %.1f)",
                        best.getKey(), best.getValue()));
            }
            if (worst.getValue() < 6) {
                recommendations.add(String.format(Locale.ROOT,
                        "%s shows low quality scores (avg: %.1f) - review its usage", worst.getKey(), worst.getValue()));
            }
        }
        return new QualityInsights(avgByModel, recommendations);
    }

    /**
     * Direction of a metric over the last 24 hours, comparing the oldest and newest data point.
     * Changes within 5% are stable; rising cost or response time counts as declining.
     */
    public synchronized Trend getTrend(Metric metric) {
        Instant dayAgo = clock.instant().minus(Duration.ofDays(1));
        Function<PerformanceRecord, Double> extractor = extractor(metric);
        List<DataPoint> points = records.values().stream()
                .filter(r -> !r.timestamp().isBefore(dayAgo))
                .filter(r -> extractor.apply(r) != null)
                .map(r -> new DataPoint(r.timestamp(), extractor.apply(r)))
                .sorted(Comparator.comparing(DataPoint::timestamp))
                .collect(Collectors.toList());
        if (points.size() < 2) {
            return new Trend(metric, Direction.STABLE, 0, points);
        }
        double first = points.get(0).value();
        double last = points.get(points.size() - 1).value();
        double change;
        if (first == 0) {
            change = last == 0 ? 0 : 100;
        } else {
            change = (last - first) / first * 100;
        }

        Direction direction;
        if (Math.abs(change) < STABLE_BAND_PERCENT) {
            direction = Direction.STABLE;
        } else if ((change > 0) != lowerIsBetter(metric)) {
            direction = Direction.IMPROVING;
        } else {
            direction = Direction.DECLINING;
        }
        return new Trend(metric, direction, change, points);
    }

    /**
     * One CSV line per run with a header row. A run without a quality score has an empty
     * {@code avgQualityScore} cell.
     */
    public synchronized String exportCsv() {
        StringBuilder sb = new StringBuilder("runId,timestamp,totalCost,totalTimeMs,successRate,avgQualityScore,engineCount\n");
        for (PerformanceRecord r : records.values()) {
            sb.append(r.runId()).append(',')
                    .append(r.timestamp()).append(',')
                    .append(r.totalCost()).append(',')
                    .append(r.totalTimeMs()).append(',')
                    .append(r.successRate()).append(',')
                    .append(r.avgQualityScore() == null ? "" : String.valueOf(r.avgQualityScore())).append(',')
                    .append(r.perEngine().size()).append('\n');
        }
        return sb.toString();
    }

    private List<PerformanceRecord> inRange(Instant from, Instant to) {
        return records.values().stream()
                .filter(r -> from == null || !r.timestamp().isBefore(from))
                .filter(r -> to == null || !r.timestamp().isAfter(to))
                .collect(Collectors.toList());
    }

    private static Map<String, List<ModelPerformance>> groupByLabel(Iterable<PerformanceRecord> runs) {
        Map<String, List<ModelPerformance>> byLabel = new LinkedHashMap<>();
        for (PerformanceRecord run : runs) {
            for (ModelPerformance m : run.perEngine()) {
                byLabel.computeIfAbsent(m.label(), k -> new ArrayList<>()).add(m);
            }
        }
        return byLabel;
    }

    private static double averageQuality(List<ModelPerformance> perf) {
        return perf.stream().map(ModelPerformance::qualityScore).filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue).average().orElse(0);
    }

    private static boolean lowerIsBetter(Metric metric) {
        return metric == Metric.COST || metric == Metric.RESPONSE_TIME;
    }

    private static Function<PerformanceRecord, Double> extractor(Metric metric) {
        return switch (metric) {
            case COST -> PerformanceRecord::totalCost;
            case RESPONSE_TIME -> r -> (double) r.totalTimeMs();
            case QUALITY_SCORE -> PerformanceRecord::avgQualityScore;
            case SUCCESS_RATE -> PerformanceRecord::successRate;
        };
    }
}
