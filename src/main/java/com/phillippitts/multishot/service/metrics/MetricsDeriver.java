package com.phillippitts.multishot.service.metrics;

import com.phillippitts.multishot.domain.EngineResponse;
import com.phillippitts.multishot.domain.TokenUsage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a run's responses into a {@link PerformanceRecord}.
 *
 * <p>All methods are pure: the same inputs always produce an equal record. Scores are
 * heuristics and intentionally cheap; both are clamped to the 1-10 range.
 */
public final class MetricsDeriver {

    static final double MIN_SCORE = 1;
    static final double MAX_SCORE = 10;

    private static final List<String> COMPLEX_KEYWORDS = List.of(
            "architecture", "design", "implement", "system", "algorithm",
            "optimization", "performance", "scalability", "security",
            "integration", "analysis", "strategy", "framework");

    private static final Map<String, Double> MODEL_PRIOR = Map.of(
            "gpt-4o", 2.0,
            "gpt-4o-mini", 1.0,
            "claude-sonnet", 2.0,
            "tinyllama", -1.0);

    private MetricsDeriver() {
    }

    public static PerformanceRecord derive(String runId, Instant timestamp, String prompt,
                                           Map<String, EngineResponse> results, long totalTimeMs,
                                           RunContext context) {
        List<ModelPerformance> perEngine = new ArrayList<>(results.size());
        double totalCost = 0;
        double qualitySum = 0;
        int successes = 0;

        for (Map.Entry<String, EngineResponse> e : results.entrySet()) {
            String engineName = e.getKey();
            EngineResponse r = e.getValue();
            double cost = cost(engineName, r);
            Double quality = r.isSuccess() ? qualityScore(engineName, r) : null;
            totalCost += cost;
            if (r.isSuccess()) {
                successes++;
                qualitySum += quality;
            }
            perEngine.add(new ModelPerformance(engineName, r.model(), r.executionTimeMs(), r.tokenUsage(),
                    cost, quality, r.isSuccess(), r.error(), r.timestamp()));
        }

        double successRate = results.isEmpty() ? 0 : (double) successes / results.size();
        Double avgQuality = successes == 0 ? null : qualitySum / successes;
        return new PerformanceRecord(runId, timestamp, prompt, perEngine, totalCost, Math.max(0, totalTimeMs),
                successRate, avgQuality, taskComplexity(prompt), context);
    }

    /**
     * Estimated USD cost of one response. Uses reported token usage when present,
     * otherwise the response length.
     */
    public static double cost(String engineName, EngineResponse response) {
        TokenUsage usage = response.tokenUsage();
        if (usage != null) {
            return PricingTable.cost(engineName, usage.promptTokens(), usage.completionTokens());
        }
        return PricingTable.estimate(engineName, response.content().length());
    }

    /**
     * Heuristic quality of a successful response: length band, latency band, model prior,
     * and small bonuses for code fences, lists and long answers.
     */
    public static double qualityScore(String engineName, EngineResponse response) {
        String content = response.content();
        int length = content.length();
        long ms = response.executionTimeMs();

        double score = 5;
        if (length > 100 && length < 5000) {
            score += 1;
        } else if (length < 50) {
            score -= 1;
        }
        if (ms > 1000 && ms < 30_000) {
            score += 1;
        } else if (ms > 60_000) {
            score -= 1;
        }
        score += MODEL_PRIOR.getOrDefault(engineName.toLowerCase(Locale.ROOT), 0.0);
        if (content.contains("```")) {
            score += 0.5;
        }
        if (content.contains("\n-") || content.contains("\n*")) {
            score += 0.5;
        }
        if (length > 500) {
            score += 0.5;
        }
        return clamp(score);
    }

    /**
     * Heuristic complexity of a prompt: length bands, domain keywords (at most 3 count),
     * many questions, and multi-part markers.
     */
    public static int taskComplexity(String prompt) {
        if (prompt == null) {
            return (int) MIN_SCORE;
        }
        int complexity = 3;
        if (prompt.length() > 500) {
            complexity++;
        }
        if (prompt.length() > 1000) {
            complexity++;
        }
        String lower = prompt.toLowerCase(Locale.ROOT);
        long hits = COMPLEX_KEYWORDS.stream().filter(lower::contains).count();
        complexity += (int) Math.min(3, hits);

        long questions = prompt.chars().filter(c -> c == '?').count();
        if (questions > 2) {
            complexity++;
        }
        if (prompt.contains("1)") || prompt.contains("a)") || prompt.contains("first")) {
            complexity += 2;
        }
        return (int) clamp(complexity);
    }

    private static double clamp(double v) {
        return Math.min(MAX_SCORE, Math.max(MIN_SCORE, v));
    }
}
