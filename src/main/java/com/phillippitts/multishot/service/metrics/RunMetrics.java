package com.phillippitts.multishot.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for runs and engine dispatches.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Engine call latency per engine</li>
 *   <li>Success/failure counts per engine, failures tagged by reason</li>
 *   <li>Retry attempts per engine</li>
 *   <li>Run outcomes (success, partial, failed, aborted)</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class RunMetrics {

    private static final String METRIC_PREFIX = "multishot";

    public static final String REASON_TIMEOUT = "timeout";
    public static final String REASON_ENGINE_ERROR = "engine_error";
    public static final String REASON_UNEXPECTED = "unexpected_error";

    private final MeterRegistry registry;

    public RunMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the duration of one engine's terminal outcome.
     *
     * @param engineName engine name
     * @param durationMs duration in milliseconds
     */
    public void recordLatency(String engineName, long durationMs) {
        Timer.builder(METRIC_PREFIX + ".engine.latency")
                .description("Time taken by an engine to produce its terminal response")
                .tag("engine", engineName)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void incrementSuccess(String engineName) {
        Counter.builder(METRIC_PREFIX + ".engine.success")
                .description("Number of successful engine responses")
                .tag("engine", engineName)
                .register(registry)
                .increment();
    }

    /**
     * @param reason one of {@link #REASON_TIMEOUT}, {@link #REASON_ENGINE_ERROR}, {@link #REASON_UNEXPECTED}
     */
    public void incrementFailure(String engineName, String reason) {
        Counter.builder(METRIC_PREFIX + ".engine.failure")
                .description("Number of failed engine responses")
                .tag("engine", engineName)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementRetry(String engineName) {
        Counter.builder(METRIC_PREFIX + ".engine.retry")
                .description("Number of retried engine attempts")
                .tag("engine", engineName)
                .register(registry)
                .increment();
    }

    public void incrementRun(String outcome) {
        Counter.builder(METRIC_PREFIX + ".run")
                .description("Number of runs by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
