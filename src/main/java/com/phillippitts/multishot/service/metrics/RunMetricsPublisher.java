package com.phillippitts.multishot.service.metrics;

import com.phillippitts.multishot.domain.EngineResponse;
import com.phillippitts.multishot.domain.RunResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Null-safe front for {@link RunMetrics} used by the runner.
 *
 * <p>Runners built outside Spring (tests, embedded use) get {@link #NOOP}.
 *
 * @see RunMetrics
 */
@Component
public final class RunMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(RunMetricsPublisher.class);

    /**
     * No-op instance: never throws, records nothing, reports disabled.
     */
    public static final RunMetricsPublisher NOOP = new RunMetricsPublisher(null);

    static final String TIMEOUT_MARKER = "timed out after";

    private final RunMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public RunMetricsPublisher(RunMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("RunMetricsPublisher created without metrics (test mode)");
        }
    }

    /**
     * Records an engine's terminal outcome: latency plus a success or categorized failure count.
     */
    public void recordOutcome(EngineResponse response, boolean unexpected) {
        if (metrics == null) {
            return;
        }
        metrics.recordLatency(response.engine(), response.executionTimeMs());
        if (response.isSuccess()) {
            metrics.incrementSuccess(response.engine());
        } else {
            metrics.incrementFailure(response.engine(), failureReason(response, unexpected));
        }
    }

    public void recordRetry(String engineName) {
        if (metrics != null) {
            metrics.incrementRetry(engineName);
        }
    }

    public void recordRun(RunResult result) {
        if (metrics == null) {
            return;
        }
        String outcome;
        if (!result.success()) {
            outcome = "failed";
        } else if (result.failureCount() > 0) {
            outcome = "partial";
        } else {
            outcome = "success";
        }
        metrics.incrementRun(outcome);
    }

    public void recordAbort() {
        if (metrics != null) {
            metrics.incrementRun("aborted");
        }
    }

    public boolean isEnabled() {
        return metrics != null;
    }

    static String failureReason(EngineResponse response, boolean unexpected) {
        if (unexpected) {
            return RunMetrics.REASON_UNEXPECTED;
        }
        String error = response.error();
        if (error != null && error.contains(TIMEOUT_MARKER)) {
            return RunMetrics.REASON_TIMEOUT;
        }
        return RunMetrics.REASON_ENGINE_ERROR;
    }
}
