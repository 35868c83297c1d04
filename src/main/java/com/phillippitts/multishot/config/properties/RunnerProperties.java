package com.phillippitts.multishot.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Execution policy applied to runs built from configuration.
 *
 * <p>Properties:
 * <ul>
 *   <li>multishot.runner.concurrent - dispatch through the concurrency gate (default: true)</li>
 *   <li>multishot.runner.max-concurrency - permits held by the gate (default: 5)</li>
 *   <li>multishot.runner.timeout-ms - per-attempt timeout, 0 disables it (default: 60000)</li>
 *   <li>multishot.runner.retries - extra attempts after the first (default: 1)</li>
 *   <li>multishot.runner.continue-on-error - keep going after a terminal failure (default: true)</li>
 *   <li>multishot.runner.retry-base-delay-ms - backoff unit, multiplied by the attempt (default: 1000)</li>
 *   <li>multishot.runner.sequential-delay-ms - pause between sequential dispatches (default: 100)</li>
 *   <li>multishot.runner.max-concurrent-runs - runs the service executes at once (default: 4)</li>
 *   <li>multishot.runner.run-acquire-timeout-ms - wait for a run slot before rejecting (default: 5000)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "multishot.runner")
@Validated
public class RunnerProperties {

    private boolean concurrent = true;

    @Min(value = 1, message = "Max concurrency must be at least 1")
    private int maxConcurrency = 5;

    @PositiveOrZero(message = "Timeout must not be negative")
    private long timeoutMs = 60_000;

    @PositiveOrZero(message = "Retries must not be negative")
    private int retries = 1;

    private boolean continueOnError = true;

    @PositiveOrZero
    private long retryBaseDelayMs = 1000;

    @PositiveOrZero
    private long sequentialDelayMs = 100;

    @Min(value = 1, message = "Max concurrent runs must be at least 1")
    private int maxConcurrentRuns = 4;

    @PositiveOrZero(message = "Run acquire timeout must not be negative")
    private long runAcquireTimeoutMs = 5000;

    public boolean isConcurrent() {
        return concurrent;
    }

    public void setConcurrent(boolean concurrent) {
        this.concurrent = concurrent;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public int getRetries() {
        return retries;
    }

    public void setRetries(int retries) {
        this.retries = retries;
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    public void setContinueOnError(boolean continueOnError) {
        this.continueOnError = continueOnError;
    }

    public long getRetryBaseDelayMs() {
        return retryBaseDelayMs;
    }

    public void setRetryBaseDelayMs(long retryBaseDelayMs) {
        this.retryBaseDelayMs = retryBaseDelayMs;
    }

    public long getSequentialDelayMs() {
        return sequentialDelayMs;
    }

    public void setSequentialDelayMs(long sequentialDelayMs) {
        this.sequentialDelayMs = sequentialDelayMs;
    }

    public int getMaxConcurrentRuns() {
        return maxConcurrentRuns;
    }

    public void setMaxConcurrentRuns(int maxConcurrentRuns) {
        this.maxConcurrentRuns = maxConcurrentRuns;
    }

    public long getRunAcquireTimeoutMs() {
        return runAcquireTimeoutMs;
    }

    public void setRunAcquireTimeoutMs(long runAcquireTimeoutMs) {
        this.runAcquireTimeoutMs = runAcquireTimeoutMs;
    }
}
