package com.phillippitts.multishot.service.runner;

import com.phillippitts.multishot.service.engine.Engine;
import com.phillippitts.multishot.service.output.NoopResultSink;
import com.phillippitts.multishot.service.output.ResultSink;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable execution policy and engine set of a run.
 *
 * <p>Defaults: concurrent, at most 5 engines at once, 60s per attempt, 1 retry, continue on
 * error, 1s backoff unit, 100ms between sequential dispatches, no output.
 *
 * <pre>{@code
 * RunConfig config = RunConfig.builder()
 *         .engine(gpt)
 *         .engine(haiku)
 *         .maxConcurrency(2)
 *         .timeoutMs(30_000)
 *         .build();
 * }</pre>
 */
public final class RunConfig {

    public static final int DEFAULT_MAX_CONCURRENCY = 5;
    public static final long DEFAULT_TIMEOUT_MS = 60_000;
    public static final int DEFAULT_RETRIES = 1;
    public static final long DEFAULT_RETRY_BASE_DELAY_MS = 1000;
    public static final long DEFAULT_SEQUENTIAL_DELAY_MS = 100;

    private final Map<String, Engine> engines;
    private final boolean concurrent;
    private final int maxConcurrency;
    private final long timeoutMs;
    private final int retries;
    private final long retryBaseDelayMs;
    private final long sequentialDelayMs;
    private final boolean continueOnError;
    private final ResultSink sink;

    private RunConfig(Builder b) {
        this.engines = Collections.unmodifiableMap(new LinkedHashMap<>(b.engines));
        this.concurrent = b.concurrent;
        this.maxConcurrency = b.maxConcurrency;
        this.timeoutMs = b.timeoutMs;
        this.retries = b.retries;
        this.retryBaseDelayMs = b.retryBaseDelayMs;
        this.sequentialDelayMs = b.sequentialDelayMs;
        this.continueOnError = b.continueOnError;
        this.sink = b.sink;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Engines keyed by name, in caller order.
     */
    public Map<String, Engine> engines() {
        return engines;
    }

    public List<String> engineNames() {
        return List.copyOf(engines.keySet());
    }

    public boolean concurrent() {
        return concurrent;
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    /**
     * Per-attempt timeout; 0 waits indefinitely.
     */
    public long timeoutMs() {
        return timeoutMs;
    }

    public int retries() {
        return retries;
    }

    public long retryBaseDelayMs() {
        return retryBaseDelayMs;
    }

    public long sequentialDelayMs() {
        return sequentialDelayMs;
    }

    public boolean continueOnError() {
        return continueOnError;
    }

    public ResultSink sink() {
        return sink;
    }

    /**
     * Multi-line description of the configuration, suitable for logs and dry runs.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Engines (").append(engines.size()).append("):\n");
        engines.values().forEach(e -> sb.append("  - ").append(e.getDisplayName()).append('\n'));
        sb.append("Mode: ").append(concurrent ? "concurrent (max " + maxConcurrency + ")" : "sequential").append('\n');
        sb.append("Timeout: ").append(timeoutMs == 0 ? "none" : timeoutMs + "ms").append('\n');
        sb.append("Retries: ").append(retries).append(" (backoff ").append(retryBaseDelayMs).append("ms x attempt)\n");
        sb.append("Continue on error: ").append(continueOnError ? "yes" : "no").append('\n');
        sb.append("Output: ").append(sink);
        return sb.toString();
    }

    @Override
    public String toString() {
        return "RunConfig[engines=" + engines.keySet() + ", concurrent=" + concurrent
                + ", maxConcurrency=" + maxConcurrency + ", timeoutMs=" + timeoutMs
                + ", retries=" + retries + ", continueOnError=" + continueOnError + "]";
    }

    public static final class Builder {
        private final Map<String, Engine> engines = new LinkedHashMap<>();
        private boolean concurrent = true;
        private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;
        private long timeoutMs = DEFAULT_TIMEOUT_MS;
        private int retries = DEFAULT_RETRIES;
        private long retryBaseDelayMs = DEFAULT_RETRY_BASE_DELAY_MS;
        private long sequentialDelayMs = DEFAULT_SEQUENTIAL_DELAY_MS;
        private boolean continueOnError = true;
        private ResultSink sink = NoopResultSink.INSTANCE;

        private Builder() {
        }

        /**
         * Adds an engine under its own name. A second engine with the same name replaces the first.
         */
        public Builder engine(Engine engine) {
            Objects.requireNonNull(engine, "engine");
            engines.put(engine.getName(), engine);
            return this;
        }

        public Builder engines(Map<String, Engine> engines) {
            this.engines.putAll(engines);
            return this;
        }

        public Builder concurrent(boolean concurrent) {
            this.concurrent = concurrent;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder retryBaseDelayMs(long retryBaseDelayMs) {
            this.retryBaseDelayMs = retryBaseDelayMs;
            return this;
        }

        public Builder sequentialDelayMs(long sequentialDelayMs) {
            this.sequentialDelayMs = sequentialDelayMs;
            return this;
        }

        public Builder continueOnError(boolean continueOnError) {
            this.continueOnError = continueOnError;
            return this;
        }

        public Builder sink(ResultSink sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        /**
         * @throws IllegalArgumentException if no engine was added or a policy value is out of range
         */
        public RunConfig build() {
            if (engines.isEmpty()) {
                throw new IllegalArgumentException("At least one engine is required");
            }
            if (maxConcurrency < 1) {
                throw new IllegalArgumentException("maxConcurrency must be >= 1, got " + maxConcurrency);
            }
            if (timeoutMs < 0 || retries < 0 || retryBaseDelayMs < 0 || sequentialDelayMs < 0) {
                throw new IllegalArgumentException("timeout, retries and delays must not be negative");
            }
            return new RunConfig(this);
        }
    }
}
