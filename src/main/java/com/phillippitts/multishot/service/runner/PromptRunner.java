package com.phillippitts.multishot.service.runner;

import com.phillippitts.multishot.domain.EngineResponse;
import com.phillippitts.multishot.domain.PromptRequest;
import com.phillippitts.multishot.domain.RunResult;
import com.phillippitts.multishot.exception.RunAbortedException;
import com.phillippitts.multishot.service.engine.Engine;
import com.phillippitts.multishot.service.metrics.MetricsDeriver;
import com.phillippitts.multishot.service.metrics.PerformanceRecord;
import com.phillippitts.multishot.service.metrics.PerformanceTracker;
import com.phillippitts.multishot.service.metrics.RunContext;
import com.phillippitts.multishot.service.metrics.RunMetricsPublisher;
import com.phillippitts.multishot.service.output.SinkReceipt;
import com.phillippitts.multishot.service.runner.event.ProgressUpdate;
import com.phillippitts.multishot.util.LogSanitizer;
import com.phillippitts.multishot.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Executes one prompt against every engine of a {@link RunConfig}.
 *
 * <p>Each engine gets its own dispatch that walks this state machine:
 * <pre>
 * PENDING -> RUNNING -> SUCCESS
 *                    -> FAILED | TIMED_OUT -> RETRYING -> RUNNING   (attempts left)
 *                                          -> terminal failure      (attempts exhausted)
 * </pre>
 *
 * <p><b>Concurrent mode:</b> dispatches run on {@code dispatchExecutor} and are admitted by the
 * runner's {@link ConcurrencyGate}, so at most {@code maxConcurrency} engines are in flight.
 * The permit is held across all attempts of an engine and released in a {@code finally} block.
 *
 * <p><b>Sequential mode:</b> dispatches run on the calling thread in caller order with
 * {@code sequentialDelayMs} between them; the gate is not used.
 *
 * <p><b>Timeouts:</b> every attempt runs on {@code engineCallExecutor}; the dispatch waits at
 * most {@code timeoutMs} and then cancels the call with interruption. A transport that ignores
 * interruption keeps running in the background after the timeout has been recorded.
 *
 * <p><b>Error Handling:</b> engine failures, timeouts and unexpected exceptions all become
 * error-bearing {@link EngineResponse}s; nothing escapes a dispatch. With
 * {@code continueOnError=false} the first terminal failure aborts the run: dispatches that have
 * not started yet are skipped, in-flight ones settle, and {@link #run(PromptRequest)} throws
 * {@link RunAbortedException} with the results gathered so far.
 *
 * <p>A runner owns its gate and may execute several runs, one after another or concurrently;
 * concurrent runs on the same runner share its permits.
 */
public class PromptRunner {

    private static final Logger LOG = LogManager.getLogger(PromptRunner.class);

    static final String MDC_RUN_ID = "runId";
    static final String MDC_ENGINE = "engine";
    private static final int PROMPT_PREVIEW_CHARS = 80;

    private final RunConfig config;
    private final ConcurrencyGate gate;
    private final Executor dispatchExecutor;
    private final Executor engineCallExecutor;
    private final ProgressListener listener;
    private final RunMetricsPublisher metrics;
    private final PerformanceTracker tracker;
    private final Clock clock;

    private PromptRunner(Builder b) {
        this.config = b.config;
        this.gate = new ConcurrencyGate(b.config.maxConcurrency());
        this.dispatchExecutor = b.dispatchExecutor;
        this.engineCallExecutor = b.engineCallExecutor;
        this.listener = b.listener;
        this.metrics = b.metrics;
        this.tracker = b.tracker;
        this.clock = b.clock;
    }

    /**
     * @param config             run configuration
     * @param dispatchExecutor   executor for concurrent dispatches
     * @param engineCallExecutor executor for the engine calls themselves; must not run tasks on the
     *                           submitting thread, or timeouts cannot be enforced
     */
    public static Builder builder(RunConfig config, Executor dispatchExecutor, Executor engineCallExecutor) {
        return new Builder(config, dispatchExecutor, engineCallExecutor);
    }

    /**
     * Runs the prompt against all engines and returns once every engine has a terminal outcome.
     *
     * @param request prompt to execute
     * @return run result; {@code success} is true iff at least one engine succeeded
     * @throws RunAbortedException if {@code continueOnError} is false and an engine failed terminally
     */
    public RunResult run(PromptRequest request) {
        Objects.requireNonNull(request, "request");
        String runId = newRunId();
        boolean ownsRunId = !ThreadContext.containsKey(MDC_RUN_ID);
        ThreadContext.put(MDC_RUN_ID, runId);
        try {
            return execute(runId, request);
        } finally {
            if (ownsRunId) {
                ThreadContext.remove(MDC_RUN_ID);
            }
        }
    }

    private RunResult execute(String runId, PromptRequest request) {
        long t0 = System.nanoTime();
        List<String> engineNames = config.engineNames();
        LOG.info("Run {} started: {} engine(s) {}, {} mode, prompt='{}'", runId, engineNames.size(), engineNames,
                config.concurrent() ? "concurrent" : "sequential", LogSanitizer.preview(request.prompt(), PROMPT_PREVIEW_CHARS));

        List<String> errors = new ArrayList<>();
        boolean sinkReady = initializeSink(errors);

        RunState state = new RunState(runId, engineNames.size());
        if (config.concurrent()) {
            runConcurrently(request, state);
        } else {
            runSequentially(request, state);
        }

        Map<String, EngineResponse> results = ordered(state.results, engineNames);
        long elapsedMs = TimeUtils.elapsedMillis(t0);

        Aborted aborted = state.aborted.get();
        if (aborted != null) {
            metrics.recordAbort();
            LOG.warn("Run {} aborted after {}ms: {} failed ({})", runId, elapsedMs, aborted.engineName(), aborted.error());
            throw new RunAbortedException(aborted.engineName(), aborted.error(), results);
        }

        results.forEach((name, r) -> {
            if (!r.isSuccess()) {
                errors.add(name + ": " + r.error());
            }
        });
        boolean success = results.values().stream().anyMatch(EngineResponse::isSuccess);

        recordPerformance(runId, request, results, elapsedMs);

        String location = null;
        if (sinkReady) {
            location = saveResults(runId, request, engineNames, results, errors);
        }

        RunResult result = new RunResult(success, runId, results, elapsedMs, errors, location);
        metrics.recordRun(result);
        LOG.info("Run {} finished in {}ms: {}/{} succeeded", runId, elapsedMs, result.successCount(), results.size());
        return result;
    }

    private void runConcurrently(PromptRequest request, RunState state) {
        List<CompletableFuture<Void>> futures = new ArrayList<>(config.engines().size());
        for (Engine engine : config.engines().values()) {
            futures.add(CompletableFuture.runAsync(() -> dispatchGated(engine, request, state), dispatchExecutor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Run {} interrupted while waiting for dispatches", state.runId);
            state.abortIfFirst(new Aborted("run", "interrupted"));
        } catch (ExecutionException e) {
            LOG.error("Run {} dispatch failed unexpectedly", state.runId, e.getCause());
        }
    }

    private void runSequentially(PromptRequest request, RunState state) {
        boolean first = true;
        for (Engine engine : config.engines().values()) {
            if (state.aborted.get() != null) {
                break;
            }
            if (!first && config.sequentialDelayMs() > 0 && !sleep(config.sequentialDelayMs())) {
                state.abortIfFirst(new Aborted(engine.getName(), "interrupted"));
                break;
            }
            first = false;
            dispatch(engine, request, state);
        }
    }

    private void dispatchGated(Engine engine, PromptRequest request, RunState state) {
        try {
            gate.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            settle(engine, state, EngineResponse.failure("Interrupted while waiting for a concurrency permit",
                    engine.getConfig().model(), engine.getName(), 0), false);
            return;
        }
        try {
            if (state.aborted.get() != null) {
                LOG.debug("Skipping {}: run {} already aborted", engine.getName(), state.runId);
                return;
            }
            dispatch(engine, request, state);
        } finally {
            gate.release();
        }
    }

    /**
     * Attempt loop for one engine. Never throws.
     */
    private void dispatch(Engine engine, PromptRequest request, RunState state) {
        String name = engine.getName();
        boolean ownsRunId = !ThreadContext.containsKey(MDC_RUN_ID);
        ThreadContext.put(MDC_RUN_ID, state.runId);
        ThreadContext.put(MDC_ENGINE, name);
        try {
            notify(new ProgressUpdate(state.runId, name, ProgressUpdate.Status.STARTED, null, null,
                    state.completed.get(), state.total));
            int maxAttempts = config.retries() + 1;
            for (int attempt = 1; ; attempt++) {
                Attempt outcome = attempt(engine, request);
                EngineResponse response = outcome.response();
                if (response.isSuccess() || attempt >= maxAttempts) {
                    settle(engine, state, response, outcome.unexpected());
                    return;
                }
                if (state.aborted.get() != null) {
                    LOG.debug("{} not retried: run aborted", name);
                    return;
                }
                LOG.info("{} attempt {}/{} failed: {}; retrying", name, attempt, maxAttempts, response.error());
                metrics.recordRetry(name);
                notify(new ProgressUpdate(state.runId, name, ProgressUpdate.Status.RETRYING, null, response.error(),
                        state.completed.get(), state.total));
                if (!sleep(attempt * config.retryBaseDelayMs())) {
                    settle(engine, state, response, outcome.unexpected());
                    return;
                }
            }
        } catch (RuntimeException e) {
            LOG.error("{} dispatch failed unexpectedly", name, e);
            settle(engine, state, EngineResponse.failure(describe(e), modelOf(engine), name, 0), true);
        } finally {
            ThreadContext.remove(MDC_ENGINE);
            if (ownsRunId) {
                ThreadContext.remove(MDC_RUN_ID);
            }
        }
    }

    /**
     * One engine call bounded by the configured timeout.
     */
    private Attempt attempt(Engine engine, PromptRequest request) {
        String name = engine.getName();
        FutureTask<EngineResponse> call = new FutureTask<>(() -> engine.execute(request));
        long t0 = System.nanoTime();
        try {
            engineCallExecutor.execute(call);
        } catch (RejectedExecutionException e) {
            LOG.warn("{} call rejected by engine-call executor", name);
            return new Attempt(EngineResponse.failure("Engine " + name + " rejected: engine-call pool saturated",
                    modelOf(engine), name, 0), true);
        }
        try {
            long timeoutMs = config.timeoutMs();
            EngineResponse response = timeoutMs > 0 ? call.get(timeoutMs, TimeUnit.MILLISECONDS) : call.get();
            if (response == null) {
                return new Attempt(EngineResponse.failure("Engine " + name + " returned no response",
                        modelOf(engine), name, TimeUtils.elapsedMillis(t0)), true);
            }
            return new Attempt(response, false);
        } catch (TimeoutException e) {
            call.cancel(true);
            LOG.warn("{} timed out after {}ms", name, config.timeoutMs());
            return new Attempt(EngineResponse.failure("Engine " + name + " timed out after " + config.timeoutMs() + "ms",
                    modelOf(engine), name, TimeUtils.elapsedMillis(t0)), false);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.error("{} threw from execute()", name, cause);
            return new Attempt(EngineResponse.failure(describe(cause), modelOf(engine), name,
                    TimeUtils.elapsedMillis(t0)), true);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return new Attempt(EngineResponse.failure("Engine " + name + " call interrupted",
                    modelOf(engine), name, TimeUtils.elapsedMillis(t0)), false);
        }
    }

    private void settle(Engine engine, RunState state, EngineResponse response, boolean unexpected) {
        String name = engine.getName();
        if (state.results.putIfAbsent(name, response) != null) {
            return;
        }
        int completed = state.completed.incrementAndGet();
        metrics.recordOutcome(response, unexpected);
        if (response.isSuccess()) {
            LOG.info("{} completed in {}ms ({}/{})", name, response.executionTimeMs(), completed, state.total);
            notify(new ProgressUpdate(state.runId, name, ProgressUpdate.Status.COMPLETED, response, null,
                    completed, state.total));
        } else {
            LOG.warn("{} failed: {} ({}/{})", name, response.error(), completed, state.total);
            notify(new ProgressUpdate(state.runId, name, ProgressUpdate.Status.FAILED, response, response.error(),
                    completed, state.total));
            if (!config.continueOnError()) {
                state.abortIfFirst(new Aborted(name, response.error()));
            }
        }
    }

    private boolean initializeSink(List<String> errors) {
        try {
            config.sink().initialize();
            return true;
        } catch (RuntimeException e) {
            LOG.warn("Result sink initialization failed: {}", e.getMessage());
            errors.add("output: " + describe(e));
            return false;
        }
    }

    private String saveResults(String runId, PromptRequest request, List<String> engineNames,
                               Map<String, EngineResponse> results, List<String> errors) {
        try {
            SinkReceipt receipt = config.sink().saveResults(runId, request, engineNames, results);
            return receipt == null ? null : receipt.location();
        } catch (RuntimeException e) {
            LOG.warn("Saving results of run {} failed: {}", runId, e.getMessage());
            errors.add("output: " + describe(e));
            return null;
        }
    }

    private void recordPerformance(String runId, PromptRequest request, Map<String, EngineResponse> results, long elapsedMs) {
        if (tracker == null) {
            return;
        }
        try {
            RunContext context = new RunContext(config.concurrent(), config.maxConcurrency(),
                    config.timeoutMs(), config.retries());
            PerformanceRecord record = MetricsDeriver.derive(runId, clock.instant(), request.prompt(), results,
                    elapsedMs, context);
            tracker.record(record);
        } catch (RuntimeException e) {
            LOG.warn("Failed to record performance metrics for run {}: {}", runId, e.getMessage());
        }
    }

    private void notify(ProgressUpdate update) {
        try {
            listener.onProgress(update);
        } catch (RuntimeException e) {
            LOG.warn("Progress listener failed on {} {}: {}", update.engineName(), update.status(), e.getMessage());
        }
    }

    /**
     * Probes every engine's availability. A probe that throws counts as unavailable.
     */
    public Map<String, Boolean> getEngineStatus() {
        Map<String, Boolean> status = new LinkedHashMap<>();
        for (Map.Entry<String, Engine> e : config.engines().entrySet()) {
            boolean available;
            try {
                available = e.getValue().isAvailable();
            } catch (RuntimeException ex) {
                LOG.debug("Availability probe for {} failed: {}", e.getKey(), ex.getMessage());
                available = false;
            }
            status.put(e.getKey(), available);
        }
        return status;
    }

    public String summary() {
        return config.summary();
    }

    public RunConfig getConfig() {
        return config;
    }

    public ConcurrencyGate getGate() {
        return gate;
    }

    private static Map<String, EngineResponse> ordered(Map<String, EngineResponse> results, List<String> order) {
        Map<String, EngineResponse> out = new LinkedHashMap<>();
        for (String name : order) {
            EngineResponse r = results.get(name);
            if (r != null) {
                out.put(name, r);
            }
        }
        return out;
    }

    private static boolean sleep(long ms) {
        if (ms <= 0) {
            return true;
        }
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String modelOf(Engine engine) {
        try {
            return engine.getConfig().model();
        } catch (RuntimeException e) {
            return engine.getName();
        }
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    static String newRunId() {
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        String suffix = Long.toString(rnd.nextLong(36L * 36 * 36 * 36 * 36), 36);
        return "run-" + Long.toString(System.currentTimeMillis(), 36) + "-" + suffix;
    }

    private record Attempt(EngineResponse response, boolean unexpected) {}

    private record Aborted(String engineName, String error) {}

    /**
     * Mutable state of one run, shared by its dispatches.
     */
    private static final class RunState {
        final String runId;
        final int total;
        final Map<String, EngineResponse> results = new ConcurrentHashMap<>();
        final AtomicInteger completed = new AtomicInteger();
        final AtomicReference<Aborted> aborted = new AtomicReference<>();

        RunState(String runId, int total) {
            this.runId = runId;
            this.total = total;
        }

        void abortIfFirst(Aborted cause) {
            aborted.compareAndSet(null, cause);
        }
    }

    public static final class Builder {
        private final RunConfig config;
        private final Executor dispatchExecutor;
        private final Executor engineCallExecutor;
        private ProgressListener listener = ProgressListener.NONE;
        private RunMetricsPublisher metrics = RunMetricsPublisher.NOOP;
        private PerformanceTracker tracker;
        private Clock clock = Clock.systemUTC();

        private Builder(RunConfig config, Executor dispatchExecutor, Executor engineCallExecutor) {
            this.config = Objects.requireNonNull(config, "config");
            this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
            this.engineCallExecutor = Objects.requireNonNull(engineCallExecutor, "engineCallExecutor");
        }

        public Builder progressListener(ProgressListener listener) {
            this.listener = listener == null ? ProgressListener.NONE : listener;
            return this;
        }

        public Builder metrics(RunMetricsPublisher metrics) {
            this.metrics = metrics == null ? RunMetricsPublisher.NOOP : metrics;
            return this;
        }

        /**
         * Tracker receiving one {@link PerformanceRecord} per completed run (nullable).
         */
        public Builder performanceTracker(PerformanceTracker tracker) {
            this.tracker = tracker;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public PromptRunner build() {
            return new PromptRunner(this);
        }
    }
}
