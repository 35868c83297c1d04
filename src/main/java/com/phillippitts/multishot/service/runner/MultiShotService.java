package com.phillippitts.multishot.service.runner;

import com.phillippitts.multishot.config.properties.OutputProperties;
import com.phillippitts.multishot.config.properties.RunnerProperties;
import com.phillippitts.multishot.domain.PromptRequest;
import com.phillippitts.multishot.domain.RunResult;
import com.phillippitts.multishot.exception.GateTimeoutException;
import com.phillippitts.multishot.exception.InvalidPromptException;
import com.phillippitts.multishot.exception.MultiShotException;
import com.phillippitts.multishot.service.engine.Engine;
import com.phillippitts.multishot.service.engine.EngineFactory;
import com.phillippitts.multishot.service.metrics.PerformanceTracker;
import com.phillippitts.multishot.service.metrics.RunMetricsPublisher;
import com.phillippitts.multishot.service.output.FolderResultSink;
import com.phillippitts.multishot.service.output.NoopResultSink;
import com.phillippitts.multishot.service.output.ResultSink;
import com.phillippitts.multishot.service.runner.event.RunCompletedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Builds runs from configuration and per-request overrides.
 *
 * <p>Each call resolves engine names through the {@link EngineFactory}, assembles a
 * {@link RunConfig}, and executes it on a fresh {@link PromptRunner} wired to the shared
 * executors, metrics and performance tracker. Progress and completion are published as
 * application events.
 *
 * <p>At most {@code multishot.runner.max-concurrent-runs} runs execute at once. A caller waits
 * up to {@code run-acquire-timeout-ms} for a slot and is then rejected with
 * {@link GateTimeoutException}.
 */
@Service
public class MultiShotService {

    private static final Logger LOG = LogManager.getLogger(MultiShotService.class);

    private final EngineFactory engineFactory;
    private final RunnerProperties runnerProperties;
    private final OutputProperties outputProperties;
    private final RunMetricsPublisher metrics;
    private final PerformanceTracker tracker;
    private final ApplicationEventPublisher publisher;
    private final Executor dispatchExecutor;
    private final Executor engineCallExecutor;
    private final ConcurrencyGate runGate;

    public MultiShotService(EngineFactory engineFactory,
                            RunnerProperties runnerProperties,
                            OutputProperties outputProperties,
                            RunMetricsPublisher metrics,
                            PerformanceTracker tracker,
                            ApplicationEventPublisher publisher,
                            @Qualifier("dispatchExecutor") Executor dispatchExecutor,
                            @Qualifier("engineCallExecutor") Executor engineCallExecutor) {
        this.engineFactory = Objects.requireNonNull(engineFactory);
        this.runnerProperties = Objects.requireNonNull(runnerProperties);
        this.outputProperties = Objects.requireNonNull(outputProperties);
        this.metrics = metrics == null ? RunMetricsPublisher.NOOP : metrics;
        this.tracker = tracker;
        this.publisher = Objects.requireNonNull(publisher);
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor);
        this.engineCallExecutor = Objects.requireNonNull(engineCallExecutor);
        this.runGate = new ConcurrencyGate(runnerProperties.getMaxConcurrentRuns());
    }

    /**
     * Runs a prompt against the named engines (or the configured defaults when none are named).
     *
     * @throws InvalidPromptException if no engine can be built or an override is out of range
     * @throws GateTimeoutException if no run slot frees up within the configured wait
     * @throws com.phillippitts.multishot.exception.RunAbortedException on a fail-fast abort
     */
    public RunResult run(PromptRequest request, List<String> engineNames, RunOptions options) {
        Objects.requireNonNull(request, "request");
        RunConfig config = buildConfig(engineNames, options == null ? RunOptions.DEFAULTS : options);
        PromptRunner runner = PromptRunner.builder(config, dispatchExecutor, engineCallExecutor)
                .progressListener(new PublishingProgressListener(publisher))
                .metrics(metrics)
                .performanceTracker(tracker)
                .build();
        LOG.debug("Run configuration:\n{}", config.summary());

        acquireRunSlot();
        try {
            RunResult result = runner.run(request);
            publisher.publishEvent(new RunCompletedEvent(result, Instant.now()));
            return result;
        } finally {
            runGate.release();
        }
    }

    private void acquireRunSlot() {
        long timeoutMs = runnerProperties.getRunAcquireTimeoutMs();
        try {
            runGate.acquire(timeoutMs);
        } catch (GateTimeoutException e) {
            LOG.warn("Run rejected: {} runs in progress, no slot after {}ms", runGate.inUse(), timeoutMs);
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MultiShotException("Interrupted while waiting for a run slot", e);
        }
    }

    /**
     * Availability of the named engines (or the defaults). Names that cannot be built report false.
     */
    public Map<String, Boolean> engineStatus(List<String> engineNames) {
        List<String> names = resolveNames(engineNames);
        Map<String, Engine> engines = engineFactory.createEngines(names);
        Map<String, Boolean> status = new LinkedHashMap<>();
        for (String name : names) {
            Engine engine = engines.get(name.trim());
            boolean available = false;
            if (engine != null) {
                try {
                    available = engine.isAvailable();
                } catch (RuntimeException e) {
                    LOG.debug("Availability probe for {} failed: {}", name, e.getMessage());
                }
            }
            status.put(name.trim(), available);
        }
        return status;
    }

    public PerformanceTracker getPerformanceTracker() {
        return tracker;
    }

    ConcurrencyGate getRunGate() {
        return runGate;
    }

    RunConfig buildConfig(List<String> engineNames, RunOptions options) {
        Map<String, Engine> engines = engineFactory.createEngines(resolveNames(engineNames));
        if (engines.isEmpty()) {
            throw new InvalidPromptException("none of the requested engines could be created");
        }
        try {
            return RunConfig.builder()
                    .engines(engines)
                    .concurrent(orDefault(options.concurrent(), runnerProperties.isConcurrent()))
                    .maxConcurrency(orDefault(options.maxConcurrency(), runnerProperties.getMaxConcurrency()))
                    .timeoutMs(orDefault(options.timeoutMs(), runnerProperties.getTimeoutMs()))
                    .retries(orDefault(options.retries(), runnerProperties.getRetries()))
                    .continueOnError(orDefault(options.continueOnError(), runnerProperties.isContinueOnError()))
                    .retryBaseDelayMs(runnerProperties.getRetryBaseDelayMs())
                    .sequentialDelayMs(runnerProperties.getSequentialDelayMs())
                    .sink(orDefault(options.saveOutput(), true) ? createSink() : NoopResultSink.INSTANCE)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new InvalidPromptException(e.getMessage());
        }
    }

    private List<String> resolveNames(List<String> engineNames) {
        if (engineNames == null || engineNames.stream().allMatch(n -> n == null || n.isBlank())) {
            return engineFactory.defaultEngineNames();
        }
        return engineNames.stream().filter(n -> n != null && !n.isBlank()).map(String::trim).distinct().toList();
    }

    private ResultSink createSink() {
        return switch (outputProperties.getStrategy()) {
            case FOLDERS -> new FolderResultSink(Path.of(outputProperties.getBaseDir()),
                    outputProperties.isCleanupOld(), outputProperties.getMaxAgeDays());
            case NONE -> NoopResultSink.INSTANCE;
        };
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
