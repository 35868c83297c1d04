package com.phillippitts.multishot.service.runner;

import com.phillippitts.multishot.config.properties.EngineProperties;
import com.phillippitts.multishot.config.properties.OutputProperties;
import com.phillippitts.multishot.config.properties.RunnerProperties;
import com.phillippitts.multishot.domain.PromptRequest;
import com.phillippitts.multishot.domain.RunResult;
import com.phillippitts.multishot.exception.EngineExecutionException;
import com.phillippitts.multishot.exception.GateTimeoutException;
import com.phillippitts.multishot.exception.InvalidPromptException;
import com.phillippitts.multishot.exception.RunAbortedException;
import com.phillippitts.multishot.service.engine.Completion;
import com.phillippitts.multishot.service.engine.EngineFactory;
import com.phillippitts.multishot.service.engine.EngineTransports;
import com.phillippitts.multishot.service.metrics.PerformanceTracker;
import com.phillippitts.multishot.service.metrics.RunMetricsPublisher;
import com.phillippitts.multishot.service.output.FolderResultSink;
import com.phillippitts.multishot.service.output.NoopResultSink;
import com.phillippitts.multishot.service.runner.event.ProgressUpdate;
import com.phillippitts.multishot.service.runner.event.RunCompletedEvent;
import com.phillippitts.multishot.testutil.EventCapturingPublisher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.awaitility.Awaitility.await;

class MultiShotServiceTest {

    @TempDir
    Path outputDir;

    private final ExecutorService pool = Executors.newCachedThreadPool();
    private EngineProperties engineProperties;
    private RunnerProperties runnerProperties;
    private OutputProperties outputProperties;
    private PerformanceTracker tracker;
    private EventCapturingPublisher publisher;
    private MultiShotService service;

    @BeforeEach
    void setUp() {
        engineProperties = new EngineProperties();
        engineProperties.setApiKeys(Map.of("openai", "sk-test", "anthropic", "sk-ant-test"));
        runnerProperties = new RunnerProperties();
        runnerProperties.setRetryBaseDelayMs(5);
        runnerProperties.setSequentialDelayMs(0);
        outputProperties = new OutputProperties();
        outputProperties.setStrategy(OutputProperties.Strategy.NONE);
        tracker = new PerformanceTracker();
        publisher = new EventCapturingPublisher();
        EngineTransports echo = EngineTransports.forAll((cfg, sys, prompt) -> Completion.of(cfg.model() + ": " + prompt));
        service = new MultiShotService(new EngineFactory(echo, engineProperties), runnerProperties, outputProperties,
                RunMetricsPublisher.NOOP, tracker, publisher, pool, pool);
    }

    @AfterEach
    void shutdown() {
        pool.shutdownNow();
    }

    @Test
    void runsDefaultEnginesAndPublishesCompletion() {
        RunResult result = service.run(PromptRequest.of("ping"), null, null);

        assertThat(result.success()).isTrue();
        assertThat(result.results()).containsOnlyKeys("gpt-4o-mini", "claude-haiku");
        assertThat(result.results().get("claude-haiku").content()).isEqualTo("claude-3-haiku-20240307: ping");

        RunCompletedEvent completed = publisher.findRunCompletedEvent();
        assertThat(completed).isNotNull();
        assertThat(completed.result().runId()).isEqualTo(result.runId());
        assertThat(publisher.eventsOfType(ProgressUpdate.class))
                .extracting(ProgressUpdate::status)
                .filteredOn(s -> s == ProgressUpdate.Status.COMPLETED)
                .hasSize(2);
        assertThat(tracker.getRunMetrics(result.runId())).isPresent();
    }

    @Test
    void appliesRequestOverridesOverProperties() {
        RunConfig cfg = service.buildConfig(List.of("gpt-4o"),
                new RunOptions(false, 2, 500L, 0, false, false));

        assertThat(cfg.concurrent()).isFalse();
        assertThat(cfg.maxConcurrency()).isEqualTo(2);
        assertThat(cfg.timeoutMs()).isEqualTo(500);
        assertThat(cfg.retries()).isZero();
        assertThat(cfg.continueOnError()).isFalse();
        assertThat(cfg.sink()).isSameAs(NoopResultSink.INSTANCE);
    }

    @Test
    void fallsBackToPropertiesWhenNoOverride() {
        runnerProperties.setMaxConcurrency(3);

        RunConfig cfg = service.buildConfig(Arrays.asList(" gpt-4o ", null, "gpt-4o"), RunOptions.DEFAULTS);

        assertThat(cfg.engineNames()).containsExactly("gpt-4o");
        assertThat(cfg.maxConcurrency()).isEqualTo(3);
        assertThat(cfg.retries()).isEqualTo(runnerProperties.getRetries());
    }

    @Test
    void folderStrategyWritesRunOutput() {
        outputProperties.setStrategy(OutputProperties.Strategy.FOLDERS);
        outputProperties.setBaseDir(outputDir.toString());

        assertThat(service.buildConfig(List.of("gpt-4o"), RunOptions.DEFAULTS).sink())
                .isInstanceOf(FolderResultSink.class);

        RunResult result = service.run(PromptRequest.of("Explain kubernetes deployment"), List.of("gpt-4o"), null);

        assertThat(result.outputLocation()).isNotNull();
        assertThat(Files.exists(Path.of(result.outputLocation()).resolve("metadata.json"))).isTrue();
    }

    @Test
    void rejectsRequestWhenNoEngineCanBeBuilt() {
        engineProperties.setLocalEndpoint("");

        assertThatThrownBy(() -> service.run(PromptRequest.of("hi"), List.of("tinyllama"), null))
                .isInstanceOf(InvalidPromptException.class)
                .hasMessageContaining("none of the requested engines could be created");
    }

    @Test
    void rejectsOutOfRangeOverride() {
        assertThatThrownBy(() -> service.buildConfig(List.of("gpt-4o"),
                new RunOptions(null, 0, null, null, null, null)))
                .isInstanceOf(InvalidPromptException.class)
                .hasMessageContaining("maxConcurrency");
    }

    @Test
    void reportsEngineStatusIncludingUnbuildableNames() {
        engineProperties.setApiKeys(Map.of("openai", "sk-test"));
        engineProperties.setLocalEndpoint("");

        Map<String, Boolean> status = service.engineStatus(List.of("gpt-4o", "claude-haiku", "tinyllama"));

        assertThat(status).containsExactly(
                entry("gpt-4o", true),
                entry("claude-haiku", false),
                entry("tinyllama", false));
    }

    private MultiShotService serviceWithBlockingTransport(CountDownLatch unblock) {
        EngineTransports blocking = EngineTransports.forAll((cfg, sys, prompt) -> {
            try {
                unblock.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Completion.of("done");
        });
        return new MultiShotService(new EngineFactory(blocking, engineProperties), runnerProperties, outputProperties,
                RunMetricsPublisher.NOOP, tracker, publisher, pool, pool);
    }

    @Test
    void rejectsRunWhenNoRunSlotFreesUpInTime() throws Exception {
        runnerProperties.setMaxConcurrentRuns(1);
        runnerProperties.setRunAcquireTimeoutMs(50);
        CountDownLatch unblock = new CountDownLatch(1);
        MultiShotService busy = serviceWithBlockingTransport(unblock);

        Future<RunResult> first = pool.submit(() -> busy.run(PromptRequest.of("first"), List.of("gpt-4o"), null));
        await().atMost(2, TimeUnit.SECONDS).until(() -> busy.getRunGate().inUse() == 1);

        assertThatThrownBy(() -> busy.run(PromptRequest.of("second"), List.of("gpt-4o"), null))
                .isInstanceOf(GateTimeoutException.class)
                .hasMessageContaining("50ms");

        unblock.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS).success()).isTrue();
        assertThat(busy.getRunGate().inUse()).isZero();
        assertThat(busy.run(PromptRequest.of("third"), List.of("gpt-4o"), null).success()).isTrue();
    }

    @Test
    void releasesRunSlotWhenRunAborts() {
        runnerProperties.setMaxConcurrentRuns(1);
        runnerProperties.setRunAcquireTimeoutMs(0);
        EngineTransports failing = EngineTransports.forAll((cfg, sys, prompt) -> {
            throw new EngineExecutionException("HTTP 503");
        });
        MultiShotService strict = new MultiShotService(new EngineFactory(failing, engineProperties), runnerProperties,
                outputProperties, RunMetricsPublisher.NOOP, tracker, publisher, pool, pool);
        RunOptions failFast = new RunOptions(null, null, null, 0, false, null);

        assertThatThrownBy(() -> strict.run(PromptRequest.of("hi"), List.of("gpt-4o"), failFast))
                .isInstanceOf(RunAbortedException.class);
        assertThat(strict.getRunGate().availablePermits()).isEqualTo(1);
    }
}
