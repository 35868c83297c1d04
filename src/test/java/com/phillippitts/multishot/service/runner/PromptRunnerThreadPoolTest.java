package com.phillippitts.multishot.service.runner;

import com.phillippitts.multishot.config.ThreadPoolConfig;
import com.phillippitts.multishot.config.properties.ThreadPoolProperties;
import com.phillippitts.multishot.domain.PromptRequest;
import com.phillippitts.multishot.domain.RunResult;
import com.phillippitts.multishot.testutil.FakeEngine;
import com.phillippitts.multishot.testutil.FakeEngine.ConcurrencyProbe;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs on the executors the application wires, so pool sizing cannot undercut the gate.
 */
class PromptRunnerThreadPoolTest {

    private static final PromptRequest REQUEST = PromptRequest.of("Compare B-trees and LSM trees");

    private ThreadPoolTaskExecutor dispatchPool;
    private ThreadPoolTaskExecutor enginePool;

    @BeforeEach
    void setUp() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        dispatchPool = (ThreadPoolTaskExecutor) config.dispatchExecutor();
        enginePool = (ThreadPoolTaskExecutor) config.engineCallExecutor();
    }

    @AfterEach
    void tearDown() {
        dispatchPool.shutdown();
        enginePool.shutdown();
    }

    private RunResult runAll(int engines, int maxConcurrency, ConcurrencyProbe probe) {
        RunConfig.Builder b = RunConfig.builder()
                .maxConcurrency(maxConcurrency)
                .timeoutMs(5000)
                .retries(0);
        for (int i = 0; i < engines; i++) {
            b.engine(FakeEngine.named("engine-" + i).delayMs(300).probe(probe).build());
        }
        return PromptRunner.builder(b.build(), dispatchPool, enginePool).build().run(REQUEST);
    }

    @Test
    void defaultPoolsRunEveryEngineAtOnceWhenLimitAllows() {
        ConcurrencyProbe probe = new ConcurrencyProbe();

        RunResult result = runAll(5, 5, probe);

        assertThat(result.successCount()).isEqualTo(5);
        assertThat(probe.peak()).isEqualTo(5);
    }

    @Test
    void parallelismEqualsEngineCountWhenLimitIsHigher() {
        ConcurrencyProbe probe = new ConcurrencyProbe();

        RunResult result = runAll(6, 10, probe);

        assertThat(result.successCount()).isEqualTo(6);
        assertThat(probe.peak()).isEqualTo(6);
    }

    @Test
    void gateStillBoundsParallelismOnDefaultPools() {
        ConcurrencyProbe probe = new ConcurrencyProbe();

        RunResult result = runAll(8, 3, probe);

        assertThat(result.successCount()).isEqualTo(8);
        assertThat(probe.peak()).isBetween(1, 3);
    }
}
