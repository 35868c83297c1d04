package com.phillippitts.multishot.testutil;

import com.phillippitts.multishot.domain.EngineResponse;
import com.phillippitts.multishot.domain.PromptRequest;
import com.phillippitts.multishot.domain.TokenUsage;
import com.phillippitts.multishot.service.engine.Engine;
import com.phillippitts.multishot.service.engine.EngineCapabilities;
import com.phillippitts.multishot.service.engine.EngineConfig;
import com.phillippitts.multishot.service.engine.EngineType;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double for Engine with scripted outcomes.
 *
 * <p>Allows tests to control:
 * <ul>
 *   <li>Simulated latency per call</li>
 *   <li>How many leading attempts fail before the engine succeeds (or always fail)</li>
 *   <li>Throwing from {@code execute()} to simulate a contract violation</li>
 * </ul>
 *
 * <p>Counts attempts and, through an optional shared {@link ConcurrencyProbe}, how many engines
 * were executing at the same time.
 */
public class FakeEngine implements Engine {

    public static final int ALWAYS = Integer.MAX_VALUE;

    private final EngineConfig config;
    private final String content;
    private final long delayMs;
    private final int failuresBeforeSuccess;
    private final boolean throwOnExecute;
    private final ConcurrencyProbe probe;
    private final AtomicInteger attempts = new AtomicInteger();
    public volatile boolean available = true;

    private FakeEngine(Builder b) {
        this.config = EngineConfig.of(b.name);
        this.content = b.content;
        this.delayMs = b.delayMs;
        this.failuresBeforeSuccess = b.failuresBeforeSuccess;
        this.throwOnExecute = b.throwOnExecute;
        this.probe = b.probe;
    }

    public static Builder named(String name) {
        return new Builder(name);
    }

    /**
     * Engine that answers immediately with {@code "<name> says hi"}.
     */
    public static FakeEngine ok(String name) {
        return named(name).build();
    }

    public static FakeEngine failing(String name) {
        return named(name).failures(ALWAYS).build();
    }

    @Override
    public EngineResponse execute(PromptRequest request) {
        int attempt = attempts.incrementAndGet();
        if (probe != null) {
            probe.enter();
        }
        long t0 = System.currentTimeMillis();
        try {
            if (delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return EngineResponse.failure("interrupted", config.model(), config.name(),
                            System.currentTimeMillis() - t0);
                }
            }
            if (throwOnExecute) {
                throw new IllegalStateException(config.name() + " exploded");
            }
            long ms = System.currentTimeMillis() - t0;
            if (attempt <= failuresBeforeSuccess) {
                return EngineResponse.failure(config.name() + " attempt " + attempt + " failed",
                        config.model(), config.name(), ms);
            }
            return EngineResponse.success(content, config.model(), config.name(), ms, TokenUsage.of(10, 20));
        } finally {
            if (probe != null) {
                probe.exit();
            }
        }
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public EngineConfig getConfig() {
        return config;
    }

    @Override
    public EngineType getType() {
        return EngineType.CUSTOM;
    }

    @Override
    public EngineCapabilities getCapabilities() {
        return new EngineCapabilities(4000, false, true);
    }

    public int attempts() {
        return attempts.get();
    }

    public static final class Builder {
        private final String name;
        private String content;
        private long delayMs;
        private int failuresBeforeSuccess;
        private boolean throwOnExecute;
        private ConcurrencyProbe probe;

        private Builder(String name) {
            this.name = name;
            this.content = name + " says hi";
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder delayMs(long delayMs) {
            this.delayMs = delayMs;
            return this;
        }

        /**
         * Number of leading attempts that return an error response; {@link #ALWAYS} never succeeds.
         */
        public Builder failures(int failuresBeforeSuccess) {
            this.failuresBeforeSuccess = failuresBeforeSuccess;
            return this;
        }

        public Builder throwing() {
            this.throwOnExecute = true;
            return this;
        }

        public Builder probe(ConcurrencyProbe probe) {
            this.probe = probe;
            return this;
        }

        public FakeEngine build() {
            return new FakeEngine(this);
        }
    }

    /**
     * Tracks the number of engines executing at once and the peak observed.
     */
    public static final class ConcurrencyProbe {
        private final AtomicInteger current = new AtomicInteger();
        private final AtomicInteger peak = new AtomicInteger();

        void enter() {
            int now = current.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
        }

        void exit() {
            current.decrementAndGet();
        }

        public int peak() {
            return peak.get();
        }

        public int current() {
            return current.get();
        }
    }
}
