package com.phillippitts.multishot.service.engine;

import com.phillippitts.multishot.domain.EngineResponse;
import com.phillippitts.multishot.domain.PromptRequest;
import com.phillippitts.multishot.exception.EngineConfigurationException;
import com.phillippitts.multishot.exception.EngineExecutionException;
import com.phillippitts.multishot.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Abstract base class for engine variants providing the common execution pipeline.
 *
 * <p>This class implements the Template Method pattern. {@link #execute(PromptRequest)} is
 * final and always returns a response:
 * <ol>
 *   <li>Rejects the call without reaching the backend if no transport is registered or
 *       {@link #unavailableReason()} reports a configuration problem (executionTimeMs = 0)</li>
 *   <li>Shapes the prompt according to {@link #getCapabilities()}: engines without system
 *       prompt support receive the system instruction folded into the user prompt</li>
 *   <li>Calls the transport with {@link #effectiveConfig()} and times the call</li>
 *   <li>Converts transport failures and unexpected runtime errors into error responses; an
 *       interrupted call keeps the thread's interrupt flag set</li>
 * </ol>
 *
 * <p><b>Thread Safety:</b> Instances are immutable after construction; concurrent executions
 * are safe as long as the transport is.
 *
 * <p><b>Subclass Responsibilities:</b>
 * <ul>
 *   <li>{@link #getType()} and {@link #getCapabilities()}</li>
 *   <li>{@link #unavailableReason()} - variant-specific readiness check (optional)</li>
 *   <li>{@link #effectiveConfig()} - variant-specific limits (optional)</li>
 * </ul>
 *
 * @see Engine
 * @see com.phillippitts.multishot.service.engine.remote.RemoteLargeEngine
 * @see com.phillippitts.multishot.service.engine.local.LocalEngine
 */
public abstract class AbstractEngine implements Engine {

    private static final Logger LOG = LogManager.getLogger(AbstractEngine.class);

    protected final EngineConfig config;
    private final CompletionTransport transport;

    /**
     * @param config    engine configuration (name and model must not be blank)
     * @param transport provider client (nullable: engine is then unavailable)
     * @throws EngineConfigurationException if name or model is blank
     */
    protected AbstractEngine(EngineConfig config, CompletionTransport transport) {
        this.config = Objects.requireNonNull(config, "config");
        if (config.name().isBlank() || config.model().isBlank()) {
            throw new EngineConfigurationException(config.name(), "engine configuration must include name and model");
        }
        this.transport = transport;
    }

    @Override
    public final EngineResponse execute(PromptRequest request) {
        Objects.requireNonNull(request, "request");
        if (transport == null) {
            return failure("No completion transport registered for " + getType() + " engines", 0);
        }
        String reason = unavailableReason();
        if (reason != null) {
            return failure(reason, 0);
        }

        String systemPrompt = request.systemPrompt();
        String prompt = request.prompt();
        if (systemPrompt != null && !getCapabilities().supportsSystemPrompts()) {
            prompt = foldSystemPrompt(systemPrompt, prompt);
            systemPrompt = null;
        }

        long t0 = System.nanoTime();
        try {
            Completion completion = transport.complete(effectiveConfig(), systemPrompt, prompt);
            long ms = TimeUtils.elapsedMillis(t0);
            if (completion == null) {
                return failure("Backend returned no completion", ms);
            }
            return EngineResponse.success(completion.content(), config.model(), config.name(), ms,
                    completion.tokenUsage());
        } catch (EngineExecutionException e) {
            if (e.getCause() instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                return failure(config.name() + " call interrupted", TimeUtils.elapsedMillis(t0));
            }
            LOG.warn("{} failed: {}", config.name(), e.getMessage());
            return failure(e.getMessage(), TimeUtils.elapsedMillis(t0));
        } catch (RuntimeException e) {
            LOG.error("{} unexpected error", config.name(), e);
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return failure(msg, TimeUtils.elapsedMillis(t0));
        }
    }

    @Override
    public boolean isAvailable() {
        return transport != null && unavailableReason() == null;
    }

    @Override
    public EngineConfig getConfig() {
        return config.sanitized();
    }

    /**
     * Variant-specific readiness check.
     *
     * @return a human-readable reason the engine cannot run, or null when ready
     */
    protected String unavailableReason() {
        return null;
    }

    /**
     * Configuration handed to the transport. Variants override to apply their own limits.
     */
    protected EngineConfig effectiveConfig() {
        return config;
    }

    /**
     * Merges a system instruction into the user prompt for backends that take a single prompt.
     */
    protected String foldSystemPrompt(String systemPrompt, String prompt) {
        return systemPrompt + "\n\n" + prompt;
    }

    private EngineResponse failure(String error, long ms) {
        return EngineResponse.failure(error, config.model(), config.name(), ms);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getDisplayName() + "]";
    }
}
