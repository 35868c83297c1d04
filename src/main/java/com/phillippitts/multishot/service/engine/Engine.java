package com.phillippitts.multishot.service.engine;

import com.phillippitts.multishot.domain.EngineResponse;
import com.phillippitts.multishot.domain.PromptRequest;

/**
 * Contract for text-generation backends dispatched by the runner.
 *
 * <p>Implementations wrap one provider behind a uniform interface so heterogeneous backends
 * can be fanned out the same way.
 *
 * <p>Error contract: {@link #execute(PromptRequest)} must not throw for ordinary remote
 * failures. Provider errors, unreachable endpoints and missing credentials are reported through
 * {@link EngineResponse#error()}. The runner still guards against unexpected exceptions.
 *
 * <p>Thread Safety: implementations must support concurrent executions; the runner may issue
 * a retry while an abandoned, timed-out attempt is still running.
 *
 * @see AbstractEngine
 * @see EngineFactory
 */
public interface Engine {

    /**
     * Sends the request to the backend and returns its outcome.
     *
     * @param request prompt to execute (never null)
     * @return success or error-bearing response, never null
     */
    EngineResponse execute(PromptRequest request);

    /**
     * Cheap reachability/configuration check (credentials present, endpoint configured,
     * transport registered). Must not perform a completion.
     *
     * @return true if the engine is expected to accept requests
     */
    boolean isAvailable();

    /**
     * Returns the engine configuration with credentials removed.
     */
    EngineConfig getConfig();

    EngineType getType();

    EngineCapabilities getCapabilities();

    /**
     * Returns the engine name used as the results key.
     */
    default String getName() {
        return getConfig().name();
    }

    /**
     * Human-readable label, e.g. {@code "claude-haiku (claude-3-haiku-20240307)"}.
     */
    default String getDisplayName() {
        EngineConfig cfg = getConfig();
        return cfg.name() + " (" + cfg.model() + ")";
    }
}
