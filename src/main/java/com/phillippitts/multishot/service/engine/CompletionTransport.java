package com.phillippitts.multishot.service.engine;

import com.phillippitts.multishot.exception.EngineExecutionException;

/**
 * Provider client used by an engine to perform the actual network call.
 *
 * <p>Implementations live outside this module (one per provider API). They should honor thread
 * interruption: the runner cancels a timed-out call with {@code Future.cancel(true)}, and a
 * transport that ignores the interrupt keeps consuming backend resources after the runner has
 * already recorded the timeout.
 */
@FunctionalInterface
public interface CompletionTransport {

    /**
     * Sends one prompt to the backend.
     *
     * @param config       engine configuration (model, credentials, endpoint, limits)
     * @param systemPrompt system instruction, or null when absent or folded into the prompt
     * @param prompt       user prompt
     * @return completion returned by the backend
     * @throws EngineExecutionException when the backend reports a failure or cannot be reached
     */
    Completion complete(EngineConfig config, String systemPrompt, String prompt);
}
