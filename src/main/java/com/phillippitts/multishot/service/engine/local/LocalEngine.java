package com.phillippitts.multishot.service.engine.local;

import com.phillippitts.multishot.exception.EngineConfigurationException;
import com.phillippitts.multishot.service.engine.AbstractEngine;
import com.phillippitts.multishot.service.engine.CompletionTransport;
import com.phillippitts.multishot.service.engine.EngineCapabilities;
import com.phillippitts.multishot.service.engine.EngineConfig;
import com.phillippitts.multishot.service.engine.EngineType;

/**
 * Model served by a local runtime (ollama, llama.cpp).
 *
 * <p>Local runtimes take a single prompt, so the system instruction is folded into it.
 * The endpoint is mandatory.
 */
public class LocalEngine extends AbstractEngine {

    private static final EngineCapabilities CAPABILITIES = new EngineCapabilities(2048, false, false);

    /**
     * @throws EngineConfigurationException if no endpoint is configured
     */
    public LocalEngine(EngineConfig config, CompletionTransport transport) {
        super(config, transport);
        if (!config.hasBaseUrl()) {
            throw new EngineConfigurationException(config.name(), "local engine requires endpoint configuration");
        }
    }

    @Override
    public EngineType getType() {
        return EngineType.LOCAL;
    }

    @Override
    public EngineCapabilities getCapabilities() {
        return CAPABILITIES;
    }

    @Override
    protected String foldSystemPrompt(String systemPrompt, String prompt) {
        return "System: " + systemPrompt + "\n\nUser: " + prompt + "\n\nAssistant:";
    }
}
