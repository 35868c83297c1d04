package com.phillippitts.multishot.service.engine.remote;

import com.phillippitts.multishot.service.engine.AbstractEngine;
import com.phillippitts.multishot.service.engine.CompletionTransport;
import com.phillippitts.multishot.service.engine.EngineCapabilities;
import com.phillippitts.multishot.service.engine.EngineConfig;
import com.phillippitts.multishot.service.engine.EngineType;

/**
 * Hosted small/cheap model (gpt-4o-mini, claude-haiku and the like).
 *
 * <p>Completion length is capped at {@value #MAX_COMPLETION_TOKENS} tokens regardless of the
 * configured value.
 */
public class RemoteSmallEngine extends AbstractEngine {

    static final int MAX_COMPLETION_TOKENS = 4096;

    private static final EngineCapabilities CAPABILITIES =
            new EngineCapabilities(MAX_COMPLETION_TOKENS, true, true);

    public RemoteSmallEngine(EngineConfig config, CompletionTransport transport) {
        super(config, transport);
    }

    @Override
    public EngineType getType() {
        return EngineType.REMOTE_SMALL;
    }

    @Override
    public EngineCapabilities getCapabilities() {
        return CAPABILITIES;
    }

    @Override
    protected String unavailableReason() {
        return config.hasApiKey() ? null : "API key not configured for " + config.name();
    }

    @Override
    protected EngineConfig effectiveConfig() {
        return config.maxTokens() > MAX_COMPLETION_TOKENS ? config.withMaxTokens(MAX_COMPLETION_TOKENS) : config;
    }
}
