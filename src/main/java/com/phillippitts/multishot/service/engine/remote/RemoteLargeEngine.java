package com.phillippitts.multishot.service.engine.remote;

import com.phillippitts.multishot.service.engine.AbstractEngine;
import com.phillippitts.multishot.service.engine.CompletionTransport;
import com.phillippitts.multishot.service.engine.EngineCapabilities;
import com.phillippitts.multishot.service.engine.EngineConfig;
import com.phillippitts.multishot.service.engine.EngineType;

/**
 * Hosted premium model (gpt-4o, claude-sonnet and the like).
 */
public class RemoteLargeEngine extends AbstractEngine {

    private static final EngineCapabilities CAPABILITIES = new EngineCapabilities(128_000, true, true);

    public RemoteLargeEngine(EngineConfig config, CompletionTransport transport) {
        super(config, transport);
    }

    @Override
    public EngineType getType() {
        return EngineType.REMOTE_LARGE;
    }

    @Override
    public EngineCapabilities getCapabilities() {
        return CAPABILITIES;
    }

    @Override
    protected String unavailableReason() {
        return config.hasApiKey() ? null : "API key not configured for " + config.name();
    }
}
