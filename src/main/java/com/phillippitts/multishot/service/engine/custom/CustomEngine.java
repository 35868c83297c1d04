package com.phillippitts.multishot.service.engine.custom;

import com.phillippitts.multishot.service.engine.AbstractEngine;
import com.phillippitts.multishot.service.engine.CompletionTransport;
import com.phillippitts.multishot.service.engine.EngineCapabilities;
import com.phillippitts.multishot.service.engine.EngineConfig;
import com.phillippitts.multishot.service.engine.EngineType;

/**
 * User-defined backend. Fallback variant for names no other variant claims.
 */
public class CustomEngine extends AbstractEngine {

    private static final EngineCapabilities CAPABILITIES = new EngineCapabilities(4000, false, true);

    public CustomEngine(EngineConfig config, CompletionTransport transport) {
        super(config, transport);
    }

    @Override
    public EngineType getType() {
        return EngineType.CUSTOM;
    }

    @Override
    public EngineCapabilities getCapabilities() {
        return CAPABILITIES;
    }
}
