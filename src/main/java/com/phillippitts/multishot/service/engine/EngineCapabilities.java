package com.phillippitts.multishot.service.engine;

/**
 * Static limits and features of an engine variant.
 */
public record EngineCapabilities(
        int maxTokens,
        boolean supportsStreaming,
        boolean supportsSystemPrompts
) {}
