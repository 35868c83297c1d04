package com.phillippitts.multishot.service.engine;

/**
 * Closed set of engine variants. Adding a variant requires one new constant and one new
 * case in {@link EngineFactory#create(EngineType, EngineConfig)}.
 */
public enum EngineType {
    /** Hosted large model (premium tier). */
    REMOTE_LARGE,
    /** Hosted small/cheap model. */
    REMOTE_SMALL,
    /** Model served by a local runtime (ollama, llama.cpp). */
    LOCAL,
    /** User-defined backend. */
    CUSTOM
}
