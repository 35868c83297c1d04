package com.phillippitts.multishot.service.engine;

import java.util.Objects;

/**
 * Associates a completion transport with the engine variant it serves.
 * Declare one bean per provider client to make the matching engines available.
 */
public record TransportBinding(EngineType type, CompletionTransport transport) {
    public TransportBinding {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(transport, "transport");
    }
}
