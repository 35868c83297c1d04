package com.phillippitts.multishot.service.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of completion transports per engine variant.
 *
 * <p>Variants without a registered transport still build, but report themselves unavailable
 * and answer every execution with an error response.
 */
@Component
public class EngineTransports {

    private static final Logger LOG = LogManager.getLogger(EngineTransports.class);

    private final Map<EngineType, CompletionTransport> transports = new EnumMap<>(EngineType.class);

    @Autowired
    public EngineTransports(ObjectProvider<TransportBinding> bindings) {
        bindings.orderedStream().forEach(b -> register(b.type(), b.transport()));
        LOG.info("Completion transports registered for {}", transports.keySet());
    }

    public EngineTransports(Map<EngineType, CompletionTransport> transports) {
        transports.forEach(this::register);
    }

    /**
     * Registry that serves every variant with the same transport. Handy for tests and dry runs.
     */
    public static EngineTransports forAll(CompletionTransport transport) {
        Map<EngineType, CompletionTransport> all = new EnumMap<>(EngineType.class);
        for (EngineType type : EngineType.values()) {
            all.put(type, transport);
        }
        return new EngineTransports(all);
    }

    public static EngineTransports none() {
        return new EngineTransports(Map.of());
    }

    private void register(EngineType type, CompletionTransport transport) {
        CompletionTransport previous = transports.put(type, transport);
        if (previous != null) {
            LOG.warn("Replacing completion transport for {}", type);
        }
    }

    public Optional<CompletionTransport> forType(EngineType type) {
        return Optional.ofNullable(transports.get(type));
    }
}
