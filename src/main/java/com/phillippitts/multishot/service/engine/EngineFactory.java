package com.phillippitts.multishot.service.engine;

import com.phillippitts.multishot.config.properties.EngineProperties;
import com.phillippitts.multishot.exception.EngineConfigurationException;
import com.phillippitts.multishot.service.engine.custom.CustomEngine;
import com.phillippitts.multishot.service.engine.local.LocalEngine;
import com.phillippitts.multishot.service.engine.remote.RemoteLargeEngine;
import com.phillippitts.multishot.service.engine.remote.RemoteSmallEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Builds engines from a variant tag and configuration, or from a bare model name.
 *
 * <p>Known names get a predefined configuration; other names are classified by
 * {@link #inferType(String)}. Credentials are looked up per vendor in
 * {@link EngineProperties#getApiKeys()}, the local endpoint in
 * {@link EngineProperties#getLocalEndpoint()}.
 */
@Component
public class EngineFactory {

    private static final Logger LOG = LogManager.getLogger(EngineFactory.class);

    static final String VENDOR_OPENAI = "openai";
    static final String VENDOR_ANTHROPIC = "anthropic";
    static final int LOCAL_MAX_TOKENS = 2048;

    private static final List<String> SMALL_MARKERS = List.of("mini", "haiku", "small", "nano");
    private static final List<String> LOCAL_MARKERS = List.of("local", "ollama", ":", "qwen", "llama");

    private record KnownEngine(EngineType type, String model) {}

    private static final Map<String, KnownEngine> KNOWN = Map.of(
            "gpt-4o", new KnownEngine(EngineType.REMOTE_LARGE, "gpt-4o"),
            "gpt-4o-mini", new KnownEngine(EngineType.REMOTE_SMALL, "gpt-4o-mini"),
            "claude-sonnet", new KnownEngine(EngineType.REMOTE_LARGE, "claude-3-sonnet-20240229"),
            "claude-haiku", new KnownEngine(EngineType.REMOTE_SMALL, "claude-3-haiku-20240307"),
            "tinyllama", new KnownEngine(EngineType.LOCAL, "tinyllama")
    );

    private final EngineTransports transports;
    private final EngineProperties properties;

    public EngineFactory(EngineTransports transports, EngineProperties properties) {
        this.transports = Objects.requireNonNull(transports, "transports");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * Creates an engine of the given variant.
     *
     * @throws EngineConfigurationException if the configuration is unusable for the variant
     */
    public Engine create(EngineType type, EngineConfig config) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(config, "config");
        CompletionTransport transport = transports.forType(type).orElse(null);
        return switch (type) {
            case REMOTE_LARGE -> new RemoteLargeEngine(config, transport);
            case REMOTE_SMALL -> new RemoteSmallEngine(config, transport);
            case LOCAL -> new LocalEngine(config, transport);
            case CUSTOM -> new CustomEngine(config, transport);
        };
    }

    /**
     * Creates an engine from its name, using the predefined configuration when the name is known.
     *
     * @throws EngineConfigurationException if the name is blank or the derived configuration is unusable
     */
    public Engine create(String name) {
        if (name == null || name.isBlank()) {
            throw new EngineConfigurationException(String.valueOf(name), "engine name must not be blank");
        }
        String trimmed = name.trim();
        KnownEngine known = KNOWN.get(trimmed.toLowerCase(Locale.ROOT));
        EngineType type = known != null ? known.type() : inferType(trimmed);
        String model = known != null ? known.model() : trimmed;
        return create(type, configFor(trimmed, model, type));
    }

    /**
     * Builds engines for the given names in order. A name that cannot be built is logged and
     * skipped; duplicates keep their first position.
     */
    public Map<String, Engine> createEngines(List<String> names) {
        Map<String, Engine> engines = new LinkedHashMap<>();
        for (String name : names) {
            try {
                Engine engine = create(name);
                engines.putIfAbsent(engine.getName(), engine);
            } catch (EngineConfigurationException e) {
                LOG.warn("Skipping engine {}: {}", name, e.getMessage());
            }
        }
        return engines;
    }

    public List<String> defaultEngineNames() {
        return List.copyOf(properties.getDefaults());
    }

    /**
     * Classifies a model name: vendor names with a small-model marker are
     * {@link EngineType#REMOTE_SMALL}, other vendor names {@link EngineType#REMOTE_LARGE},
     * local runtime names {@link EngineType#LOCAL}, everything else {@link EngineType#CUSTOM}.
     */
    public static EngineType inferType(String name) {
        String n = name.toLowerCase(Locale.ROOT);
        if (vendorOf(n) != null) {
            return SMALL_MARKERS.stream().anyMatch(n::contains) ? EngineType.REMOTE_SMALL : EngineType.REMOTE_LARGE;
        }
        if (LOCAL_MARKERS.stream().anyMatch(n::contains)) {
            return EngineType.LOCAL;
        }
        return EngineType.CUSTOM;
    }

    static String vendorOf(String name) {
        String n = name.toLowerCase(Locale.ROOT);
        if (n.contains("gpt") || n.contains(VENDOR_OPENAI)) {
            return VENDOR_OPENAI;
        }
        if (n.contains("claude") || n.contains(VENDOR_ANTHROPIC)) {
            return VENDOR_ANTHROPIC;
        }
        return null;
    }

    private EngineConfig configFor(String name, String model, EngineType type) {
        EngineConfig base = new EngineConfig(name, model, null, null,
                properties.getTemperature(), properties.getMaxTokens(), 0);
        return switch (type) {
            case REMOTE_LARGE, REMOTE_SMALL -> base.withApiKey(apiKeyFor(name));
            case LOCAL -> base.withBaseUrl(properties.getLocalEndpoint()).withMaxTokens(LOCAL_MAX_TOKENS);
            case CUSTOM -> base;
        };
    }

    private String apiKeyFor(String name) {
        String vendor = vendorOf(name);
        if (vendor == null) {
            return null;
        }
        String key = properties.getApiKeys().get(vendor);
        if (key == null || key.isBlank()) {
            LOG.debug("No API key configured for vendor {}", vendor);
            return null;
        }
        return key;
    }
}
