package com.phillippitts.multishot.service.engine;

import com.phillippitts.multishot.config.properties.EngineProperties;
import com.phillippitts.multishot.exception.EngineConfigurationException;
import com.phillippitts.multishot.service.engine.custom.CustomEngine;
import com.phillippitts.multishot.service.engine.local.LocalEngine;
import com.phillippitts.multishot.service.engine.remote.RemoteLargeEngine;
import com.phillippitts.multishot.service.engine.remote.RemoteSmallEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineFactoryTest {

    private EngineProperties properties;
    private EngineFactory factory;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        properties.setApiKeys(Map.of("openai", "sk-test", "anthropic", "sk-ant-test"));
        factory = new EngineFactory(EngineTransports.forAll((cfg, sys, prompt) -> Completion.of("ok")), properties);
    }

    @ParameterizedTest
    @CsvSource({
            "gpt-4o, REMOTE_LARGE",
            "gpt-4o-mini, REMOTE_SMALL",
            "gpt-4.1-nano, REMOTE_SMALL",
            "claude-3-opus, REMOTE_LARGE",
            "claude-3-5-haiku, REMOTE_SMALL",
            "qwen2.5:0.5b, LOCAL",
            "ollama-phi3, LOCAL",
            "mistral-7b, CUSTOM"
    })
    void shouldInferTypeFromName(String name, EngineType expected) {
        assertThat(EngineFactory.inferType(name)).isEqualTo(expected);
    }

    @Test
    void shouldUsePredefinedConfigurationForKnownNames() {
        Engine haiku = factory.create("claude-haiku");

        assertThat(haiku).isInstanceOf(RemoteSmallEngine.class);
        assertThat(haiku.getName()).isEqualTo("claude-haiku");
        assertThat(haiku.getConfig().model()).isEqualTo("claude-3-haiku-20240307");
        assertThat(haiku.isAvailable()).isTrue();
    }

    @Test
    void shouldNeverExposeApiKeyThroughConfig() {
        Engine gpt = factory.create("gpt-4o");

        assertThat(gpt).isInstanceOf(RemoteLargeEngine.class);
        assertThat(gpt.getConfig().apiKey()).isNull();
        assertThat(gpt.toString()).doesNotContain("sk-test");
    }

    @Test
    void shouldConfigureLocalEngineWithEndpoint() {
        Engine local = factory.create("tinyllama");

        assertThat(local).isInstanceOf(LocalEngine.class);
        assertThat(local.getConfig().baseUrl()).isEqualTo("http://localhost:11434");
        assertThat(local.getConfig().maxTokens()).isEqualTo(EngineFactory.LOCAL_MAX_TOKENS);
    }

    @Test
    void shouldBuildCustomEngineForUnknownName() {
        assertThat(factory.create("mistral-7b")).isInstanceOf(CustomEngine.class);
    }

    @Test
    void shouldReportRemoteEngineUnavailableWithoutApiKey() {
        properties.setApiKeys(Map.of());

        Engine gpt = factory.create("gpt-4o-mini");

        assertThat(gpt.isAvailable()).isFalse();
    }

    @Test
    void shouldReportEngineUnavailableWithoutTransport() {
        EngineFactory bare = new EngineFactory(EngineTransports.none(), properties);

        assertThat(bare.create("gpt-4o").isAvailable()).isFalse();
    }

    @Test
    void shouldRejectBlankName() {
        assertThatThrownBy(() -> factory.create("  "))
                .isInstanceOf(EngineConfigurationException.class)
                .hasMessageContaining("must not be blank");
    }

    @Test
    void shouldRejectLocalEngineWithoutEndpoint() {
        properties.setLocalEndpoint(null);

        assertThatThrownBy(() -> factory.create("tinyllama"))
                .isInstanceOf(EngineConfigurationException.class)
                .hasMessageContaining("endpoint");
    }

    @Test
    void shouldSkipUnbuildableNamesAndDuplicates() {
        properties.setLocalEndpoint("");

        Map<String, Engine> engines = factory.createEngines(List.of("gpt-4o", "tinyllama", "claude-haiku", "gpt-4o"));

        assertThat(engines.keySet()).containsExactly("gpt-4o", "claude-haiku");
    }

    @Test
    void shouldReturnConfiguredDefaults() {
        assertThat(factory.defaultEngineNames()).containsExactly("gpt-4o-mini", "claude-haiku");
    }
}
