package com.phillippitts.multishot;

import com.phillippitts.multishot.config.IntegrationTestConfiguration;
import com.phillippitts.multishot.service.runner.MultiShotService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import static org.assertj.core.api.Assertions.assertThat;

@Import(IntegrationTestConfiguration.class)
@SpringBootTest
class MultiShotApplicationTests {

    @Autowired
    private MultiShotService service;

    @Test
    void contextLoads() {
        assertThat(service.engineStatus(null)).containsOnlyKeys("gpt-4o-mini", "claude-haiku");
        assertThat(service.engineStatus(null).values()).containsOnly(true);
    }
}
