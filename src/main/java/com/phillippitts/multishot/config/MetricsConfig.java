package com.phillippitts.multishot.config;

import com.phillippitts.multishot.config.properties.MetricsStoreProperties;
import com.phillippitts.multishot.service.metrics.PerformanceArchive;
import com.phillippitts.multishot.service.metrics.PerformanceTracker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the shared performance tracker. With {@code multishot.metrics.persist=true} records are
 * archived as JSON and earlier records are loaded at startup.
 */
@Configuration
public class MetricsConfig {

    private static final Logger LOG = LogManager.getLogger(MetricsConfig.class);

    @Bean
    public PerformanceTracker performanceTracker(MetricsStoreProperties properties) {
        if (!properties.isPersist()) {
            return new PerformanceTracker();
        }
        PerformanceArchive archive = new PerformanceArchive(Path.of(properties.getDirectory()));
        PerformanceTracker tracker = new PerformanceTracker(archive, Clock.systemUTC());
        try {
            tracker.loadHistory();
        } catch (RuntimeException e) {
            LOG.warn("Could not load archived performance records from {}: {}", archive.getDirectory(), e.getMessage());
        }
        return tracker;
    }
}
