package com.phillippitts.multishot.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Archiving of performance records as JSON files.
 */
@ConfigurationProperties(prefix = "multishot.metrics")
@Validated
public class MetricsStoreProperties {

    private boolean persist = false;

    @NotBlank
    private String directory = "./multi-shot-metrics";

    public boolean isPersist() {
        return persist;
    }

    public void setPersist(boolean persist) {
        this.persist = persist;
    }

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }
}
