package com.phillippitts.multishot.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Where and how run results are persisted.
 */
@ConfigurationProperties(prefix = "multishot.output")
@Validated
public class OutputProperties {

    public enum Strategy { FOLDERS, NONE }

    @NotNull
    private Strategy strategy = Strategy.FOLDERS;

    @NotBlank
    private String baseDir = "./multi-shot-results";

    /** Delete run folders older than {@link #maxAgeDays} when the sink initializes. */
    private boolean cleanupOld = false;

    @Positive
    private int maxAgeDays = 7;

    public Strategy getStrategy() {
        return strategy;
    }

    public void setStrategy(Strategy strategy) {
        this.strategy = strategy;
    }

    public String getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(String baseDir) {
        this.baseDir = baseDir;
    }

    public boolean isCleanupOld() {
        return cleanupOld;
    }

    public void setCleanupOld(boolean cleanupOld) {
        this.cleanupOld = cleanupOld;
    }

    public int getMaxAgeDays() {
        return maxAgeDays;
    }

    public void setMaxAgeDays(int maxAgeDays) {
        this.maxAgeDays = maxAgeDays;
    }
}
