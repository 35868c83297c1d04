package com.phillippitts.multishot.service.runner;

/**
 * Per-request overrides of the configured run policy. Null fields keep the configured value.
 *
 * @param concurrent      dispatch mode
 * @param maxConcurrency  gate capacity
 * @param timeoutMs       per-attempt timeout, 0 for none
 * @param retries         extra attempts after the first
 * @param continueOnError keep going after a terminal failure
 * @param saveOutput      false to skip the result sink for this run
 */
public record RunOptions(
        Boolean concurrent,
        Integer maxConcurrency,
        Long timeoutMs,
        Integer retries,
        Boolean continueOnError,
        Boolean saveOutput
) {
    public static final RunOptions DEFAULTS = new RunOptions(null, null, null, null, null, null);
}
