package com.phillippitts.multishot.service.metrics;

/**
 * Execution policy a run was performed under.
 */
public record RunContext(boolean concurrent, int maxConcurrency, long timeoutMs, int retries) {}
