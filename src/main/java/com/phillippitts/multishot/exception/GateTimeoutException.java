package com.phillippitts.multishot.exception;

/**
 * Thrown when a concurrency permit cannot be obtained within the requested wait.
 */
public class GateTimeoutException extends MultiShotException {

    private final long timeoutMs;

    public GateTimeoutException(long timeoutMs) {
        super("Concurrency gate acquire timeout after " + timeoutMs + "ms");
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
