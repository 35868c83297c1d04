package com.phillippitts.multishot.exception;

/**
 * Thrown when a run request is rejected before any engine is dispatched
 * (blank prompt, no resolvable engines, out-of-range policy values).
 */
public class InvalidPromptException extends MultiShotException {

    private final String reason;

    public InvalidPromptException(String reason) {
        super("Invalid run request: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
