package com.phillippitts.multishot.exception;

/**
 * Thrown by a completion transport when a backend call fails.
 * Engines convert it into an error-bearing response; it never leaves a dispatch.
 */
public class EngineExecutionException extends MultiShotException {

    private final String engineName;

    public EngineExecutionException(String message) {
        super(message);
        this.engineName = "unknown";
    }

    public EngineExecutionException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public EngineExecutionException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
