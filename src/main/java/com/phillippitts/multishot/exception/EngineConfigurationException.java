package com.phillippitts.multishot.exception;

/**
 * Thrown when an engine definition cannot be turned into a usable engine
 * (missing model, local engine without endpoint, unknown type).
 */
public class EngineConfigurationException extends MultiShotException {

    private final String engineName;

    public EngineConfigurationException(String engineName, String reason) {
        super("Invalid configuration for engine '" + engineName + "': " + reason);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
