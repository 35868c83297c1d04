package com.phillippitts.multishot.exception;

import com.phillippitts.multishot.domain.EngineResponse;

import java.util.Map;

/**
 * Raised by the runner when {@code continueOnError} is disabled and an engine reaches a
 * terminal failure. Carries the offending engine and the results gathered before the abort.
 */
public class RunAbortedException extends MultiShotException {

    private final String engineName;
    private final String engineError;
    private final transient Map<String, EngineResponse> partialResults;

    public RunAbortedException(String engineName, String engineError, Map<String, EngineResponse> partialResults) {
        super("Engine " + engineName + " failed: " + engineError);
        this.engineName = engineName;
        this.engineError = engineError;
        this.partialResults = partialResults == null ? Map.of() : Map.copyOf(partialResults);
    }

    public String getEngineName() {
        return engineName;
    }

    public String getEngineError() {
        return engineError;
    }

    public Map<String, EngineResponse> getPartialResults() {
        return partialResults;
    }
}
