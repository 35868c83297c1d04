package com.phillippitts.multishot.exception;

/**
 * Thrown when a result sink cannot prepare or write its output.
 */
public class ResultSinkException extends MultiShotException {

    private final String location;

    public ResultSinkException(String location, Throwable cause) {
        super("Failed to write run output to " + location + ": " + cause.getMessage(), cause);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
