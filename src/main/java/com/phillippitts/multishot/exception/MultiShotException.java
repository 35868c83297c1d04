package com.phillippitts.multishot.exception;

/**
 * Base exception for all multishot application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class MultiShotException extends RuntimeException {

    public MultiShotException(String message) {
        super(message);
    }

    public MultiShotException(String message, Throwable cause) {
        super(message, cause);
    }

    public MultiShotException(Throwable cause) {
        super(cause);
    }
}
