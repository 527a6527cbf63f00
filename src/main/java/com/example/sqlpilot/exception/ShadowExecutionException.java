package com.example.sqlpilot.exception;

/**
 * A statement failed or timed out inside the shadow environment.
 */
public class ShadowExecutionException extends SqlPilotException {

    private final boolean timeout;

    public ShadowExecutionException(String message, boolean timeout, Throwable cause) {
        super(message, cause);
        this.timeout = timeout;
    }

    public ShadowExecutionException(String message) {
        this(message, false, null);
    }

    public boolean isTimeout() {
        return timeout;
    }
}
