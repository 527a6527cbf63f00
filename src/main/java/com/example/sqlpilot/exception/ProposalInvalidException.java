package com.example.sqlpilot.exception;

public class ProposalInvalidException extends SqlPilotException {

    private final boolean timeout;

    public ProposalInvalidException(String message) {
        this(message, false, null);
    }

    public ProposalInvalidException(String message, boolean timeout, Throwable cause) {
        super(message, cause);
        this.timeout = timeout;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
