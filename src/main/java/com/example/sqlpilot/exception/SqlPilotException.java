package com.example.sqlpilot.exception;

public class SqlPilotException extends RuntimeException {

    public SqlPilotException(String message) {
        super(message);
    }

    public SqlPilotException(String message, Throwable cause) {
        super(message, cause);
    }
}
