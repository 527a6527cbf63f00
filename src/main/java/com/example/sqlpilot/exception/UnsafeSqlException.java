package com.example.sqlpilot.exception;

public class UnsafeSqlException extends SqlPilotException {

    public UnsafeSqlException(String message) {
        super(message);
    }

    public UnsafeSqlException(String message, Throwable cause) {
        super(message, cause);
    }
}
