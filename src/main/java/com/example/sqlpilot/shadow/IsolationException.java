package com.example.sqlpilot.shadow;

import com.example.sqlpilot.exception.SqlPilotException;

/**
 * Changes made during an attempt could not be undone. The request cannot continue safely.
 */
public class IsolationException extends SqlPilotException {

    public IsolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
