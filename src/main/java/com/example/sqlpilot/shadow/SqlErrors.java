package com.example.sqlpilot.shadow;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;

import com.example.sqlpilot.exception.CollaboratorUnavailableException;
import com.example.sqlpilot.exception.CollaboratorUnavailableException.Collaborator;
import com.example.sqlpilot.exception.ShadowExecutionException;
import com.example.sqlpilot.exception.SqlPilotException;

final class SqlErrors {

    private SqlErrors() {
    }

    static SqlPilotException translate(SQLException e, String action) {
        String state = e.getSQLState();
        if (e instanceof SQLTimeoutException || "57014".equals(state) || "70100".equals(state)) {
            return new ShadowExecutionException(action + " timed out: " + e.getMessage(), true, e);
        }
        if (isConnectionFailure(e)) {
            return new CollaboratorUnavailableException(Collaborator.DATABASE,
                    "Shadow database unavailable: " + e.getMessage(), e);
        }
        return new ShadowExecutionException(action + " failed: " + e.getMessage(), false, e);
    }

    static boolean isConnectionFailure(SQLException e) {
        String state = e.getSQLState();
        return (state != null && state.startsWith("08"))
                || e instanceof SQLTransientConnectionException
                || e instanceof SQLNonTransientConnectionException
                || e instanceof SQLRecoverableException;
    }
}
