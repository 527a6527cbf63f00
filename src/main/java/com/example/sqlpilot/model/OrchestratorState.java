package com.example.sqlpilot.model;

public enum OrchestratorState {
    DIAGNOSING,
    PROPOSING,
    VALIDATING,
    RETRY_WITH_FEEDBACK,
    ACCEPTED,
    EXHAUSTED,
    FATAL_ERROR,
    CANCELLED;

    public boolean isTerminal() {
        return this == ACCEPTED || this == EXHAUSTED || this == FATAL_ERROR || this == CANCELLED;
    }
}
