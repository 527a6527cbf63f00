package com.example.sqlpilot.model;

public enum OutcomeStatus {
    ACCEPTED,
    EXHAUSTED,
    FATAL_ERROR,
    CANCELLED
}
