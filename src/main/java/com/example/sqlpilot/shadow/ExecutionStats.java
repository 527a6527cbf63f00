package com.example.sqlpilot.shadow;

import lombok.Value;

@Value
public class ExecutionStats {
    long rowCount;
    double elapsedMs;
    /** More rows were available than the configured cap allowed to be read. */
    boolean truncated;
}
