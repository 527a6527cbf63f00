package com.example.sqlpilot.shadow;

import java.util.UUID;

import com.example.sqlpilot.model.Dialect;

/**
 * A request's private view of the shadow database. Closing it more than once has no further effect.
 */
public interface IsolationScope extends AutoCloseable {

    UUID getRequestId();

    Dialect getDialect();

    /**
     * Starts attempt {@code attempt}. Only one attempt may be open at a time, and everything it
     * changes is rolled back when it closes.
     */
    AttemptScope beginAttempt(int attempt);

    boolean isReleased();

    @Override
    void close();
}
