package com.example.sqlpilot.shadow;

import java.util.UUID;

import com.example.sqlpilot.model.Dialect;

/**
 * Copy of production data that candidate statements may be run against.
 */
public interface ShadowDatabase {

    Dialect getDialect();

    /**
     * Opens a private scope for one optimization request. Nothing done inside it is visible to
     * other requests, and everything is undone when it is released.
     *
     * @throws com.example.sqlpilot.exception.CollaboratorUnavailableException if the database
     *         cannot be reached
     */
    IsolationScope createIsolationScope(UUID requestId);

    default void release(IsolationScope scope) {
        scope.close();
    }

    /**
     * Product name and version of the shadow database, used by health checks.
     */
    String describe();
}
