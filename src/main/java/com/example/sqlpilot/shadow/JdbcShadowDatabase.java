package com.example.sqlpilot.shadow;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.time.Duration;
import java.util.UUID;

import javax.sql.DataSource;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.example.sqlpilot.config.ShadowDatabaseProperties;
import com.example.sqlpilot.exception.CollaboratorUnavailableException;
import com.example.sqlpilot.exception.CollaboratorUnavailableException.Collaborator;
import com.example.sqlpilot.model.Dialect;

import lombok.extern.slf4j.Slf4j;

/**
 * Shadow database reached through the pooled {@link DataSource}. Each isolation scope holds one
 * connection in a single open transaction that is always rolled back. Where index DDL commits
 * implicitly, scopes share {@link TableLocks} so an applied index is never seen by another request.
 */
@Slf4j
@Component
public class JdbcShadowDatabase implements ShadowDatabase {

    static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofMinutes(2);

    private final DataSource dataSource;
    private final Dialect dialect;
    private final TableLocks tableLocks;
    private final Duration lockTimeout;

    @Autowired
    public JdbcShadowDatabase(DataSource dataSource, ShadowDatabaseProperties properties) {
        this(dataSource, Dialect.fromName(properties.getDialect()), properties.getLockTimeout());
    }

    public JdbcShadowDatabase(DataSource dataSource, Dialect dialect) {
        this(dataSource, dialect, DEFAULT_LOCK_TIMEOUT);
    }

    public JdbcShadowDatabase(DataSource dataSource, Dialect dialect, Duration lockTimeout) {
        this.dataSource = dataSource;
        this.dialect = dialect;
        this.tableLocks = dialect.ddlCommitsImplicitly() ? new TableLocks() : null;
        this.lockTimeout = lockTimeout != null ? lockTimeout : DEFAULT_LOCK_TIMEOUT;
    }

    @Override
    public Dialect getDialect() {
        return dialect;
    }

    @Override
    public IsolationScope createIsolationScope(UUID requestId) {
        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLException e) {
            throw new CollaboratorUnavailableException(Collaborator.DATABASE,
                    "Cannot obtain shadow database connection: " + e.getMessage(), e);
        }
        try {
            connection.setAutoCommit(false);
            connection.setTransactionIsolation(Connection.TRANSACTION_REPEATABLE_READ);
        } catch (SQLException e) {
            closeQuietly(connection, requestId);
            throw new CollaboratorUnavailableException(Collaborator.DATABASE,
                    "Cannot prepare isolation scope: " + e.getMessage(), e);
        }
        log.debug("Opened isolation scope for request {}", requestId);
        return new JdbcIsolationScope(requestId, dialect, connection, tableLocks, lockTimeout);
    }

    @Override
    public String describe() {
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            return metaData.getDatabaseProductName() + " " + metaData.getDatabaseProductVersion();
        } catch (SQLException e) {
            throw new CollaboratorUnavailableException(Collaborator.DATABASE,
                    "Shadow database unavailable: " + e.getMessage(), e);
        }
    }

    private static void closeQuietly(Connection connection, UUID requestId) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close connection for request {}: {}", requestId, e.getMessage());
        }
    }
}
