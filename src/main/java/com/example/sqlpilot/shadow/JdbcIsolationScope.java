package com.example.sqlpilot.shadow;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import com.example.sqlpilot.exception.SqlPilotException;
import com.example.sqlpilot.model.ColumnMetadata;
import com.example.sqlpilot.model.Dialect;
import com.example.sqlpilot.model.IndexMetadata;
import com.example.sqlpilot.model.TableMetadata;
import com.example.sqlpilot.util.TableCollector;

import lombok.extern.slf4j.Slf4j;

@Slf4j
class JdbcIsolationScope implements IsolationScope {

    private final UUID requestId;
    private final Dialect dialect;
    private final Connection connection;
    /** Null where index DDL stays inside the transaction. */
    private final TableLocks tableLocks;
    private final Duration lockTimeout;
    private final AtomicBoolean released = new AtomicBoolean();
    private JdbcAttemptScope openAttempt;

    JdbcIsolationScope(UUID requestId, Dialect dialect, Connection connection) {
        this(requestId, dialect, connection, null, null);
    }

    JdbcIsolationScope(UUID requestId, Dialect dialect, Connection connection, TableLocks tableLocks,
                       Duration lockTimeout) {
        this.requestId = requestId;
        this.dialect = dialect;
        this.connection = connection;
        this.tableLocks = tableLocks;
        this.lockTimeout = lockTimeout;
    }

    @Override
    public UUID getRequestId() {
        return requestId;
    }

    @Override
    public Dialect getDialect() {
        return dialect;
    }

    @Override
    public synchronized AttemptScope beginAttempt(int attempt) {
        if (released.get()) {
            throw new IllegalStateException("Isolation scope for request " + requestId + " is already released");
        }
        if (openAttempt != null && !openAttempt.closed) {
            throw new IllegalStateException("Attempt " + openAttempt.attempt + " is still open");
        }
        try {
            openAttempt = new JdbcAttemptScope(attempt, connection.setSavepoint("attempt_" + attempt));
            return openAttempt;
        } catch (SQLException e) {
            throw SqlErrors.translate(e, "Starting attempt " + attempt);
        }
    }

    @Override
    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        synchronized (this) {
            if (openAttempt != null && !openAttempt.closed) {
                try {
                    openAttempt.close();
                } catch (IsolationException e) {
                    log.error("Releasing scope for request {} with attempt {} not undone: {}", requestId,
                            openAttempt.attempt, e.getMessage());
                }
            }
        }
        if (!released.compareAndSet(false, true)) {
            return;
        }
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed while releasing scope for request {}: {}", requestId, e.getMessage());
        } finally {
            try {
                connection.close();
            } catch (SQLException e) {
                log.warn("Failed to close connection for request {}: {}", requestId, e.getMessage());
            }
        }
        log.debug("Released isolation scope for request {}", requestId);
    }

    private List<String> tablesOf(String sql) {
        if (tableLocks == null) {
            return Collections.emptyList();
        }
        try {
            return TableCollector.collectTables(sql);
        } catch (SqlPilotException e) {
            log.debug("No table locks for unparsable statement: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    private void lockShared(List<String> tables) {
        if (tableLocks != null && !tables.isEmpty()) {
            tableLocks.acquireShared(requestId, tables, lockTimeout);
        }
    }

    private void unlockShared(List<String> tables) {
        if (tableLocks != null && !tables.isEmpty()) {
            tableLocks.releaseShared(requestId, tables);
        }
    }

    private static int timeoutSeconds(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return 0;
        }
        return (int) Math.max(1, (timeout.toMillis() + 999) / 1000);
    }

    private class JdbcAttemptScope implements AttemptScope {

        private final int attempt;
        private final Savepoint savepoint;
        private final Deque<String[]> appliedIndexes = new ArrayDeque<>();
        private final List<String> lockedTables = new ArrayList<>();
        private int nestedSavepoints;
        private boolean closed;

        JdbcAttemptScope(int attempt, Savepoint savepoint) {
            this.attempt = attempt;
            this.savepoint = savepoint;
        }

        @Override
        public int getAttempt() {
            return attempt;
        }

        @Override
        public Dialect getDialect() {
            return dialect;
        }

        @Override
        public ExecutionStats execute(String sql, Duration timeout, int maxRows, RowSink sink) {
            checkOpen();
            List<String> tables = tablesOf(sql);
            lockShared(tables);
            try (Statement statement = connection.createStatement()) {
                statement.setQueryTimeout(timeoutSeconds(timeout));
                if (maxRows > 0 && maxRows < Integer.MAX_VALUE) {
                    statement.setMaxRows(maxRows + 1);
                }
                long started = System.nanoTime();
                long rowCount = 0;
                boolean truncated = false;
                try (ResultSet rs = statement.executeQuery(sql)) {
                    ResultSetMetaData metaData = rs.getMetaData();
                    int columnCount = metaData.getColumnCount();
                    List<String> columns = new ArrayList<>(columnCount);
                    for (int i = 1; i <= columnCount; i++) {
                        columns.add(metaData.getColumnLabel(i));
                    }
                    sink.begin(columns);
                    while (rs.next()) {
                        if (rowCount == maxRows) {
                            truncated = true;
                            break;
                        }
                        Object[] row = new Object[columnCount];
                        for (int i = 1; i <= columnCount; i++) {
                            row[i - 1] = rs.getObject(i);
                        }
                        sink.accept(row);
                        rowCount++;
                    }
                }
                double elapsedMs = (System.nanoTime() - started) / 1_000_000.0;
                return new ExecutionStats(rowCount, elapsedMs, truncated);
            } catch (SQLException e) {
                throw SqlErrors.translate(e, "Query");
            } finally {
                unlockShared(tables);
            }
        }

        @Override
        public List<Map<String, Object>> explain(String sql, Duration timeout) {
            checkOpen();
            List<String> tables = tablesOf(sql);
            lockShared(tables);
            Savepoint nested;
            try {
                nested = nestedSavepoint();
            } catch (RuntimeException e) {
                unlockShared(tables);
                throw e;
            }
            try (Statement statement = connection.createStatement()) {
                statement.setQueryTimeout(timeoutSeconds(timeout));
                List<Map<String, Object>> rows = new ArrayList<>();
                try (ResultSet rs = statement.executeQuery(dialect.explain(sql))) {
                    ResultSetMetaData metaData = rs.getMetaData();
                    while (rs.next()) {
                        Map<String, Object> row = new LinkedHashMap<>();
                        for (int i = 1; i <= metaData.getColumnCount(); i++) {
                            row.put(metaData.getColumnLabel(i), rs.getObject(i));
                        }
                        rows.add(row);
                    }
                }
                return rows;
            } catch (SQLException e) {
                rollbackNested(nested);
                throw SqlErrors.translate(e, "Explain");
            } finally {
                unlockShared(tables);
            }
        }

        @Override
        public void applyIndex(String ddl, String indexName, String tableName, Duration timeout) {
            checkOpen();
            boolean locked = false;
            if (tableLocks != null) {
                tableLocks.acquireExclusive(requestId, tableName, lockTimeout);
                locked = true;
                lockedTables.add(tableName);
            }
            try (Statement statement = connection.createStatement()) {
                statement.setQueryTimeout(timeoutSeconds(timeout));
                statement.execute(ddl);
                appliedIndexes.push(new String[] {indexName, tableName});
                log.debug("Applied index {} on {} for request {} attempt {}", indexName, tableName, requestId, attempt);
            } catch (SQLException e) {
                if (locked && !indexOn(tableName)) {
                    releaseExclusive(tableName);
                }
                throw SqlErrors.translate(e, "Index creation");
            }
        }

        @Override
        public boolean hasAppliedIndexes() {
            return !appliedIndexes.isEmpty();
        }

        @Override
        public TableMetadata describeTable(String schema, String table) {
            checkOpen();
            List<String> tables = tableLocks != null ? List.of(table) : Collections.<String>emptyList();
            lockShared(tables);
            try {
                DatabaseMetaData metaData = connection.getMetaData();
                String catalog = dialect == Dialect.MYSQL ? connection.getCatalog() : null;
                for (String candidate : nameVariants(table)) {
                    List<ColumnMetadata> columns = readColumns(metaData, catalog, schema, candidate);
                    if (!columns.isEmpty()) {
                        return TableMetadata.builder()
                                .name(candidate)
                                .columns(columns)
                                .indexes(readIndexes(metaData, catalog, schema, candidate))
                                .estimatedRows(estimateRows(candidate))
                                .build();
                    }
                }
                return null;
            } catch (SQLException e) {
                throw SqlErrors.translate(e, "Reading metadata of " + table);
            } finally {
                unlockShared(tables);
            }
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            SQLException failure = null;
            try {
                connection.rollback(savepoint);
            } catch (SQLException e) {
                // DDL commits implicitly on some engines, which discards the savepoint
                log.debug("Savepoint rollback failed for request {} attempt {}: {}", requestId, attempt, e.getMessage());
                try {
                    connection.rollback();
                } catch (SQLException fallback) {
                    failure = fallback;
                }
            }
            while (!appliedIndexes.isEmpty()) {
                String[] index = appliedIndexes.pop();
                try (Statement statement = connection.createStatement()) {
                    statement.setQueryTimeout(timeoutSeconds(lockTimeout));
                    statement.execute(dialect.dropIndex(index[0], index[1]));
                    log.debug("Dropped index {} for request {} attempt {}", index[0], requestId, attempt);
                } catch (SQLException e) {
                    if (!indexGone(index[0], index[1])) {
                        if (failure == null) {
                            failure = e;
                        } else {
                            failure.addSuppressed(e);
                        }
                    }
                }
            }
            if (failure != null) {
                // the index may still exist, so other requests stay locked out of its table
                throw new IsolationException("Attempt " + attempt + " of request " + requestId
                        + " could not be rolled back", failure);
            }
            for (String table : new ArrayList<>(lockedTables)) {
                releaseExclusive(table);
            }
        }

        private void releaseExclusive(String table) {
            tableLocks.releaseExclusive(requestId, table);
            lockedTables.remove(table);
        }

        private boolean indexOn(String tableName) {
            for (String[] index : appliedIndexes) {
                if (index[1].equalsIgnoreCase(tableName)) {
                    return true;
                }
            }
            return false;
        }

        private void checkOpen() {
            if (closed || released.get()) {
                throw new IllegalStateException("Attempt " + attempt + " of request " + requestId + " is closed");
            }
        }

        private Savepoint nestedSavepoint() {
            try {
                return connection.setSavepoint("attempt_" + attempt + "_" + (++nestedSavepoints));
            } catch (SQLException e) {
                throw SqlErrors.translate(e, "Savepoint");
            }
        }

        private void rollbackNested(Savepoint nested) {
            try {
                connection.rollback(nested);
            } catch (SQLException e) {
                log.debug("Nested savepoint rollback failed: {}", e.getMessage());
            }
        }

        private boolean indexGone(String indexName, String tableName) {
            try {
                String catalog = dialect == Dialect.MYSQL ? connection.getCatalog() : null;
                DatabaseMetaData metaData = connection.getMetaData();
                for (String candidate : nameVariants(tableName)) {
                    for (IndexMetadata index : readIndexes(metaData, catalog, null, candidate)) {
                        if (index.getName().equalsIgnoreCase(indexName)) {
                            return false;
                        }
                    }
                }
                return true;
            } catch (SQLException e) {
                return false;
            }
        }

        private List<ColumnMetadata> readColumns(DatabaseMetaData metaData, String catalog, String schema,
                                                 String table) throws SQLException {
            List<ColumnMetadata> columns = new ArrayList<>();
            try (ResultSet rs = metaData.getColumns(catalog, schema, table, null)) {
                while (rs.next()) {
                    columns.add(ColumnMetadata.builder()
                            .name(rs.getString("COLUMN_NAME"))
                            .type(rs.getString("TYPE_NAME"))
                            .nullable(rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls)
                            .build());
                }
            }
            return columns;
        }

        private List<IndexMetadata> readIndexes(DatabaseMetaData metaData, String catalog, String schema,
                                                String table) throws SQLException {
            Map<String, IndexMetadata.IndexMetadataBuilder> byName = new LinkedHashMap<>();
            try (ResultSet rs = metaData.getIndexInfo(catalog, schema, table, false, true)) {
                while (rs.next()) {
                    String name = rs.getString("INDEX_NAME");
                    String column = rs.getString("COLUMN_NAME");
                    if (name == null || column == null) {
                        continue;
                    }
                    boolean unique = !rs.getBoolean("NON_UNIQUE");
                    byName.computeIfAbsent(name, n -> IndexMetadata.builder().name(n).unique(unique))
                            .column(column);
                }
            }
            List<IndexMetadata> indexes = new ArrayList<>();
            byName.values().forEach(builder -> indexes.add(builder.build()));
            return indexes;
        }

        private Long estimateRows(String table) throws SQLException {
            String query;
            switch (dialect) {
                case MYSQL:
                    query = "SELECT table_rows FROM information_schema.tables "
                            + "WHERE table_schema = DATABASE() AND table_name = ?";
                    break;
                case POSTGRESQL:
                    query = "SELECT reltuples::bigint FROM pg_class WHERE relname = ? AND relkind = 'r'";
                    break;
                case H2:
                default:
                    query = "SELECT ROW_COUNT_ESTIMATE FROM INFORMATION_SCHEMA.TABLES WHERE TABLE_NAME = ?";
            }
            Savepoint nested = nestedSavepoint();
            try (PreparedStatement statement = connection.prepareStatement(query)) {
                statement.setString(1, table);
                try (ResultSet rs = statement.executeQuery()) {
                    if (rs.next()) {
                        long rows = rs.getLong(1);
                        return rs.wasNull() || rows < 0 ? null : rows;
                    }
                    return null;
                }
            } catch (SQLException e) {
                if (SqlErrors.isConnectionFailure(e)) {
                    throw e;
                }
                rollbackNested(nested);
                log.debug("No row estimate for {}: {}", table, e.getMessage());
                return null;
            }
        }
    }

    private static List<String> nameVariants(String table) {
        List<String> variants = new ArrayList<>();
        String cleaned = table.replace("\"", "").replace("`", "");
        int dot = cleaned.lastIndexOf('.');
        if (dot >= 0) {
            cleaned = cleaned.substring(dot + 1);
        }
        variants.add(cleaned);
        String upper = cleaned.toUpperCase(Locale.ROOT);
        String lower = cleaned.toLowerCase(Locale.ROOT);
        if (!variants.contains(upper)) {
            variants.add(upper);
        }
        if (!variants.contains(lower)) {
            variants.add(lower);
        }
        return variants;
    }
}
