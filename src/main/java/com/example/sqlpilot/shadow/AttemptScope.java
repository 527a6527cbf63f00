package com.example.sqlpilot.shadow;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import com.example.sqlpilot.model.Dialect;
import com.example.sqlpilot.model.TableMetadata;

public interface AttemptScope extends AutoCloseable {

    int getAttempt();

    Dialect getDialect();

    /**
     * Runs a query and streams at most {@code maxRows} rows into {@code sink}.
     *
     * @throws com.example.sqlpilot.exception.ShadowExecutionException if the statement fails or
     *         exceeds {@code timeout}
     */
    ExecutionStats execute(String sql, Duration timeout, int maxRows, RowSink sink);

    List<Map<String, Object>> explain(String sql, Duration timeout);

    /**
     * Creates an index that is dropped again when this attempt closes.
     */
    void applyIndex(String ddl, String indexName, String tableName, Duration timeout);

    /**
     * True while an index applied by this attempt still exists.
     */
    boolean hasAppliedIndexes();

    /**
     * Reads column, index and row-count metadata, or returns null if the table does not exist.
     */
    TableMetadata describeTable(String schema, String table);

    /**
     * @throws IsolationException if the attempt's changes could not be undone
     */
    @Override
    void close();
}
