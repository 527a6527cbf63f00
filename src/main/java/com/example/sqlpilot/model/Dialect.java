package com.example.sqlpilot.model;

import java.util.Locale;

/**
 * Target database flavours the shadow environment knows how to explain and clean up after.
 */
public enum Dialect {

    MYSQL("EXPLAIN "),
    POSTGRESQL("EXPLAIN "),
    H2("EXPLAIN ");

    private final String explainPrefix;

    Dialect(String explainPrefix) {
        this.explainPrefix = explainPrefix;
    }

    public String explain(String sql) {
        return explainPrefix + sql;
    }

    /**
     * Statement that undoes a {@code CREATE INDEX} applied during a validation attempt.
     */
    public String dropIndex(String indexName, String tableName) {
        switch (this) {
            case MYSQL:
                return "DROP INDEX " + indexName + " ON " + tableName;
            case POSTGRESQL:
            case H2:
            default:
                return "DROP INDEX IF EXISTS " + indexName;
        }
    }

    /**
     * True where {@code CREATE INDEX} commits the open transaction, so an index applied during an
     * attempt is visible to other connections until it is dropped.
     */
    public boolean ddlCommitsImplicitly() {
        return this != POSTGRESQL;
    }

    public static Dialect fromName(String name) {
        if (name == null || name.isBlank()) {
            return MYSQL;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if ("POSTGRES".equals(normalized) || "PG".equals(normalized)) {
            return POSTGRESQL;
        }
        try {
            return Dialect.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported database: " + name, e);
        }
    }
}
