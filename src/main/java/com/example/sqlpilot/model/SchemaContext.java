package com.example.sqlpilot.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only metadata for the tables a query touches, keyed case-insensitively by table name.
 */
public final class SchemaContext {

    private final Map<String, TableMetadata> tables;

    private SchemaContext(Map<String, TableMetadata> tables) {
        this.tables = Collections.unmodifiableMap(tables);
    }

    public static SchemaContext of(Iterable<TableMetadata> tables) {
        Map<String, TableMetadata> byName = new LinkedHashMap<>();
        for (TableMetadata table : tables) {
            byName.put(table.getName().toLowerCase(Locale.ROOT), table);
        }
        return new SchemaContext(byName);
    }

    public static SchemaContext empty() {
        return new SchemaContext(new LinkedHashMap<>());
    }

    public Optional<TableMetadata> table(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tables.get(unqualified(name).toLowerCase(Locale.ROOT)));
    }

    public Map<String, TableMetadata> getTables() {
        return tables;
    }

    public boolean isEmpty() {
        return tables.isEmpty();
    }

    private static String unqualified(String name) {
        String cleaned = name.replace("\"", "").replace("`", "");
        int dot = cleaned.lastIndexOf('.');
        return dot >= 0 ? cleaned.substring(dot + 1) : cleaned;
    }
}
