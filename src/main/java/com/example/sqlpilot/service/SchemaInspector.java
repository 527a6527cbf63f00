package com.example.sqlpilot.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Service;

import com.example.sqlpilot.model.SchemaContext;
import com.example.sqlpilot.model.TableMetadata;
import com.example.sqlpilot.shadow.AttemptScope;
import com.example.sqlpilot.util.TableCollector;

import lombok.extern.slf4j.Slf4j;

/**
 * Loads metadata for the tables a query reads. Table metadata is cached across requests and never
 * modified once loaded. Metadata read while the calling attempt has an index applied is not cached.
 */
@Slf4j
@Service
public class SchemaInspector {

    private final Map<String, TableMetadata> cache = new ConcurrentHashMap<>();

    public SchemaContext inspect(String sql, String schema, AttemptScope scope) {
        List<TableMetadata> tables = new ArrayList<>();
        for (String table : TableCollector.collectTables(sql)) {
            String key = cacheKey(schema, table);
            TableMetadata metadata = cache.get(key);
            if (metadata == null) {
                metadata = scope.describeTable(schema, table);
                if (metadata == null) {
                    log.debug("No metadata found for table {}", table);
                    continue;
                }
                if (scope.hasAppliedIndexes()) {
                    // an index applied during validation is not part of the schema
                    log.debug("Not caching metadata of {} read while an index attempt is open", table);
                } else {
                    TableMetadata existing = cache.putIfAbsent(key, metadata);
                    if (existing != null) {
                        metadata = existing;
                    }
                }
            }
            tables.add(metadata);
        }
        return SchemaContext.of(tables);
    }

    void evictAll() {
        cache.clear();
    }

    int cachedTableCount() {
        return cache.size();
    }

    private static String cacheKey(String schema, String table) {
        return (schema == null ? "" : schema.toLowerCase(Locale.ROOT)) + "|" + table.toLowerCase(Locale.ROOT);
    }
}
