package com.example.sqlpilot.model;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Canonical form of a result set: its digest plus the rows themselves when the set is small
 * enough to keep.
 */
@Value
@Builder(toBuilder = true)
public class CanonicalResult {
    String digest;
    long rowCount;
    List<String> columns;
    boolean ordered;
    boolean truncated;
    /** Normalized row values, or an empty list when the set exceeded the retention limit. */
    List<List<Object>> retainedRows;

    public boolean isFullyRetained() {
        return retainedRows.size() == rowCount;
    }
}
