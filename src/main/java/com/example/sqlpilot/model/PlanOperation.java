package com.example.sqlpilot.model;

import lombok.Builder;
import lombok.Value;

/**
 * One access step of an execution plan: which table is read, how, and through which index.
 */
@Value
@Builder
public class PlanOperation {

    public enum AccessType {
        FULL_SCAN,
        INDEX_SCAN,
        INDEX_LOOKUP,
        OTHER
    }

    String table;
    AccessType accessType;
    String index;
    Long estimatedRows;
    String extra;

    public boolean isFullScan() {
        return accessType == AccessType.FULL_SCAN;
    }
}
