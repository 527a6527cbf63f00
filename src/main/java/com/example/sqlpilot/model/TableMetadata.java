package com.example.sqlpilot.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class TableMetadata {
    String name;
    @Singular
    List<ColumnMetadata> columns;
    @Singular
    List<IndexMetadata> indexes;
    Long estimatedRows;

    public boolean isLeadingIndexColumn(String column) {
        return indexes.stream().anyMatch(index -> index.leadsWith(column));
    }

    public boolean isIndexed(String column) {
        return indexes.stream().anyMatch(index -> index.covers(column));
    }
}
