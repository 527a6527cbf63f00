package com.example.sqlpilot.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class IndexMetadata {
    String name;
    boolean unique;
    @Singular
    List<String> columns;

    public boolean leadsWith(String column) {
        return !columns.isEmpty() && columns.get(0).equalsIgnoreCase(column);
    }

    public boolean covers(String column) {
        return columns.stream().anyMatch(c -> c.equalsIgnoreCase(column));
    }
}
