package com.example.sqlpilot.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DetectedIssue {
    IssueTag tag;
    String table;
    String column;
    String detail;

    public String describe() {
        StringBuilder sb = new StringBuilder(tag.getLabel());
        if (table != null) {
            sb.append(" on ").append(table);
            if (column != null) {
                sb.append('.').append(column);
            }
        } else if (column != null) {
            sb.append(" on ").append(column);
        }
        if (detail != null && !detail.isBlank()) {
            sb.append(": ").append(detail);
        }
        return sb.toString();
    }
}
