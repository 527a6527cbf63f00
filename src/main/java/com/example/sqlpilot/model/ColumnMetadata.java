package com.example.sqlpilot.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ColumnMetadata {
    String name;
    String type;
    boolean nullable;
}
