package com.example.sqlpilot.model;

import java.time.Instant;
import java.util.UUID;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OptimizationRequest {
    @Builder.Default
    UUID id = UUID.randomUUID();
    String originalSql;
    Dialect dialect;
    String schema;
    @Builder.Default
    Instant createdAt = Instant.now();
}
