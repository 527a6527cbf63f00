package com.example.sqlpilot.model;

import java.time.Duration;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable thresholds for one orchestrator instance.
 */
@Value
@Builder(toBuilder = true)
public class VerificationSettings {
    @Builder.Default
    int maxAttempts = 3;
    @Builder.Default
    double minSpeedup = 1.05;
    @Builder.Default
    int timingRepeatCount = 3;
    @Builder.Default
    double varianceTolerance = 0.5;
    @Builder.Default
    double floatEpsilon = 1e-9;
    @Builder.Default
    Duration executionTimeout = Duration.ofSeconds(30);
    @Builder.Default
    Duration proposalTimeout = Duration.ofSeconds(60);
    @Builder.Default
    int maxResultRows = 100_000;
    @Builder.Default
    int retainedRowLimit = 1_000;
    @Builder.Default
    long fullScanRowThreshold = 10_000;

    public static VerificationSettings defaults() {
        return VerificationSettings.builder().build();
    }
}
