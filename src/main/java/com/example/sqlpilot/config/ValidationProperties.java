package com.example.sqlpilot.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.example.sqlpilot.model.VerificationSettings;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
@Validated
@ConfigurationProperties(prefix = "sqlpilot.validation")
public class ValidationProperties {

    @Min(value = 1, message = "max-attempts must be at least 1")
    private int maxAttempts = 3;

    @DecimalMin(value = "1.0", message = "min-speedup must be at least 1.0")
    private double minSpeedup = 1.05;

    @Min(value = 1, message = "timing-repeat-count must be at least 1")
    private int timingRepeatCount = 3;

    @DecimalMin(value = "0.0", message = "variance-tolerance must not be negative")
    private double varianceTolerance = 0.5;

    @DecimalMin(value = "0.0", inclusive = false, message = "float-epsilon must be positive")
    private double floatEpsilon = 1e-9;

    @NotNull
    private Duration executionTimeout = Duration.ofSeconds(30);

    @NotNull
    private Duration proposalTimeout = Duration.ofSeconds(60);

    @Min(value = 1, message = "max-result-rows must be at least 1")
    private int maxResultRows = 100_000;

    @Min(value = 0, message = "retained-row-limit must not be negative")
    private int retainedRowLimit = 1_000;

    @Min(value = 0, message = "full-scan-row-threshold must not be negative")
    private long fullScanRowThreshold = 10_000;

    private List<String> forbiddenOperations = new ArrayList<>(List.of(
            "DROP", "TRUNCATE", "DELETE", "UPDATE", "INSERT", "ALTER", "GRANT", "REVOKE"));

    public VerificationSettings toSettings() {
        return VerificationSettings.builder()
                .maxAttempts(maxAttempts)
                .minSpeedup(minSpeedup)
                .timingRepeatCount(timingRepeatCount)
                .varianceTolerance(varianceTolerance)
                .floatEpsilon(floatEpsilon)
                .executionTimeout(executionTimeout)
                .proposalTimeout(proposalTimeout)
                .maxResultRows(maxResultRows)
                .retainedRowLimit(retainedRowLimit)
                .fullScanRowThreshold(fullScanRowThreshold)
                .build();
    }
}
