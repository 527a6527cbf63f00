package com.example.sqlpilot.model;

import java.util.List;
import java.util.Locale;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ShadowRunResult {
    Variant variant;
    String sql;
    CanonicalResult result;
    double elapsedMs;
    List<Double> samplesMs;
    double relativeSpread;
    ExecutionPlan plan;

    public long getRowCount() {
        return result.getRowCount();
    }

    public String getResultDigest() {
        return result.getDigest();
    }

    public String summary() {
        String digest = result.getDigest();
        return String.format("%s[rows=%d, median=%.2fms, spread=%.2f, digest=%s%s]",
                variant.name().toLowerCase(Locale.ROOT), result.getRowCount(), elapsedMs, relativeSpread,
                digest.length() > 12 ? digest.substring(0, 12) : digest,
                result.isTruncated() ? ", truncated" : "");
    }
}
