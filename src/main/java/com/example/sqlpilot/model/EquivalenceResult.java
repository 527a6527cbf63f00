package com.example.sqlpilot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EquivalenceResult {
    boolean equivalent;
    String detail;

    public static EquivalenceResult match(String detail) {
        return new EquivalenceResult(true, detail);
    }

    public static EquivalenceResult mismatch(String detail) {
        return new EquivalenceResult(false, detail);
    }
}
