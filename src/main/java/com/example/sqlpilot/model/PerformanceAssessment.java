package com.example.sqlpilot.model;

import lombok.Value;

@Value
public class PerformanceAssessment {

    public enum Outcome {
        PASS,
        REGRESSION,
        INCONCLUSIVE
    }

    double speedupRatio;
    Outcome outcome;
    String detail;

    public boolean isPass() {
        return outcome == Outcome.PASS;
    }
}
