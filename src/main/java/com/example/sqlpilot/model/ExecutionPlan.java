package com.example.sqlpilot.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class ExecutionPlan {
    String planText;
    Double totalCost;
    @Singular
    List<PlanOperation> operations;

    public static ExecutionPlan unavailable() {
        return ExecutionPlan.builder().planText("").build();
    }

    public boolean hasFullScan() {
        return operations.stream().anyMatch(PlanOperation::isFullScan);
    }
}
