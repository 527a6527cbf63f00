package com.example.sqlpilot.model;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Bottleneck analysis of the original query. Context for the proposal step and for the user,
 * never an input to the accept/reject decision.
 */
@Value
@Builder
public class Diagnosis {
    ExecutionPlan plan;
    @Singular
    List<DetectedIssue> issues;
    String summary;
    SchemaContext schema;

    public List<IssueTag> getTags() {
        return issues.stream().map(DetectedIssue::getTag).distinct().collect(Collectors.toList());
    }

    public boolean has(IssueTag tag) {
        return issues.stream().anyMatch(issue -> issue.getTag() == tag);
    }
}
