package com.example.sqlpilot.model.dto;

import java.util.List;
import java.util.stream.Collectors;

import com.example.sqlpilot.model.DetectedIssue;
import com.example.sqlpilot.model.Diagnosis;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DiagnosisDto {
    private String summary;
    private List<String> tags;
    private List<String> issues;
    private String plan;

    public static DiagnosisDto from(Diagnosis diagnosis) {
        if (diagnosis == null) {
            return null;
        }
        return DiagnosisDto.builder()
                .summary(diagnosis.getSummary())
                .tags(diagnosis.getTags().stream().map(tag -> tag.getLabel()).collect(Collectors.toList()))
                .issues(diagnosis.getIssues().stream().map(DetectedIssue::describe).collect(Collectors.toList()))
                .plan(diagnosis.getPlan() != null ? diagnosis.getPlan().getPlanText() : null)
                .build();
    }
}
