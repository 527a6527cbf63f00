package com.example.sqlpilot.model.dto;

import java.util.List;
import java.util.stream.Collectors;

import com.example.sqlpilot.model.Proposal;
import com.example.sqlpilot.model.RequestOutcome;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class OptimizeResponse {
    private String requestId;
    private String status;
    private String originalSql;
    private String optimizedSql;
    private String indexDdl;
    private boolean verified;
    private Double speedupRatio;
    private DiagnosisDto diagnosis;
    private List<AttemptDto> attempts;
    private String rationale;
    private String message;
    private long processingTimeMs;

    public static OptimizeResponse from(RequestOutcome outcome, long processingTimeMs) {
        Proposal accepted = outcome.getAcceptedProposal();
        return OptimizeResponse.builder()
                .requestId(outcome.getRequestId().toString())
                .status(outcome.getStatus().name())
                .originalSql(outcome.getOriginalSql())
                .optimizedSql(outcome.recommendedSql())
                .indexDdl(outcome.recommendedIndexDdl())
                .verified(outcome.isVerified())
                .speedupRatio(outcome.isVerified() ? outcome.getAcceptedVerdict().getSpeedupRatio() : null)
                .diagnosis(DiagnosisDto.from(outcome.getDiagnosis()))
                .attempts(outcome.getVerdicts().stream().map(AttemptDto::from).collect(Collectors.toList()))
                .rationale(outcome.isVerified() && accepted != null ? accepted.getRationale() : null)
                .message(outcome.getMessage())
                .processingTimeMs(processingTimeMs)
                .build();
    }
}
