package com.example.sqlpilot.model.dto;

import com.example.sqlpilot.model.VerificationVerdict;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AttemptDto {
    private int attempt;
    private String kind;
    private String statement;
    private boolean semanticMatch;
    private Double speedupRatio;
    private boolean accepted;
    private String rejectionKind;
    private String rejectionReason;
    private Double baselineMs;
    private Double candidateMs;

    public static AttemptDto from(VerificationVerdict verdict) {
        return AttemptDto.builder()
                .attempt(verdict.getAttempt())
                .kind(verdict.getProposal() != null ? verdict.getProposal().getKind().name() : null)
                .statement(verdict.getProposal() != null ? verdict.getProposal().getStatement() : null)
                .semanticMatch(verdict.isSemanticMatch())
                .speedupRatio(verdict.getSpeedupRatio())
                .accepted(verdict.isAccepted())
                .rejectionKind(verdict.getRejectionKind() != null ? verdict.getRejectionKind().name() : null)
                .rejectionReason(verdict.getRejectionReason())
                .baselineMs(verdict.getBaseline() != null ? verdict.getBaseline().getElapsedMs() : null)
                .candidateMs(verdict.getCandidate() != null ? verdict.getCandidate().getElapsedMs() : null)
                .build();
    }
}
