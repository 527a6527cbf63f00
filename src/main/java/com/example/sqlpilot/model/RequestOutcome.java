package com.example.sqlpilot.model;

import java.util.List;
import java.util.UUID;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class RequestOutcome {
    UUID requestId;
    String originalSql;
    OutcomeStatus status;
    VerificationVerdict acceptedVerdict;
    @Singular
    List<VerificationVerdict> verdicts;
    Diagnosis diagnosis;
    String message;

    public Proposal getAcceptedProposal() {
        return acceptedVerdict != null ? acceptedVerdict.getProposal() : null;
    }

    /**
     * SQL to hand back to the caller. Anything short of an accepted query rewrite returns the
     * original text unchanged.
     */
    public String recommendedSql() {
        Proposal proposal = getAcceptedProposal();
        if (status == OutcomeStatus.ACCEPTED && proposal != null && proposal.getKind() == ProposalKind.QUERY_REWRITE) {
            return proposal.getCandidateSql();
        }
        return originalSql;
    }

    public String recommendedIndexDdl() {
        Proposal proposal = getAcceptedProposal();
        if (status == OutcomeStatus.ACCEPTED && proposal != null && proposal.getKind() == ProposalKind.INDEX_DDL) {
            return proposal.getIndexDdl();
        }
        return null;
    }

    public boolean isVerified() {
        return status == OutcomeStatus.ACCEPTED;
    }
}
