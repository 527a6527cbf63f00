package com.example.sqlpilot.model;

import lombok.Builder;
import lombok.Value;

/**
 * Judgment for one attempt. {@code accepted} can only be true together with a semantic match and a
 * speedup above one.
 */
@Value
@Builder(access = lombok.AccessLevel.PRIVATE)
public class VerificationVerdict {
    int attempt;
    Proposal proposal;
    boolean semanticMatch;
    Double speedupRatio;
    boolean accepted;
    RejectionKind rejectionKind;
    String rejectionReason;
    ShadowRunResult baseline;
    ShadowRunResult candidate;

    public static VerificationVerdict accepted(Proposal proposal, double speedupRatio,
                                               ShadowRunResult baseline, ShadowRunResult candidate) {
        if (!(speedupRatio > 1.0)) {
            throw new IllegalArgumentException("Accepted verdict requires a speedup above 1.0, got " + speedupRatio);
        }
        return VerificationVerdict.builder()
                .attempt(proposal.getAttempt())
                .proposal(proposal)
                .semanticMatch(true)
                .speedupRatio(speedupRatio)
                .accepted(true)
                .baseline(baseline)
                .candidate(candidate)
                .build();
    }

    public static VerificationVerdict rejected(int attempt, Proposal proposal, boolean semanticMatch,
                                               Double speedupRatio, RejectionKind kind, String reason,
                                               ShadowRunResult baseline, ShadowRunResult candidate) {
        return VerificationVerdict.builder()
                .attempt(attempt)
                .proposal(proposal)
                .semanticMatch(semanticMatch)
                .speedupRatio(speedupRatio)
                .accepted(false)
                .rejectionKind(kind)
                .rejectionReason(reason)
                .baseline(baseline)
                .candidate(candidate)
                .build();
    }

    public AttemptFeedback toFeedback() {
        return AttemptFeedback.builder()
                .attempt(attempt)
                .kind(rejectionKind)
                .message(rejectionReason)
                .rejectedStatement(proposal != null ? proposal.getStatement() : null)
                .build();
    }
}
