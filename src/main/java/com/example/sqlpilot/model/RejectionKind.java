package com.example.sqlpilot.model;

public enum RejectionKind {
    PROPOSAL_INVALID(false),
    PROPOSAL_TIMEOUT(false),
    EXECUTION_ERROR(false),
    EXECUTION_TIMEOUT(false),
    SEMANTIC_MISMATCH(true),
    PERFORMANCE_REGRESSION(true),
    INCONCLUSIVE_MEASUREMENT(true);

    private final boolean measured;

    RejectionKind(boolean measured) {
        this.measured = measured;
    }

    /**
     * Whether both variants ran to completion before the rejection was decided.
     */
    public boolean isMeasured() {
        return measured;
    }
}
