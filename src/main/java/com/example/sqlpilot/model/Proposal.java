package com.example.sqlpilot.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Proposal {
    int attempt;
    ProposalKind kind;
    String candidateSql;
    String indexDdl;
    String rationale;
    AttemptFeedback priorFeedback;

    /**
     * The statement the proposal source suggested: the rewritten query or the index DDL.
     */
    public String getStatement() {
        return kind == ProposalKind.INDEX_DDL ? indexDdl : candidateSql;
    }

    /**
     * The query to time as the candidate variant. An index change is measured by re-running the
     * original query once the index exists.
     */
    public String queryToMeasure(String originalSql) {
        return kind == ProposalKind.INDEX_DDL ? originalSql : candidateSql;
    }
}
