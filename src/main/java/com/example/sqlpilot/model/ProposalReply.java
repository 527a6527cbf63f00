package com.example.sqlpilot.model;

import lombok.Builder;
import lombok.Value;

/**
 * What the proposal source answered, before it is checked and numbered as an attempt.
 */
@Value
@Builder
public class ProposalReply {
    String candidateSql;
    String indexDdl;
    String rationale;
}
