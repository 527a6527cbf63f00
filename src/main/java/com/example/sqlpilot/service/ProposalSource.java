package com.example.sqlpilot.service;

import java.util.List;

import com.example.sqlpilot.model.AttemptFeedback;
import com.example.sqlpilot.model.Diagnosis;
import com.example.sqlpilot.model.Dialect;
import com.example.sqlpilot.model.ProposalReply;

import reactor.core.publisher.Mono;

/**
 * Produces candidate optimizations. Implementations are not trusted: every reply is checked and
 * measured before it can be reported.
 */
public interface ProposalSource {

    Mono<ProposalReply> propose(String originalSql, Dialect dialect, Diagnosis diagnosis,
                                List<AttemptFeedback> priorFeedback);
}
