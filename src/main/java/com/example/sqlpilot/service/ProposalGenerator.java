package com.example.sqlpilot.service;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

import org.springframework.stereotype.Service;

import com.example.sqlpilot.exception.ProposalInvalidException;
import com.example.sqlpilot.exception.SqlPilotException;
import com.example.sqlpilot.exception.UnsafeSqlException;
import com.example.sqlpilot.model.AttemptFeedback;
import com.example.sqlpilot.model.Diagnosis;
import com.example.sqlpilot.model.OptimizationRequest;
import com.example.sqlpilot.model.Proposal;
import com.example.sqlpilot.model.ProposalKind;
import com.example.sqlpilot.model.ProposalReply;
import com.example.sqlpilot.util.SqlSafetyGuard;
import com.example.sqlpilot.util.SqlStatementInspector;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;

/**
 * Obtains one proposal per attempt and makes sure it is a single safe statement that differs from
 * the original query.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProposalGenerator {

    private final ProposalSource proposalSource;
    private final SqlSafetyGuard safetyGuard;

    /**
     * @throws ProposalInvalidException when the reply is missing, unsafe, unchanged or late
     * @throws com.example.sqlpilot.exception.CollaboratorUnavailableException when the source is down
     */
    public Proposal generate(int attempt, OptimizationRequest request, Diagnosis diagnosis,
                             List<AttemptFeedback> priorFeedback, Duration timeout) {
        ProposalReply reply;
        try {
            reply = proposalSource.propose(request.getOriginalSql(), request.getDialect(), diagnosis,
                            List.copyOf(priorFeedback))
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new ProposalInvalidException("No proposal received within " + timeout.toMillis() + " ms",
                        true, cause);
            }
            if (cause instanceof SqlPilotException) {
                throw (SqlPilotException) cause;
            }
            throw new ProposalInvalidException("Proposal request failed: " + cause.getMessage(), false, cause);
        }

        if (reply == null) {
            throw new ProposalInvalidException("Proposal source returned nothing");
        }

        String statement = pickStatement(request.getOriginalSql(), reply);
        if (statement == null) {
            throw new ProposalInvalidException("Proposal contains neither a rewritten query nor an index");
        }

        ProposalKind kind;
        try {
            kind = safetyGuard.classifyCandidate(statement);
            if (kind == ProposalKind.INDEX_DDL) {
                SqlStatementInspector.indexTarget(statement);
            }
        } catch (UnsafeSqlException e) {
            throw new ProposalInvalidException("Candidate rejected: " + e.getMessage(), false, e);
        }

        if (kind == ProposalKind.QUERY_REWRITE && sameStatement(statement, request.getOriginalSql())) {
            throw new ProposalInvalidException("Candidate is identical to the original query");
        }

        log.debug("Request {} attempt {}: received {} proposal", request.getId(), attempt, kind);
        return Proposal.builder()
                .attempt(attempt)
                .kind(kind)
                .candidateSql(kind == ProposalKind.QUERY_REWRITE ? statement : null)
                .indexDdl(kind == ProposalKind.INDEX_DDL ? statement : null)
                .rationale(reply.getRationale())
                .priorFeedback(priorFeedback.isEmpty() ? null : priorFeedback.get(priorFeedback.size() - 1))
                .build();
    }

    /**
     * A rewrite wins over an index when both are offered, unless the rewrite is just the original.
     */
    private static String pickStatement(String originalSql, ProposalReply reply) {
        String candidate = blankToNull(reply.getCandidateSql());
        String index = blankToNull(reply.getIndexDdl());
        if (candidate != null && (index == null || !sameStatement(candidate, originalSql))) {
            return candidate;
        }
        return index != null ? index : candidate;
    }

    static boolean sameStatement(String a, String b) {
        return normalize(a).equals(normalize(b));
    }

    private static String normalize(String sql) {
        String collapsed = sql.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        while (collapsed.endsWith(";")) {
            collapsed = collapsed.substring(0, collapsed.length() - 1).trim();
        }
        return collapsed;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
