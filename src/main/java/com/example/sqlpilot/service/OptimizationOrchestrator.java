package com.example.sqlpilot.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.example.sqlpilot.exception.CollaboratorUnavailableException;
import com.example.sqlpilot.exception.ProposalInvalidException;
import com.example.sqlpilot.exception.ShadowExecutionException;
import com.example.sqlpilot.exception.UnsafeSqlException;
import com.example.sqlpilot.model.AttemptFeedback;
import com.example.sqlpilot.model.CancellationToken;
import com.example.sqlpilot.model.Diagnosis;
import com.example.sqlpilot.model.EquivalenceResult;
import com.example.sqlpilot.model.OptimizationRequest;
import com.example.sqlpilot.model.OrchestratorState;
import com.example.sqlpilot.model.OutcomeStatus;
import com.example.sqlpilot.model.PerformanceAssessment;
import com.example.sqlpilot.model.Proposal;
import com.example.sqlpilot.model.ProposalKind;
import com.example.sqlpilot.model.RejectionKind;
import com.example.sqlpilot.model.RequestOutcome;
import com.example.sqlpilot.model.SchemaContext;
import com.example.sqlpilot.model.ShadowRunResult;
import com.example.sqlpilot.model.Variant;
import com.example.sqlpilot.model.VerificationSettings;
import com.example.sqlpilot.model.VerificationVerdict;
import com.example.sqlpilot.shadow.AttemptScope;
import com.example.sqlpilot.shadow.IsolationException;
import com.example.sqlpilot.shadow.IsolationScope;
import com.example.sqlpilot.shadow.ShadowDatabase;
import com.example.sqlpilot.util.SqlStatementInspector;
import com.example.sqlpilot.util.SqlStatementInspector.IndexTarget;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives one request through diagnosis, proposal and validation until a candidate is accepted or
 * the attempt budget runs out.
 *
 * <p>The isolation scope is acquired at the start and released exactly once on every exit path.
 * The original query is measured once, before the first attempt, and every candidate is compared
 * against that same baseline. Attempts run strictly one after another.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OptimizationOrchestrator {

    private final ShadowDatabase shadowDatabase;
    private final SchemaInspector schemaInspector;
    private final DiagnosisCollector diagnosisCollector;
    private final ProposalGenerator proposalGenerator;
    private final ShadowExecutionSandbox sandbox;
    private final SemanticEquivalenceChecker equivalenceChecker;
    private final PerformanceComparator performanceComparator;
    private final VerificationSettings settings;

    public RequestOutcome optimize(OptimizationRequest request) {
        return optimize(request, new CancellationToken());
    }

    public RequestOutcome optimize(OptimizationRequest request, CancellationToken cancellation) {
        UUID requestId = request.getId();
        String originalSql = request.getOriginalSql();
        RequestOutcome.RequestOutcomeBuilder outcome = RequestOutcome.builder()
                .requestId(requestId)
                .originalSql(originalSql);

        log.info("Request {}: optimizing query on {} shadow database", requestId, request.getDialect());
        try (IsolationScope scope = shadowDatabase.createIsolationScope(requestId)) {
            transition(requestId, OrchestratorState.DIAGNOSING);
            Diagnosis diagnosis;
            ShadowRunResult baseline;
            try (AttemptScope setup = scope.beginAttempt(0)) {
                SchemaContext schema = schemaInspector.inspect(originalSql, request.getSchema(), setup);
                diagnosis = diagnosisCollector.diagnose(originalSql, request.getDialect(), schema, setup, settings);
                outcome.diagnosis(diagnosis);
                log.info("Request {}: {}", requestId, diagnosis.getSummary());
                baseline = sandbox.execute(originalSql, Variant.ORIGINAL, setup, settings);
            }
            if (baseline.getResult().isTruncated()) {
                return fatal(outcome, requestId, "Original query returns more than " + settings.getMaxResultRows()
                        + " rows; equivalence cannot be verified");
            }
            log.info("Request {}: baseline {}", requestId, baseline.summary());

            List<AttemptFeedback> feedback = new ArrayList<>();
            VerificationVerdict lastRejection = null;
            for (int attempt = 1; attempt <= settings.getMaxAttempts(); attempt++) {
                if (cancellation.isCancelled()) {
                    transition(requestId, OrchestratorState.CANCELLED);
                    return outcome.status(OutcomeStatus.CANCELLED)
                            .message("Cancelled before attempt " + attempt)
                            .build();
                }
                transition(requestId, OrchestratorState.PROPOSING, attempt);
                VerificationVerdict verdict = runAttempt(attempt, request, diagnosis, feedback, baseline, scope);
                outcome.verdict(verdict);

                if (verdict.isAccepted()) {
                    transition(requestId, OrchestratorState.ACCEPTED, attempt);
                    log.info("Request {}: accepted {} on attempt {} with speedup {}", requestId,
                            verdict.getProposal().getKind(), attempt, ratio(verdict.getSpeedupRatio()));
                    return outcome.status(OutcomeStatus.ACCEPTED)
                            .acceptedVerdict(verdict)
                            .message(String.format(Locale.ROOT, "Verified on attempt %d: speedup %.2fx",
                                    attempt, verdict.getSpeedupRatio()))
                            .build();
                }

                log.warn("Request {}: attempt {} rejected ({}): {} | baseline={} | candidate={}", requestId, attempt,
                        verdict.getRejectionKind(), verdict.getRejectionReason(), summary(verdict.getBaseline()),
                        summary(verdict.getCandidate()));
                feedback.add(verdict.toFeedback());
                lastRejection = verdict;
                if (attempt < settings.getMaxAttempts()) {
                    transition(requestId, OrchestratorState.RETRY_WITH_FEEDBACK, attempt);
                }
            }

            transition(requestId, OrchestratorState.EXHAUSTED);
            return outcome.status(OutcomeStatus.EXHAUSTED)
                    .message("No verified improvement after " + settings.getMaxAttempts() + " attempt(s); last rejection: "
                            + (lastRejection != null ? lastRejection.getRejectionReason() : "none"))
                    .build();
        } catch (CollaboratorUnavailableException e) {
            return fatal(outcome, requestId, e.getCollaborator() == CollaboratorUnavailableException.Collaborator.DATABASE
                    ? "Shadow database unavailable: " + e.getMessage()
                    : "Language model unavailable: " + e.getMessage());
        } catch (ShadowExecutionException e) {
            return fatal(outcome, requestId, (e.isTimeout() ? "Original query timed out: " : "Original query failed: ")
                    + e.getMessage());
        } catch (UnsafeSqlException e) {
            return fatal(outcome, requestId, "Original query rejected: " + e.getMessage());
        } catch (IsolationException e) {
            return fatal(outcome, requestId, e.getMessage());
        }
    }

    private VerificationVerdict runAttempt(int attempt, OptimizationRequest request, Diagnosis diagnosis,
                                           List<AttemptFeedback> feedback, ShadowRunResult baseline,
                                           IsolationScope scope) {
        Proposal proposal;
        try {
            proposal = proposalGenerator.generate(attempt, request, diagnosis, feedback, settings.getProposalTimeout());
        } catch (ProposalInvalidException e) {
            return VerificationVerdict.rejected(attempt, null, false, null,
                    e.isTimeout() ? RejectionKind.PROPOSAL_TIMEOUT : RejectionKind.PROPOSAL_INVALID,
                    e.getMessage(), baseline, null);
        }

        transition(request.getId(), OrchestratorState.VALIDATING, attempt);
        try (AttemptScope attemptScope = scope.beginAttempt(attempt)) {
            if (proposal.getKind() == ProposalKind.INDEX_DDL) {
                IndexTarget target = SqlStatementInspector.indexTarget(proposal.getIndexDdl());
                attemptScope.applyIndex(proposal.getIndexDdl(), target.getIndexName(), target.getTableName(),
                        settings.getExecutionTimeout());
            }
            ShadowRunResult candidate = sandbox.execute(proposal.queryToMeasure(request.getOriginalSql()),
                    Variant.CANDIDATE, attemptScope, settings, baseline.getResult().isOrdered());
            return judge(proposal, baseline, candidate);
        } catch (ShadowExecutionException e) {
            for (Throwable suppressed : e.getSuppressed()) {
                if (suppressed instanceof IsolationException) {
                    throw (IsolationException) suppressed;
                }
            }
            return VerificationVerdict.rejected(attempt, proposal, false, null,
                    e.isTimeout() ? RejectionKind.EXECUTION_TIMEOUT : RejectionKind.EXECUTION_ERROR,
                    (e.isTimeout() ? "candidate timed out: " : "candidate failed: ") + e.getMessage(),
                    baseline, null);
        }
    }

    private VerificationVerdict judge(Proposal proposal, ShadowRunResult baseline, ShadowRunResult candidate) {
        EquivalenceResult equivalence = equivalenceChecker.compare(baseline.getResult(), candidate.getResult(),
                settings.getFloatEpsilon());
        if (!equivalence.isEquivalent()) {
            return VerificationVerdict.rejected(proposal.getAttempt(), proposal, false, null,
                    RejectionKind.SEMANTIC_MISMATCH, equivalence.getDetail(), baseline, candidate);
        }

        PerformanceAssessment performance = performanceComparator.compare(baseline, candidate,
                settings.getMinSpeedup(), settings.getVarianceTolerance());
        if (performance.isPass()) {
            return VerificationVerdict.accepted(proposal, performance.getSpeedupRatio(), baseline, candidate);
        }
        RejectionKind kind = performance.getOutcome() == PerformanceAssessment.Outcome.INCONCLUSIVE
                ? RejectionKind.INCONCLUSIVE_MEASUREMENT
                : RejectionKind.PERFORMANCE_REGRESSION;
        return VerificationVerdict.rejected(proposal.getAttempt(), proposal, true, performance.getSpeedupRatio(),
                kind, performance.getDetail(), baseline, candidate);
    }

    private RequestOutcome fatal(RequestOutcome.RequestOutcomeBuilder outcome, UUID requestId, String message) {
        transition(requestId, OrchestratorState.FATAL_ERROR);
        log.error("Request {}: {}", requestId, message);
        return outcome.status(OutcomeStatus.FATAL_ERROR).message(message).build();
    }

    private static void transition(UUID requestId, OrchestratorState state) {
        log.debug("Request {}: -> {}", requestId, state);
    }

    private static void transition(UUID requestId, OrchestratorState state, int attempt) {
        log.debug("Request {}: -> {} (attempt {})", requestId, state, attempt);
    }

    private static String summary(ShadowRunResult result) {
        return result != null ? result.summary() : "n/a";
    }

    private static String ratio(Double ratio) {
        return ratio == null ? "n/a" : String.format(Locale.ROOT, "%.2fx", ratio);
    }
}
