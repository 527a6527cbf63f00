package com.example.sqlpilot.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.example.sqlpilot.TestFixtures;
import com.example.sqlpilot.exception.CollaboratorUnavailableException;
import com.example.sqlpilot.exception.CollaboratorUnavailableException.Collaborator;
import com.example.sqlpilot.exception.ProposalInvalidException;
import com.example.sqlpilot.exception.ShadowExecutionException;
import com.example.sqlpilot.model.CancellationToken;
import com.example.sqlpilot.model.OutcomeStatus;
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
import com.example.sqlpilot.shadow.IsolationScope;
import com.example.sqlpilot.shadow.ShadowDatabase;

public class OptimizationOrchestratorTest {

    private static final String INDEX_DDL = "CREATE INDEX idx_orders_created ON orders (created_at)";

    private ShadowDatabase shadowDatabase;
    private IsolationScope isolationScope;
    private AttemptScope attemptScope;
    private ProposalGenerator proposalGenerator;
    private ShadowExecutionSandbox sandbox;
    private OptimizationOrchestrator orchestrator;

    private final ShadowRunResult baseline =
            TestFixtures.run(Variant.ORIGINAL, TestFixtures.ORIGINAL_SQL, "abc", 500, 1200.0);
    private final ShadowRunResult fastCandidate =
            TestFixtures.run(Variant.CANDIDATE, TestFixtures.REWRITTEN_SQL, "abc", 500, 300.0);
    private final ShadowRunResult slowCandidate =
            TestFixtures.run(Variant.CANDIDATE, TestFixtures.REWRITTEN_SQL, "abc", 500, 2400.0);
    private final ShadowRunResult wrongCandidate =
            TestFixtures.run(Variant.CANDIDATE, TestFixtures.REWRITTEN_SQL, "zzz", 500, 300.0);

    @BeforeEach
    public void setUp() {
        shadowDatabase = mock(ShadowDatabase.class);
        isolationScope = mock(IsolationScope.class);
        attemptScope = mock(AttemptScope.class);
        SchemaInspector schemaInspector = mock(SchemaInspector.class);
        DiagnosisCollector diagnosisCollector = mock(DiagnosisCollector.class);
        proposalGenerator = mock(ProposalGenerator.class);
        sandbox = mock(ShadowExecutionSandbox.class);

        when(shadowDatabase.createIsolationScope(any())).thenReturn(isolationScope);
        when(isolationScope.beginAttempt(anyInt())).thenReturn(attemptScope);
        when(schemaInspector.inspect(anyString(), any(), any())).thenReturn(SchemaContext.empty());
        when(diagnosisCollector.diagnose(anyString(), any(), any(), any(), any())).thenReturn(TestFixtures.diagnosis());
        when(sandbox.execute(eq(TestFixtures.ORIGINAL_SQL), eq(Variant.ORIGINAL), any(), any())).thenReturn(baseline);

        orchestrator = new OptimizationOrchestrator(shadowDatabase, schemaInspector, diagnosisCollector,
                proposalGenerator, sandbox, new SemanticEquivalenceChecker(), new PerformanceComparator(),
                VerificationSettings.defaults());
    }

    private void proposeRewrites() {
        when(proposalGenerator.generate(anyInt(), any(), any(), anyList(), any())).thenAnswer(invocation ->
                TestFixtures.rewrite(invocation.<Integer>getArgument(0), TestFixtures.REWRITTEN_SQL));
    }

    @Test
    public void optimize_FasterEquivalentRewrite_IsAcceptedOnFirstAttempt() {
        proposeRewrites();
        when(sandbox.execute(anyString(), eq(Variant.CANDIDATE), any(), any(), anyBoolean())).thenReturn(fastCandidate);

        RequestOutcome outcome = orchestrator.optimize(TestFixtures.request());

        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.ACCEPTED);
        assertThat(outcome.recommendedSql()).isEqualTo(TestFixtures.REWRITTEN_SQL);
        assertThat(outcome.getAcceptedVerdict().getSpeedupRatio()).isEqualTo(4.0);
        assertThat(outcome.getMessage()).isEqualTo("Verified on attempt 1: speedup 4.00x");
        assertThat(outcome.getVerdicts()).hasSize(1);
        verify(proposalGenerator, times(1)).generate(anyInt(), any(), any(), anyList(), any());
        verify(isolationScope, times(1)).close();
        verify(attemptScope, times(2)).close();
        verify(sandbox).execute(eq(TestFixtures.REWRITTEN_SQL), eq(Variant.CANDIDATE), any(), any(), eq(false));
    }

    @Test
    public void optimize_MismatchThenMatch_RetriesWithFeedback() {
        proposeRewrites();
        when(sandbox.execute(anyString(), eq(Variant.CANDIDATE), any(), any(), anyBoolean()))
                .thenReturn(wrongCandidate, fastCandidate);

        RequestOutcome outcome = orchestrator.optimize(TestFixtures.request());

        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.ACCEPTED);
        assertThat(outcome.getVerdicts()).hasSize(2);
        VerificationVerdict first = outcome.getVerdicts().get(0);
        assertThat(first.isSemanticMatch()).isFalse();
        assertThat(first.getSpeedupRatio()).isNull();
        assertThat(first.getRejectionKind()).isEqualTo(RejectionKind.SEMANTIC_MISMATCH);
        assertThat(first.getRejectionReason()).startsWith("content mismatch");
        verify(proposalGenerator).generate(eq(2), any(), any(),
                argThat(feedback -> feedback.size() == 1
                        && feedback.get(0).getKind() == RejectionKind.SEMANTIC_MISMATCH), any());
        verify(isolationScope, times(1)).close();
    }

    @Test
    public void optimize_OnlyRegressions_ExhaustsAttemptBudget() {
        proposeRewrites();
        when(sandbox.execute(anyString(), eq(Variant.CANDIDATE), any(), any(), anyBoolean())).thenReturn(slowCandidate);

        RequestOutcome outcome = orchestrator.optimize(TestFixtures.request());

        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.EXHAUSTED);
        assertThat(outcome.recommendedSql()).isEqualTo(TestFixtures.ORIGINAL_SQL);
        assertThat(outcome.getVerdicts()).hasSize(3)
                .allSatisfy(verdict -> {
                    assertThat(verdict.isAccepted()).isFalse();
                    assertThat(verdict.isSemanticMatch()).isTrue();
                    assertThat(verdict.getRejectionKind()).isEqualTo(RejectionKind.PERFORMANCE_REGRESSION);
                });
        assertThat(outcome.getMessage())
                .startsWith("No verified improvement after 3 attempt(s); last rejection: regressed");
        verify(proposalGenerator, times(3)).generate(anyInt(), any(), any(), anyList(), any());
        verify(isolationScope, times(1)).close();
    }

    @Test
    public void optimize_NoisyCandidate_IsInconclusive() {
        proposeRewrites();
        ShadowRunResult noisy = TestFixtures.run(Variant.CANDIDATE, TestFixtures.REWRITTEN_SQL,
                TestFixtures.result("abc", 500), 300.0, 0.9);
        when(sandbox.execute(anyString(), eq(Variant.CANDIDATE), any(), any(), anyBoolean())).thenReturn(noisy);

        RequestOutcome outcome = orchestrator.optimize(TestFixtures.request());

        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.EXHAUSTED);
        assertThat(outcome.getVerdicts()).extracting(VerificationVerdict::getRejectionKind)
                .containsOnly(RejectionKind.INCONCLUSIVE_MEASUREMENT);
    }

    @Test
    public void optimize_IndexProposal_MeasuresOriginalQueryWithIndex() {
        when(proposalGenerator.generate(anyInt(), any(), any(), anyList(), any())).thenReturn(Proposal.builder()
                .attempt(1)
                .kind(ProposalKind.INDEX_DDL)
                .indexDdl(INDEX_DDL)
                .rationale("index the range column")
                .build());
        ShadowRunResult indexed = TestFixtures.run(Variant.CANDIDATE, TestFixtures.ORIGINAL_SQL, "abc", 500, 200.0);
        when(sandbox.execute(eq(TestFixtures.ORIGINAL_SQL), eq(Variant.CANDIDATE), any(), any(), anyBoolean())).thenReturn(indexed);

        RequestOutcome outcome = orchestrator.optimize(TestFixtures.request());

        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.ACCEPTED);
        assertThat(outcome.recommendedSql()).isEqualTo(TestFixtures.ORIGINAL_SQL);
        assertThat(outcome.recommendedIndexDdl()).isEqualTo(INDEX_DDL);
        verify(attemptScope).applyIndex(eq(INDEX_DDL), eq("idx_orders_created"), eq("orders"), any());
    }

    @Test
    public void optimize_ProposalTimeouts_AreRecordedAndRetried() {
        when(proposalGenerator.generate(anyInt(), any(), any(), anyList(), any()))
                .thenThrow(new ProposalInvalidException("No proposal received within 60000 ms", true, null));

        RequestOutcome outcome = orchestrator.optimize(TestFixtures.request());

        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.EXHAUSTED);
        assertThat(outcome.getVerdicts()).extracting(VerificationVerdict::getRejectionKind)
                .containsExactly(RejectionKind.PROPOSAL_TIMEOUT, RejectionKind.PROPOSAL_TIMEOUT,
                        RejectionKind.PROPOSAL_TIMEOUT);
        assertThat(outcome.getVerdicts().get(0).getProposal()).isNull();
        verify(sandbox, never()).execute(anyString(), eq(Variant.CANDIDATE), any(), any(), anyBoolean());
    }

    @Test
    public void optimize_CandidateTimesOut_IsRejectedAndNextAttemptRuns() {
        proposeRewrites();
        when(sandbox.execute(anyString(), eq(Variant.CANDIDATE), any(), any(), anyBoolean()))
                .thenThrow(new ShadowExecutionException("Query exceeded 30000 ms", true, null))
                .thenReturn(fastCandidate);

        RequestOutcome outcome = orchestrator.optimize(TestFixtures.request());

        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.ACCEPTED);
        VerificationVerdict first = outcome.getVerdicts().get(0);
        assertThat(first.getRejectionKind()).isEqualTo(RejectionKind.EXECUTION_TIMEOUT);
        assertThat(first.getRejectionReason()).startsWith("candidate timed out: ");
        assertThat(first.getCandidate()).isNull();
    }

    @Test
    public void optimize_CandidateLosesRows_IsRejectedWithRowCounts() {
        proposeRewrites();
        ShadowRunResult fullBaseline = TestFixtures.run(Variant.ORIGINAL, TestFixtures.ORIGINAL_SQL, "abc", 500, 1250.0);
        when(sandbox.execute(eq(TestFixtures.ORIGINAL_SQL), eq(Variant.ORIGINAL), any(), any())).thenReturn(fullBaseline);
        when(sandbox.execute(anyString(), eq(Variant.CANDIDATE), any(), any(), anyBoolean())).thenReturn(
                TestFixtures.run(Variant.CANDIDATE, TestFixtures.REWRITTEN_SQL, "def", 498, 12.0), fastCandidate);

        RequestOutcome outcome = orchestrator.optimize(TestFixtures.request());

        VerificationVerdict first = outcome.getVerdicts().get(0);
        assertThat(first.isSemanticMatch()).isFalse();
        assertThat(first.isAccepted()).isFalse();
        assertThat(first.getRejectionReason()).isEqualTo("row count mismatch: 498 vs 500");
        assertThat(first.toFeedback().getMessage()).isEqualTo("row count mismatch: 498 vs 500");
    }

    @Test
    public void optimize_SlightlySlowerCandidate_FeedsRatioBack() {
        proposeRewrites();
        ShadowRunResult slowBaseline = TestFixtures.run(Variant.ORIGINAL, TestFixtures.ORIGINAL_SQL, "abc", 500, 1250.0);
        when(sandbox.execute(eq(TestFixtures.ORIGINAL_SQL), eq(Variant.ORIGINAL), any(), any())).thenReturn(slowBaseline);
        when(sandbox.execute(anyString(), eq(Variant.CANDIDATE), any(), any(), anyBoolean())).thenReturn(
                TestFixtures.run(Variant.CANDIDATE, TestFixtures.REWRITTEN_SQL, "abc", 500, 1300.0), fastCandidate);

        RequestOutcome outcome = orchestrator.optimize(TestFixtures.request());

        VerificationVerdict first = outcome.getVerdicts().get(0);
        assertThat(first.isSemanticMatch()).isTrue();
        assertThat(first.getRejectionKind()).isEqualTo(RejectionKind.PERFORMANCE_REGRESSION);
        assertThat(first.getRejectionReason())
                .isEqualTo("regressed: speedup ratio 0.96 (baseline 1250.00 ms, candidate 1300.00 ms)");
        verify(proposalGenerator).generate(eq(2), any(), any(),
                argThat(feedback -> feedback.size() == 1 && feedback.get(0).getMessage().contains("0.96")), any());
        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.ACCEPTED);
    }

    @Test
    public void optimize_ShadowDatabaseUnavailable_IsFatal() {
        when(shadowDatabase.createIsolationScope(any())).thenThrow(
                new CollaboratorUnavailableException(Collaborator.DATABASE, "Connection refused"));

        RequestOutcome outcome = orchestrator.optimize(TestFixtures.request());

        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.FATAL_ERROR);
        assertThat(outcome.getMessage()).isEqualTo("Shadow database unavailable: Connection refused");
        assertThat(outcome.recommendedSql()).isEqualTo(TestFixtures.ORIGINAL_SQL);
        verify(proposalGenerator, never()).generate(anyInt(), any(), any(), anyList(), any());
    }

    @Test
    public void optimize_LanguageModelUnavailable_IsFatalAndReleasesScope() {
        when(proposalGenerator.generate(anyInt(), any(), any(), anyList(), any())).thenThrow(
                new CollaboratorUnavailableException(Collaborator.LANGUAGE_MODEL, "LLM API unavailable after 4 attempts"));

        RequestOutcome outcome = orchestrator.optimize(TestFixtures.request());

        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.FATAL_ERROR);
        assertThat(outcome.getMessage()).startsWith("Language model unavailable: ");
        assertThat(outcome.getDiagnosis()).isNotNull();
        verify(isolationScope, times(1)).close();
    }

    @Test
    public void optimize_BaselineFails_IsFatal() {
        when(sandbox.execute(eq(TestFixtures.ORIGINAL_SQL), eq(Variant.ORIGINAL), any(), any()))
                .thenThrow(new ShadowExecutionException("Table \"ORDERS\" not found"));

        RequestOutcome outcome = orchestrator.optimize(TestFixtures.request());

        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.FATAL_ERROR);
        assertThat(outcome.getMessage()).startsWith("Original query failed: ");
        verify(proposalGenerator, never()).generate(anyInt(), any(), any(), anyList(), any());
        verify(isolationScope, times(1)).close();
    }

    @Test
    public void optimize_BaselineTruncated_IsFatal() {
        ShadowRunResult truncated = TestFixtures.run(Variant.ORIGINAL, TestFixtures.ORIGINAL_SQL,
                TestFixtures.result("abc", 100_000).toBuilder().truncated(true).build(), 1200.0, 0.1);
        when(sandbox.execute(eq(TestFixtures.ORIGINAL_SQL), eq(Variant.ORIGINAL), any(), any())).thenReturn(truncated);

        RequestOutcome outcome = orchestrator.optimize(TestFixtures.request());

        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.FATAL_ERROR);
        assertThat(outcome.getMessage()).contains("equivalence cannot be verified");
        verify(isolationScope, times(1)).close();
    }

    @Test
    public void optimize_CancelledBeforeFirstAttempt_StopsWithoutProposal() {
        CancellationToken cancellation = new CancellationToken();
        cancellation.cancel();

        RequestOutcome outcome = orchestrator.optimize(TestFixtures.request(), cancellation);

        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.CANCELLED);
        assertThat(outcome.getMessage()).isEqualTo("Cancelled before attempt 1");
        verify(proposalGenerator, never()).generate(anyInt(), any(), any(), anyList(), any());
        verify(isolationScope, times(1)).close();
    }
}
