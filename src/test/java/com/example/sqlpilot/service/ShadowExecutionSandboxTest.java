package com.example.sqlpilot.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.UUID;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.example.sqlpilot.TestFixtures;
import com.example.sqlpilot.model.Dialect;
import com.example.sqlpilot.model.ShadowRunResult;
import com.example.sqlpilot.model.Variant;
import com.example.sqlpilot.model.VerificationSettings;
import com.example.sqlpilot.shadow.AttemptScope;
import com.example.sqlpilot.shadow.IsolationScope;
import com.example.sqlpilot.shadow.JdbcShadowDatabase;

public class ShadowExecutionSandboxTest {

    private final ShadowExecutionSandbox sandbox = new ShadowExecutionSandbox();
    private final SemanticEquivalenceChecker checker = new SemanticEquivalenceChecker();
    private final VerificationSettings settings = VerificationSettings.defaults().toBuilder()
            .timingRepeatCount(3)
            .maxResultRows(1_000)
            .build();

    private IsolationScope scope;

    @BeforeEach
    public void setUp() throws SQLException {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:sandbox-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        try (Connection connection = dataSource.getConnection(); Statement statement = connection.createStatement()) {
            statement.execute("CREATE TABLE orders (id BIGINT PRIMARY KEY, total DECIMAL(10, 2), created_at TIMESTAMP)");
            statement.execute("INSERT INTO orders VALUES (1, 10.50, TIMESTAMP '2023-12-31 23:59:59'), "
                    + "(2, 20.00, TIMESTAMP '2024-01-01 00:00:00'), (3, 30.25, TIMESTAMP '2024-06-15 12:00:00'), "
                    + "(4, 40.00, TIMESTAMP '2024-12-31 23:59:59'), (5, 50.75, TIMESTAMP '2025-01-01 00:00:00')");
        }
        scope = new JdbcShadowDatabase(dataSource, Dialect.H2).createIsolationScope(UUID.randomUUID());
    }

    @AfterEach
    public void tearDown() {
        scope.close();
    }

    @Test
    public void execute_EquivalentRewrite_ProducesSameDigest() {
        ShadowRunResult original;
        ShadowRunResult rewritten;
        try (AttemptScope attempt = scope.beginAttempt(0)) {
            original = sandbox.execute(TestFixtures.ORIGINAL_SQL, Variant.ORIGINAL, attempt, settings);
        }
        try (AttemptScope attempt = scope.beginAttempt(1)) {
            rewritten = sandbox.execute(TestFixtures.REWRITTEN_SQL, Variant.CANDIDATE, attempt, settings);
        }

        assertThat(original.getRowCount()).isEqualTo(3);
        assertThat(original.getSamplesMs()).hasSize(3);
        assertThat(original.getResult().isOrdered()).isFalse();
        assertThat(rewritten.getResultDigest()).isEqualTo(original.getResultDigest());
        assertThat(checker.compare(original.getResult(), rewritten.getResult(), settings.getFloatEpsilon())
                .isEquivalent()).isTrue();
    }

    @Test
    public void execute_OffByOneBoundary_IsDetected() {
        ShadowRunResult original;
        ShadowRunResult wrong;
        try (AttemptScope attempt = scope.beginAttempt(0)) {
            original = sandbox.execute(TestFixtures.ORIGINAL_SQL, Variant.ORIGINAL, attempt, settings);
        }
        try (AttemptScope attempt = scope.beginAttempt(1)) {
            wrong = sandbox.execute("SELECT id, total FROM orders WHERE created_at >= '2024-01-01' "
                    + "AND created_at <= '2025-01-01'", Variant.CANDIDATE, attempt, settings);
        }

        assertThat(checker.compare(original.getResult(), wrong.getResult(), settings.getFloatEpsilon())
                .getDetail()).isEqualTo("row count mismatch: 4 vs 3");
    }

    @Test
    public void execute_TopLevelOrderBy_IsOrdered() {
        try (AttemptScope attempt = scope.beginAttempt(0)) {
            ShadowRunResult result = sandbox.execute("SELECT id FROM orders ORDER BY total DESC",
                    Variant.ORIGINAL, attempt, settings);

            assertThat(result.getResult().isOrdered()).isTrue();
            assertThat(result.getResult().getRetainedRows()).hasSize(5);
        }
    }

    @Test
    public void execute_CandidateAddsOrderByToUnorderedOriginal_ComparedAsMultiset() {
        ShadowRunResult original;
        ShadowRunResult candidate;
        try (AttemptScope attempt = scope.beginAttempt(0)) {
            original = sandbox.execute("SELECT id, total FROM orders", Variant.ORIGINAL, attempt, settings);
        }
        try (AttemptScope attempt = scope.beginAttempt(1)) {
            candidate = sandbox.execute("SELECT id, total FROM orders ORDER BY total DESC", Variant.CANDIDATE,
                    attempt, settings, original.getResult().isOrdered());
        }

        assertThat(candidate.getResult().isOrdered()).isFalse();
        assertThat(candidate.getResultDigest()).isEqualTo(original.getResultDigest());
        assertThat(checker.compare(original.getResult(), candidate.getResult(), settings.getFloatEpsilon())
                .isEquivalent()).isTrue();
    }

    @Test
    public void execute_CandidateDropsOriginalOrderBy_IsOrderingMismatch() {
        ShadowRunResult original;
        ShadowRunResult candidate;
        try (AttemptScope attempt = scope.beginAttempt(0)) {
            original = sandbox.execute("SELECT id FROM orders ORDER BY total DESC", Variant.ORIGINAL, attempt,
                    settings);
        }
        try (AttemptScope attempt = scope.beginAttempt(1)) {
            candidate = sandbox.execute("SELECT id FROM orders", Variant.CANDIDATE, attempt, settings,
                    original.getResult().isOrdered());
        }

        assertThat(checker.compare(original.getResult(), candidate.getResult(), settings.getFloatEpsilon())
                .getDetail()).isEqualTo("ordering mismatch: original is ordered, candidate is unordered");
    }

    @Test
    public void execute_CandidateKeepsOriginalOrderBy_ComparedInOrder() {
        ShadowRunResult original;
        ShadowRunResult reversed;
        try (AttemptScope attempt = scope.beginAttempt(0)) {
            original = sandbox.execute("SELECT id FROM orders ORDER BY total DESC", Variant.ORIGINAL, attempt,
                    settings);
        }
        try (AttemptScope attempt = scope.beginAttempt(1)) {
            reversed = sandbox.execute("SELECT id FROM orders ORDER BY total ASC", Variant.CANDIDATE, attempt,
                    settings, original.getResult().isOrdered());
        }

        assertThat(reversed.getResult().isOrdered()).isTrue();
        assertThat(checker.compare(original.getResult(), reversed.getResult(), settings.getFloatEpsilon())
                .isEquivalent()).isFalse();
    }

    @Test
    public void execute_RowCap_MarksResultTruncated() {
        VerificationSettings capped = settings.toBuilder().maxResultRows(2).build();
        try (AttemptScope attempt = scope.beginAttempt(0)) {
            ShadowRunResult result = sandbox.execute("SELECT id FROM orders", Variant.ORIGINAL, attempt, capped);

            assertThat(result.getResult().isTruncated()).isTrue();
            assertThat(result.summary()).contains("truncated");
        }
    }

    @Test
    public void median_AndRelativeSpread() {
        assertThat(ShadowExecutionSandbox.median(List.of(3.0, 1.0, 2.0))).isEqualTo(2.0);
        assertThat(ShadowExecutionSandbox.median(List.of(4.0, 1.0, 2.0, 3.0))).isEqualTo(2.5);
        assertThat(ShadowExecutionSandbox.median(List.of())).isEqualTo(0.0);
        assertThat(ShadowExecutionSandbox.relativeSpread(List.of(90.0, 100.0, 110.0), 100.0))
                .isCloseTo(0.2, within(1e-9));
        assertThat(ShadowExecutionSandbox.relativeSpread(List.of(5.0), 5.0)).isZero();
        assertThat(ShadowExecutionSandbox.relativeSpread(List.of(0.0, 0.0), 0.0)).isZero();
    }
}
