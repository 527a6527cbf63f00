package com.example.sqlpilot.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.example.sqlpilot.TestFixtures;
import com.example.sqlpilot.exception.ShadowExecutionException;
import com.example.sqlpilot.model.ColumnMetadata;
import com.example.sqlpilot.model.DetectedIssue;
import com.example.sqlpilot.model.Diagnosis;
import com.example.sqlpilot.model.Dialect;
import com.example.sqlpilot.model.ExecutionPlan;
import com.example.sqlpilot.model.IndexMetadata;
import com.example.sqlpilot.model.IssueTag;
import com.example.sqlpilot.model.PlanOperation;
import com.example.sqlpilot.model.PlanOperation.AccessType;
import com.example.sqlpilot.model.SchemaContext;
import com.example.sqlpilot.model.TableMetadata;
import com.example.sqlpilot.model.VerificationSettings;
import com.example.sqlpilot.shadow.AttemptScope;

public class DiagnosisCollectorTest {

    private static final long THRESHOLD = 10_000;

    private final DiagnosisCollector collector = new DiagnosisCollector();

    private static SchemaContext ordersSchema() {
        TableMetadata orders = TableMetadata.builder()
                .name("orders")
                .column(ColumnMetadata.builder().name("id").type("BIGINT").build())
                .column(ColumnMetadata.builder().name("customer_id").type("BIGINT").build())
                .column(ColumnMetadata.builder().name("total").type("DECIMAL").build())
                .column(ColumnMetadata.builder().name("created_at").type("TIMESTAMP").build())
                .index(IndexMetadata.builder().name("PRIMARY").unique(true).column("id").build())
                .index(IndexMetadata.builder().name("idx_orders_created").column("created_at").build())
                .estimatedRows(50_000L)
                .build();
        return SchemaContext.of(List.of(orders));
    }

    private static ExecutionPlan fullScan(String table, Long rows) {
        return ExecutionPlan.builder()
                .planText("scan")
                .operation(PlanOperation.builder().table(table).accessType(AccessType.FULL_SCAN)
                        .estimatedRows(rows).build())
                .build();
    }

    @Test
    public void classify_FunctionOnIndexedColumnAndLargeScan() {
        Diagnosis diagnosis = collector.classify(TestFixtures.ORIGINAL_SQL, fullScan("ORDERS", null),
                ordersSchema(), THRESHOLD);

        assertThat(diagnosis.getTags())
                .containsExactly(IssueTag.FULL_SCAN, IssueTag.FUNCTION_ON_INDEXED_COLUMN);
        DetectedIssue scan = diagnosis.getIssues().get(0);
        assertThat(scan.getDetail()).isEqualTo("full scan over ~50000 rows");
        DetectedIssue wrapped = diagnosis.getIssues().get(1);
        assertThat(wrapped.getTable()).isEqualTo("orders");
        assertThat(wrapped.getColumn()).isEqualTo("created_at");
        assertThat(diagnosis.getSummary()).startsWith("2 issue(s): full-scan on ORDERS");
    }

    @Test
    public void classify_UnindexedFilterAndSelectStar() {
        Diagnosis diagnosis = collector.classify("SELECT * FROM orders WHERE customer_id = 5",
                ExecutionPlan.unavailable(), ordersSchema(), THRESHOLD);

        assertThat(diagnosis.getTags()).containsExactly(IssueTag.MISSING_INDEX, IssueTag.SELECT_STAR);
        assertThat(diagnosis.getIssues().get(0).getColumn()).isEqualTo("customer_id");
    }

    @Test
    public void classify_WrappedUnindexedColumnAndLeadingWildcard_AreNonSargable() {
        Diagnosis diagnosis = collector.classify(
                "SELECT id FROM orders WHERE CAST(total AS INT) = 3 AND note LIKE '%late'",
                ExecutionPlan.unavailable(), ordersSchema(), THRESHOLD);

        assertThat(diagnosis.getIssues()).extracting(DetectedIssue::getTag)
                .containsOnly(IssueTag.NON_SARGABLE_PREDICATE);
        assertThat(diagnosis.getIssues()).extracting(DetectedIssue::getColumn).contains("total", "note");
    }

    @Test
    public void classify_SmallScanAndIndexedRange_NoIssues() {
        Diagnosis diagnosis = collector.classify("SELECT id FROM orders WHERE created_at > '2024-01-01'",
                fullScan("orders", 10L), ordersSchema(), THRESHOLD);

        assertThat(diagnosis.getIssues()).isEmpty();
        assertThat(diagnosis.getSummary()).isEqualTo("No known bottleneck patterns detected");
    }

    @Test
    public void classify_FilesortIsReported() {
        ExecutionPlan plan = ExecutionPlan.builder()
                .planText("sort")
                .operation(PlanOperation.builder().table("orders").accessType(AccessType.INDEX_LOOKUP)
                        .extra("Using where; Using filesort").build())
                .build();

        Diagnosis diagnosis = collector.classify("SELECT id FROM orders WHERE created_at > '2024-01-01' ORDER BY total",
                plan, ordersSchema(), THRESHOLD);

        assertThat(diagnosis.has(IssueTag.FILESORT_OR_TEMPORARY)).isTrue();
    }

    @Test
    public void diagnose_ExplainFails_StillClassifiesQuery() {
        AttemptScope scope = mock(AttemptScope.class);
        when(scope.explain(anyString(), any())).thenThrow(new ShadowExecutionException("explain not supported"));

        Diagnosis diagnosis = collector.diagnose(TestFixtures.ORIGINAL_SQL, Dialect.H2, ordersSchema(), scope,
                VerificationSettings.defaults());

        assertThat(diagnosis.getPlan().getOperations()).isEmpty();
        assertThat(diagnosis.has(IssueTag.FUNCTION_ON_INDEXED_COLUMN)).isTrue();
    }
}
