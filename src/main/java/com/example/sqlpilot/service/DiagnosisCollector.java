package com.example.sqlpilot.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.example.sqlpilot.exception.ShadowExecutionException;
import com.example.sqlpilot.exception.UnsafeSqlException;
import com.example.sqlpilot.model.DetectedIssue;
import com.example.sqlpilot.model.Diagnosis;
import com.example.sqlpilot.model.Dialect;
import com.example.sqlpilot.model.ExecutionPlan;
import com.example.sqlpilot.model.IssueTag;
import com.example.sqlpilot.model.PlanOperation;
import com.example.sqlpilot.model.SchemaContext;
import com.example.sqlpilot.model.TableMetadata;
import com.example.sqlpilot.model.VerificationSettings;
import com.example.sqlpilot.shadow.AttemptScope;
import com.example.sqlpilot.util.ExplainPlanParser;
import com.example.sqlpilot.util.SqlStatementInspector;
import com.example.sqlpilot.util.SqlStatementInspector.ColumnRef;
import com.example.sqlpilot.util.SqlStatementInspector.PredicateReport;
import com.example.sqlpilot.util.SqlStatementInspector.WrappedColumn;

import lombok.extern.slf4j.Slf4j;

/**
 * Explains the original query and tags likely bottlenecks with a fixed rule set. The result only
 * informs the proposal prompt and the report; it never decides whether a candidate is accepted.
 */
@Slf4j
@Service
public class DiagnosisCollector {

    public Diagnosis diagnose(String sql, Dialect dialect, SchemaContext schema, AttemptScope scope,
                              VerificationSettings settings) {
        ExecutionPlan plan;
        try {
            plan = ExplainPlanParser.parse(dialect, scope.explain(sql, settings.getExecutionTimeout()));
        } catch (ShadowExecutionException e) {
            log.warn("Explain failed, diagnosing without a plan: {}", e.getMessage());
            plan = ExecutionPlan.unavailable();
        }
        return classify(sql, plan, schema, settings.getFullScanRowThreshold());
    }

    public Diagnosis classify(String sql, ExecutionPlan plan, SchemaContext schema, long fullScanRowThreshold) {
        Set<String> seen = new LinkedHashSet<>();
        List<DetectedIssue> issues = new ArrayList<>();

        for (PlanOperation operation : plan.getOperations()) {
            if (operation.isFullScan()) {
                Long rows = operation.getEstimatedRows();
                if (rows == null) {
                    rows = schema.table(operation.getTable()).map(TableMetadata::getEstimatedRows).orElse(null);
                }
                if (rows != null && rows >= fullScanRowThreshold) {
                    add(issues, seen, IssueTag.FULL_SCAN, operation.getTable(), null,
                            "full scan over ~" + rows + " rows");
                }
            }
            String extra = operation.getExtra() == null ? "" : operation.getExtra().toLowerCase(Locale.ROOT);
            if (extra.contains("filesort") || extra.contains("temporary")) {
                add(issues, seen, IssueTag.FILESORT_OR_TEMPORARY, operation.getTable(), null, operation.getExtra());
            }
        }

        PredicateReport predicates;
        try {
            predicates = SqlStatementInspector.analyzePredicates(sql);
        } catch (UnsafeSqlException e) {
            log.debug("Predicate analysis skipped: {}", e.getMessage());
            predicates = null;
        }

        if (predicates != null) {
            for (WrappedColumn wrapped : predicates.getWrappedColumns()) {
                Optional<TableMetadata> table = owningTable(schema, wrapped.getTable(), wrapped.getColumn());
                boolean indexed = table.map(t -> t.isIndexed(wrapped.getColumn())).orElse(false);
                String tableName = table.map(TableMetadata::getName).orElse(wrapped.getTable());
                add(issues, seen, indexed ? IssueTag.FUNCTION_ON_INDEXED_COLUMN : IssueTag.NON_SARGABLE_PREDICATE,
                        tableName, wrapped.getColumn(), wrapped.getFunction() + "() wraps the column");
            }
            for (ColumnRef like : predicates.getLeadingWildcardLikes()) {
                add(issues, seen, IssueTag.NON_SARGABLE_PREDICATE, like.getTable(), like.getColumn(),
                        "LIKE pattern starts with a wildcard");
            }
            for (ColumnRef filter : predicates.getFilterColumns()) {
                Optional<TableMetadata> table = owningTable(schema, filter.getTable(), filter.getColumn());
                if (table.isPresent() && !table.get().isLeadingIndexColumn(filter.getColumn())) {
                    add(issues, seen, IssueTag.MISSING_INDEX, table.get().getName(), filter.getColumn(),
                            "no index starts with this filter column");
                }
            }
            if (predicates.isSelectStar()) {
                add(issues, seen, IssueTag.SELECT_STAR, null, null, "query selects every column");
            }
        }

        return Diagnosis.builder()
                .plan(plan)
                .issues(issues)
                .summary(summarize(issues))
                .schema(schema)
                .build();
    }

    private static Optional<TableMetadata> owningTable(SchemaContext schema, String table, String column) {
        if (table != null) {
            return schema.table(table).filter(t -> hasColumn(t, column));
        }
        List<TableMetadata> owners = schema.getTables().values().stream()
                .filter(t -> hasColumn(t, column))
                .collect(Collectors.toList());
        return owners.size() == 1 ? Optional.of(owners.get(0)) : Optional.empty();
    }

    private static boolean hasColumn(TableMetadata table, String column) {
        return table.getColumns().stream().anyMatch(c -> c.getName().equalsIgnoreCase(column));
    }

    private static void add(List<DetectedIssue> issues, Set<String> seen, IssueTag tag, String table,
                            String column, String detail) {
        String key = tag + "|" + lower(table) + "|" + lower(column);
        if (seen.add(key)) {
            issues.add(DetectedIssue.builder().tag(tag).table(table).column(column).detail(detail).build());
        }
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private static String summarize(List<DetectedIssue> issues) {
        if (issues.isEmpty()) {
            return "No known bottleneck patterns detected";
        }
        return issues.size() + " issue(s): " + issues.stream()
                .map(DetectedIssue::describe)
                .collect(Collectors.joining("; "));
    }
}
