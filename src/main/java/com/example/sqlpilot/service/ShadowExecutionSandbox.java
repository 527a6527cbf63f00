package com.example.sqlpilot.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.springframework.stereotype.Service;

import com.example.sqlpilot.exception.ShadowExecutionException;
import com.example.sqlpilot.model.CanonicalResult;
import com.example.sqlpilot.model.ExecutionPlan;
import com.example.sqlpilot.model.ShadowRunResult;
import com.example.sqlpilot.model.Variant;
import com.example.sqlpilot.model.VerificationSettings;
import com.example.sqlpilot.shadow.AttemptScope;
import com.example.sqlpilot.shadow.ExecutionStats;
import com.example.sqlpilot.shadow.RowSink;
import com.example.sqlpilot.util.ExplainPlanParser;
import com.example.sqlpilot.util.ResultCanonicalizer;
import com.example.sqlpilot.util.SqlStatementInspector;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs one statement inside an attempt scope: a warm-up run that also captures the canonical result,
 * followed by the timed runs. Errors are reported to the caller, never retried here.
 */
@Slf4j
@Service
public class ShadowExecutionSandbox {

    public ShadowRunResult execute(String sql, Variant variant, AttemptScope scope, VerificationSettings settings) {
        return run(sql, variant, scope, settings, SqlStatementInspector.hasTopLevelOrderBy(sql));
    }

    /**
     * Runs a candidate under the original query's ordering mode. Row order only counts when the
     * original fixed it; a candidate that drops that ORDER BY is canonicalized as unordered and
     * fails the ordering check.
     */
    public ShadowRunResult execute(String sql, Variant variant, AttemptScope scope, VerificationSettings settings,
                                   boolean originalOrdered) {
        return run(sql, variant, scope, settings, originalOrdered && SqlStatementInspector.hasTopLevelOrderBy(sql));
    }

    private ShadowRunResult run(String sql, Variant variant, AttemptScope scope, VerificationSettings settings,
                                boolean ordered) {
        ExecutionPlan plan = explain(sql, scope, settings);

        ResultCanonicalizer canonicalizer = new ResultCanonicalizer(ordered, settings.getFloatEpsilon(),
                settings.getRetainedRowLimit());
        ExecutionStats warmUp = scope.execute(sql, settings.getExecutionTimeout(), settings.getMaxResultRows(),
                canonicalizer);
        CanonicalResult result = canonicalizer.finish(warmUp.isTruncated());
        log.debug("{} warm-up: {} rows in {} ms", variant, warmUp.getRowCount(), warmUp.getElapsedMs());

        List<Double> samples = new ArrayList<>(settings.getTimingRepeatCount());
        for (int run = 0; run < settings.getTimingRepeatCount(); run++) {
            ExecutionStats timed = scope.execute(sql, settings.getExecutionTimeout(), settings.getMaxResultRows(),
                    RowSink.DISCARD);
            samples.add(timed.getElapsedMs());
        }

        double median = median(samples);
        return ShadowRunResult.builder()
                .variant(variant)
                .sql(sql)
                .result(result)
                .elapsedMs(median)
                .samplesMs(Collections.unmodifiableList(samples))
                .relativeSpread(relativeSpread(samples, median))
                .plan(plan)
                .build();
    }

    private ExecutionPlan explain(String sql, AttemptScope scope, VerificationSettings settings) {
        try {
            return ExplainPlanParser.parse(scope.getDialect(), scope.explain(sql, settings.getExecutionTimeout()));
        } catch (ShadowExecutionException e) {
            log.debug("No plan for statement: {}", e.getMessage());
            return ExecutionPlan.unavailable();
        }
    }

    static double median(List<Double> samples) {
        List<Double> sorted = new ArrayList<>(samples);
        Collections.sort(sorted);
        int size = sorted.size();
        if (size == 0) {
            return 0.0;
        }
        if (size % 2 == 1) {
            return sorted.get(size / 2);
        }
        return (sorted.get(size / 2 - 1) + sorted.get(size / 2)) / 2.0;
    }

    /**
     * (max - min) / median, or zero for a single sample or a zero median.
     */
    static double relativeSpread(List<Double> samples, double median) {
        if (samples.size() < 2 || median <= 0.0) {
            return 0.0;
        }
        return (Collections.max(samples) - Collections.min(samples)) / median;
    }
}
