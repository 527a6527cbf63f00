package com.example.sqlpilot.service;

import java.util.Locale;

import org.springframework.stereotype.Service;

import com.example.sqlpilot.model.PerformanceAssessment;
import com.example.sqlpilot.model.PerformanceAssessment.Outcome;
import com.example.sqlpilot.model.ShadowRunResult;

/**
 * Judges whether a measured speedup is real. Noisy measurements are inconclusive rather than
 * counted as a win or a loss.
 */
@Service
public class PerformanceComparator {

    static final double MIN_CANDIDATE_MS = 0.001;

    public PerformanceAssessment compare(ShadowRunResult baseline, ShadowRunResult candidate,
                                         double minSpeedup, double varianceTolerance) {
        double baselineMs = baseline.getElapsedMs();
        double candidateMs = Math.max(candidate.getElapsedMs(), MIN_CANDIDATE_MS);
        double ratio = baselineMs / candidateMs;

        if (baseline.getRelativeSpread() > varianceTolerance || candidate.getRelativeSpread() > varianceTolerance) {
            return new PerformanceAssessment(ratio, Outcome.INCONCLUSIVE, String.format(Locale.ROOT,
                    "inconclusive: timing spread %.2f (baseline) / %.2f (candidate) exceeds tolerance %.2f, "
                            + "speedup ratio %.2f",
                    baseline.getRelativeSpread(), candidate.getRelativeSpread(), varianceTolerance, ratio));
        }
        if (ratio >= minSpeedup && ratio > 1.0) {
            return new PerformanceAssessment(ratio, Outcome.PASS, String.format(Locale.ROOT,
                    "improved: speedup ratio %.2f (baseline %.2f ms, candidate %.2f ms)",
                    ratio, baselineMs, candidateMs));
        }
        if (ratio <= 1.0) {
            return new PerformanceAssessment(ratio, Outcome.REGRESSION, String.format(Locale.ROOT,
                    "regressed: speedup ratio %.2f (baseline %.2f ms, candidate %.2f ms)",
                    ratio, baselineMs, candidateMs));
        }
        return new PerformanceAssessment(ratio, Outcome.REGRESSION, String.format(Locale.ROOT,
                "insufficient improvement: speedup ratio %.2f below required %.2f (baseline %.2f ms, candidate %.2f ms)",
                ratio, minSpeedup, baselineMs, candidateMs));
    }
}
