package com.example.sqlpilot.util;

import java.util.Locale;

import com.example.sqlpilot.model.DetectedIssue;
import com.example.sqlpilot.model.Diagnosis;
import com.example.sqlpilot.model.Proposal;
import com.example.sqlpilot.model.RequestOutcome;
import com.example.sqlpilot.model.VerificationVerdict;

/**
 * Plain-text report of a finished request, as printed by the command line.
 */
public class OutcomeReportFormatter {

    public static String format(RequestOutcome outcome, boolean verbose) {
        StringBuilder report = new StringBuilder();
        report.append("# SQL optimization ").append(outcome.getStatus()).append("\n\n");
        report.append("Request: ").append(outcome.getRequestId()).append("\n");
        if (outcome.getMessage() != null) {
            report.append(outcome.getMessage()).append("\n");
        }

        Diagnosis diagnosis = outcome.getDiagnosis();
        if (diagnosis != null) {
            report.append("\n## Diagnosis\n\n").append(diagnosis.getSummary()).append("\n");
            if (verbose) {
                for (DetectedIssue issue : diagnosis.getIssues()) {
                    report.append("- ").append(issue.describe()).append("\n");
                }
                if (diagnosis.getPlan() != null && !diagnosis.getPlan().getPlanText().isBlank()) {
                    report.append("\n### Plan\n\n").append(diagnosis.getPlan().getPlanText()).append("\n");
                }
            }
        }

        if (verbose && !outcome.getVerdicts().isEmpty()) {
            report.append("\n## Attempts\n\n");
            for (VerificationVerdict verdict : outcome.getVerdicts()) {
                report.append(verdict.getAttempt()).append(". ");
                if (verdict.isAccepted()) {
                    report.append(String.format(Locale.ROOT, "accepted, speedup %.2fx", verdict.getSpeedupRatio()));
                } else {
                    report.append(verdict.getRejectionKind()).append(": ").append(verdict.getRejectionReason());
                }
                report.append("\n");
                if (verdict.getProposal() != null) {
                    report.append("   ").append(verdict.getProposal().getStatement().replace("\n", "\n   ")).append("\n");
                }
            }
        }

        report.append("\n## Recommended SQL\n\n```sql\n").append(outcome.recommendedSql()).append("\n```\n");
        if (outcome.recommendedIndexDdl() != null) {
            report.append("\n## Recommended index\n\n```sql\n").append(outcome.recommendedIndexDdl()).append("\n```\n");
        }

        Proposal accepted = outcome.getAcceptedProposal();
        if (outcome.isVerified() && accepted != null) {
            report.append(String.format(Locale.ROOT, "%nVerified: identical results, %.2fx faster (baseline %.2f ms, candidate %.2f ms)%n",
                    outcome.getAcceptedVerdict().getSpeedupRatio(),
                    outcome.getAcceptedVerdict().getBaseline().getElapsedMs(),
                    outcome.getAcceptedVerdict().getCandidate().getElapsedMs()));
            if (accepted.getRationale() != null && !accepted.getRationale().isBlank()) {
                report.append("\n## Rationale\n\n").append(accepted.getRationale()).append("\n");
            }
        } else {
            report.append("\nNot verified: the original query is returned unchanged.\n");
        }
        return report.toString();
    }
}
