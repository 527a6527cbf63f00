package com.example.sqlpilot.service;

import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Service;

import com.example.sqlpilot.exception.ProposalInvalidException;
import com.example.sqlpilot.model.AttemptFeedback;
import com.example.sqlpilot.model.ColumnMetadata;
import com.example.sqlpilot.model.DetectedIssue;
import com.example.sqlpilot.model.Diagnosis;
import com.example.sqlpilot.model.Dialect;
import com.example.sqlpilot.model.IndexMetadata;
import com.example.sqlpilot.model.ProposalReply;
import com.example.sqlpilot.model.TableMetadata;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Asks the language model for one optimization and reads its answer from a fixed markdown template.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LLMProposalSource implements ProposalSource {

    static final String CANDIDATE_SECTION = "Candidate SQL";
    static final String INDEX_SECTION = "Index DDL";
    static final String RATIONALE_SECTION = "Rationale";

    private final LLMService llmService;

    @Override
    public Mono<ProposalReply> propose(String originalSql, Dialect dialect, Diagnosis diagnosis,
                                       List<AttemptFeedback> priorFeedback) {
        String prompt = formatPrompt(originalSql, dialect, diagnosis, priorFeedback);
        return llmService.complete(prompt).map(LLMProposalSource::parseReply);
    }

    static String formatPrompt(String query, Dialect dialect, Diagnosis diagnosis,
                               List<AttemptFeedback> priorFeedback) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Optimize the following ").append(dialect.name()).append(" query. ")
                .append("The result set must stay exactly the same: same rows, same columns, same order if ordered.\n");
        prompt.append("\nSQL query to optimize:\n```sql\n").append(query).append("\n```\n");

        if (diagnosis != null) {
            prompt.append("\nDiagnosis: ").append(diagnosis.getSummary()).append("\n");
            for (DetectedIssue issue : diagnosis.getIssues()) {
                prompt.append("- ").append(issue.describe()).append("\n");
            }

            if (diagnosis.getPlan() != null && !diagnosis.getPlan().getPlanText().isBlank()) {
                prompt.append("\nExecution plan:\n```\n").append(diagnosis.getPlan().getPlanText()).append("\n```\n");
            }

            if (diagnosis.getSchema() != null && !diagnosis.getSchema().isEmpty()) {
                prompt.append("\nTable metadata:\n");
                for (TableMetadata table : diagnosis.getSchema().getTables().values()) {
                    prompt.append("\nTable: ").append(table.getName());
                    if (table.getEstimatedRows() != null) {
                        prompt.append(" (~").append(table.getEstimatedRows()).append(" rows)");
                    }
                    prompt.append("\n");
                    if (!table.getColumns().isEmpty()) {
                        prompt.append("Columns:\n");
                        for (ColumnMetadata column : table.getColumns()) {
                            prompt.append("- ").append(column.getName())
                                    .append(" (").append(column.getType()).append(")")
                                    .append(column.isNullable() ? " NULL" : " NOT NULL")
                                    .append("\n");
                        }
                    }
                    if (!table.getIndexes().isEmpty()) {
                        prompt.append("Indexes:\n");
                        for (IndexMetadata index : table.getIndexes()) {
                            prompt.append("- ").append(index.getName())
                                    .append(" (").append(String.join(", ", index.getColumns())).append(")")
                                    .append(index.isUnique() ? " UNIQUE" : "")
                                    .append("\n");
                        }
                    }
                }
            }
        }

        if (priorFeedback != null && !priorFeedback.isEmpty()) {
            prompt.append("\nPrevious attempts were rejected after validation against real data:\n");
            for (AttemptFeedback feedback : priorFeedback) {
                prompt.append("- ").append(feedback.describe()).append("\n");
                if (feedback.getRejectedStatement() != null) {
                    prompt.append("  Rejected statement: ").append(feedback.getRejectedStatement()).append("\n");
                }
            }
            prompt.append("Propose something different that avoids these problems.\n");
        }

        prompt.append("\nAnswer using exactly this template. Fill in either the candidate SQL or the index DDL ")
                .append("and write none in the other section.\n\n");
        prompt.append("## ").append(CANDIDATE_SECTION).append("\n\n```sql\n[rewritten SELECT statement or none]\n```\n\n");
        prompt.append("## ").append(INDEX_SECTION).append("\n\n```sql\n[single CREATE INDEX statement or none]\n```\n\n");
        prompt.append("## ").append(RATIONALE_SECTION).append("\n\n[why this is faster]\n");
        return prompt.toString();
    }

    static ProposalReply parseReply(String response) {
        ProposalReply.ProposalReplyBuilder reply = ProposalReply.builder();
        boolean sectioned = false;

        String[] sections = response.split("(?m)^##(?!#)");
        for (String section : sections) {
            String heading = section.lines().findFirst().orElse("").trim().toLowerCase(Locale.ROOT);
            String body = section.contains("\n") ? section.substring(section.indexOf('\n') + 1) : "";
            if (heading.startsWith(CANDIDATE_SECTION.toLowerCase(Locale.ROOT))) {
                reply.candidateSql(statementIn(body));
                sectioned = true;
            } else if (heading.startsWith(INDEX_SECTION.toLowerCase(Locale.ROOT))) {
                reply.indexDdl(statementIn(body));
                sectioned = true;
            } else if (heading.startsWith(RATIONALE_SECTION.toLowerCase(Locale.ROOT))) {
                reply.rationale(body.trim());
            }
        }

        if (!sectioned) {
            String sql = codeBlock(response);
            if (sql == null) {
                log.error("No SQL found in LLM response");
                throw new ProposalInvalidException("No SQL statement found in LLM response");
            }
            sql = stripSemicolon(sql);
            if (sql.toUpperCase(Locale.ROOT).matches("(?s)CREATE\\s+(UNIQUE\\s+)?INDEX.*")) {
                reply.indexDdl(sql);
            } else {
                reply.candidateSql(sql);
            }
            reply.rationale(response.substring(0, response.indexOf("```")).trim());
        }
        return reply.build();
    }

    private static String statementIn(String body) {
        String code = codeBlock(body);
        String statement = stripSemicolon(code != null ? code : body);
        if (statement.isEmpty() || isPlaceholder(statement)) {
            return null;
        }
        return statement;
    }

    private static boolean isPlaceholder(String statement) {
        String normalized = statement.toLowerCase(Locale.ROOT).replaceAll("[\\[\\]().\\-_`*]", "").trim();
        return normalized.equals("none") || normalized.equals("n/a") || normalized.equals("na")
                || normalized.equals("null") || normalized.startsWith("rewritten select")
                || normalized.startsWith("single create index");
    }

    private static String codeBlock(String text) {
        int fence = text.indexOf("```");
        if (fence < 0) {
            return null;
        }
        int start = text.indexOf('\n', fence);
        if (start < 0) {
            return null;
        }
        int end = text.indexOf("```", start);
        if (end < 0) {
            return null;
        }
        return text.substring(start + 1, end).trim();
    }

    private static String stripSemicolon(String sql) {
        String trimmed = sql.trim();
        while (trimmed.endsWith(";")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        return trimmed;
    }
}
