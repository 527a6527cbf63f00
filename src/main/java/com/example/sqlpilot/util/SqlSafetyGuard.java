package com.example.sqlpilot.util;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.example.sqlpilot.exception.UnsafeSqlException;
import com.example.sqlpilot.model.ProposalKind;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.create.index.CreateIndex;
import net.sf.jsqlparser.statement.select.Select;

/**
 * Refuses anything but a single read-only query, or for candidates a single {@code CREATE INDEX}.
 */
@Slf4j
public class SqlSafetyGuard {

    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:[^']|'')*'");

    private final List<String> forbiddenOperations;
    private final Pattern forbiddenPattern;

    public SqlSafetyGuard(List<String> forbiddenOperations) {
        this.forbiddenOperations = forbiddenOperations.stream()
                .map(op -> op.trim().toUpperCase(Locale.ROOT))
                .filter(op -> !op.isEmpty())
                .collect(Collectors.toUnmodifiableList());
        this.forbiddenPattern = this.forbiddenOperations.isEmpty()
                ? null
                : Pattern.compile("\\b(" + String.join("|", this.forbiddenOperations) + ")\\b",
                        Pattern.CASE_INSENSITIVE);
    }

    public List<String> getForbiddenOperations() {
        return forbiddenOperations;
    }

    /**
     * Validates the query submitted for optimization.
     *
     * @throws UnsafeSqlException if it is not exactly one SELECT or mentions a forbidden operation
     */
    public void checkOriginal(String sql) {
        Statement statement = SqlStatementInspector.parseSingle(sql);
        if (!(statement instanceof Select)) {
            throw new UnsafeSqlException("Only SELECT statements can be optimized");
        }
        checkKeywords(sql);
    }

    /**
     * Decides what a candidate statement is, refusing anything that could change data.
     */
    public ProposalKind classifyCandidate(String sql) {
        Statement statement = SqlStatementInspector.parseSingle(sql);
        if (statement instanceof Select) {
            checkKeywords(sql);
            return ProposalKind.QUERY_REWRITE;
        }
        if (statement instanceof CreateIndex) {
            checkKeywords(sql);
            return ProposalKind.INDEX_DDL;
        }
        throw new UnsafeSqlException("Candidate must be a SELECT or CREATE INDEX statement, got "
                + statement.getClass().getSimpleName());
    }

    private void checkKeywords(String sql) {
        if (forbiddenPattern == null) {
            return;
        }
        String withoutLiterals = STRING_LITERAL.matcher(sql).replaceAll("''");
        Matcher matcher = forbiddenPattern.matcher(withoutLiterals);
        if (matcher.find()) {
            String operation = matcher.group(1).toUpperCase(Locale.ROOT);
            log.warn("Refused SQL containing forbidden operation {}", operation);
            throw new UnsafeSqlException("Forbidden operation: " + operation);
        }
    }
}
