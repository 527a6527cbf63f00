package com.example.sqlpilot.model;

public enum IssueTag {
    FULL_SCAN("full-scan"),
    MISSING_INDEX("missing-index"),
    FUNCTION_ON_INDEXED_COLUMN("function-on-indexed-column"),
    NON_SARGABLE_PREDICATE("non-sargable-predicate"),
    SELECT_STAR("select-star"),
    FILESORT_OR_TEMPORARY("filesort-or-temporary");

    private final String label;

    IssueTag(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
