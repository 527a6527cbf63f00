package com.example.sqlpilot.model;

public enum ProposalKind {
    QUERY_REWRITE,
    INDEX_DDL
}
