package com.example.sqlpilot.model;

public enum Variant {
    ORIGINAL,
    CANDIDATE
}
