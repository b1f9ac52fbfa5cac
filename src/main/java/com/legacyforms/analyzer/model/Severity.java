package com.legacyforms.analyzer.model;

public enum Severity {
    INFO,
    WARNING,
    ERROR
}
