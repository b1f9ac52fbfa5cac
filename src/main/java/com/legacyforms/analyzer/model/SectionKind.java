package com.legacyforms.analyzer.model;

public enum SectionKind {
    PLAIN,
    REPEATING
}
