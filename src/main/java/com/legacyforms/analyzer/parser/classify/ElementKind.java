package com.legacyforms.analyzer.parser.classify;

public enum ElementKind {
    LABEL,
    BOUND_CONTROL,
    PLAIN_SECTION,
    REPEATING_SECTION,
    REPEATING_TABLE,
    TEMPLATE_INDIRECTION,
    /** A moded template block met directly by the walk rather than through an indirection. */
    TEMPLATE_DEFINITION,
    PASS_THROUGH
}
