package com.legacyforms.analyzer.parser.classify;

public enum IndirectionKind {
    /** The referenced block repeats once per item of a collection. */
    REPEATING,
    /** A single-item reference inside an already open repeating block. */
    NESTED_IN_REPEATING,
    /** Plain reuse: the block's children inherit the open context. */
    PASS_THROUGH
}
