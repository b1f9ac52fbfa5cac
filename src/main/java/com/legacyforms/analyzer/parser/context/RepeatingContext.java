package com.legacyforms.analyzer.parser.context;

import com.legacyforms.analyzer.model.SectionInfo;

/**
 * Open repeating section or repeating table. {@code table} is set for the latter.
 */
public record RepeatingContext(String name, String binding, boolean table, int depth, SectionInfo section)
        implements StructuralContext {
}
