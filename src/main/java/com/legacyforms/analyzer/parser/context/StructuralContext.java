package com.legacyforms.analyzer.parser.context;

import com.legacyforms.analyzer.model.SectionInfo;

/**
 * Entry on the structural context stack of one view parse: either a plain
 * section or a repeating group.
 */
public interface StructuralContext {

    String name();

    String binding();

    int depth();

    /**
     * Section record opened together with this context and closed when it is left.
     */
    SectionInfo section();
}
