package com.legacyforms.analyzer.parser.context;

import com.legacyforms.analyzer.model.SectionInfo;

public record SectionContext(String name, String binding, String sectionType, String ctrlId, int depth,
        SectionInfo section) implements StructuralContext {
}
