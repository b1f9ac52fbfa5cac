package com.legacyforms.analyzer.service;

import java.util.List;

import com.legacyforms.analyzer.model.DynamicSection;
import com.legacyforms.analyzer.model.ViewDefinition;

public record ViewParseOutput(ViewDefinition view, List<DynamicSection> dynamicSections) {
}
