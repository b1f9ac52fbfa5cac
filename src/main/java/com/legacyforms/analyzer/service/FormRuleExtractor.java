package com.legacyforms.analyzer.service;

import java.util.List;

import com.legacyforms.analyzer.model.FormRule;
import com.legacyforms.analyzer.model.context.ToolDiagnostics;

/**
 * Extracts declarative business rules from a form's manifest and views.
 */
public interface FormRuleExtractor {

    List<FormRule> extract(FormSourceFiles sources, ToolDiagnostics diagnostics);

    /**
     * Extractor that finds no rules.
     */
    static FormRuleExtractor none() {
        return (sources, diagnostics) -> List.of();
    }
}
