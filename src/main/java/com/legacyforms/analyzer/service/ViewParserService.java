package com.legacyforms.analyzer.service;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import com.legacyforms.analyzer.model.DynamicSection;
import com.legacyforms.analyzer.model.ViewDefinition;
import com.legacyforms.analyzer.model.context.ToolDiagnostics;
import com.legacyforms.analyzer.parser.DynamicSectionExtractor;
import com.legacyforms.analyzer.parser.ViewParser;
import com.legacyforms.analyzer.parser.ViewTemplateLoader;
import com.legacyforms.analyzer.postprocess.LabelAssociator;
import com.legacyforms.analyzer.postprocess.MultiFragmentLabelMerger;

import lombok.RequiredArgsConstructor;

/**
 * Runs the per-view pipeline: structural parse, label association, label
 * fragment merge and the dynamic-section scan. A failing step is reported and
 * the remaining steps still run.
 */
@RequiredArgsConstructor
public class ViewParserService {
    private static final Logger log = LoggerFactory.getLogger(ViewParserService.class);

    private final ViewTemplateLoader loader;
    private final ViewParser parser;
    private final LabelAssociator labelAssociator;
    private final MultiFragmentLabelMerger labelMerger;
    private final DynamicSectionExtractor dynamicSectionExtractor;

    public ViewParserService() {
        this(new ViewTemplateLoader(), new ViewParser(), new LabelAssociator(), new MultiFragmentLabelMerger(),
                new DynamicSectionExtractor());
    }

    /**
     * @throws com.legacyforms.analyzer.parser.ViewLoadException if the file cannot be read or parsed as XML
     */
    public ViewParseOutput parse(Path viewFile, ToolDiagnostics diagnostics) {
        String viewName = viewFile.getFileName().toString();
        log.info("Parsing view: {}", viewName);
        return parse(viewName, loader.load(viewFile), diagnostics);
    }

    public ViewParseOutput parse(String viewName, Document document, ToolDiagnostics diagnostics) {
        ViewDefinition view;
        try {
            view = parser.parse(viewName, document);
        } catch (RuntimeException e) {
            log.warn("Structural parse of {} failed: {}", viewName, e.getMessage(), e);
            diagnostics.getErrors().add("Structural parse of " + viewName + " failed: " + e.getMessage());
            view = ViewDefinition.builder().viewName(viewName).build();
        }

        ViewDefinition parsed = view;
        runStep(viewName, "label association", diagnostics, () -> labelAssociator.associate(parsed.getControls()));
        runStep(viewName, "label merge", diagnostics, () -> labelMerger.merge(parsed.getControls()));

        List<DynamicSection> dynamicSections = List.of();
        try {
            dynamicSections = dynamicSectionExtractor.extract(document.getDocumentElement());
        } catch (RuntimeException e) {
            log.warn("Dynamic-section scan of {} failed: {}", viewName, e.getMessage(), e);
            diagnostics.getWarnings().add("Dynamic-section scan of " + viewName + " failed: " + e.getMessage());
        }

        log.info("View {}: {} controls, {} sections, {} dynamic sections", viewName,
                parsed.activeControls().size(), parsed.getSections().size(), dynamicSections.size());
        return new ViewParseOutput(parsed, dynamicSections);
    }

    private void runStep(String viewName, String step, ToolDiagnostics diagnostics, Runnable body) {
        try {
            body.run();
        } catch (RuntimeException e) {
            log.warn("{} of {} failed: {}", step, viewName, e.getMessage(), e);
            diagnostics.getWarnings().add(step + " of " + viewName + " failed: " + e.getMessage());
        }
    }
}
