package com.legacyforms.analyzer.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.legacyforms.analyzer.analysis.FormAnalysisReporter;
import com.legacyforms.analyzer.model.AnalysisMessage;
import com.legacyforms.analyzer.model.AnalysisResult;
import com.legacyforms.analyzer.model.FormDefinition;
import com.legacyforms.analyzer.model.context.ToolDiagnostics;
import com.legacyforms.analyzer.parser.ViewLoadException;
import com.legacyforms.analyzer.postprocess.FormPostProcessor;

import lombok.RequiredArgsConstructor;

/**
 * Form-level driver: discovers the inputs, parses every view, collects
 * rules, post-processes the form and derives the analysis messages.
 */
@RequiredArgsConstructor
public class FormAnalysisService {
    private static final Logger log = LoggerFactory.getLogger(FormAnalysisService.class);

    private final FormDirectoryDiscoveryService discoveryService;
    private final ViewParserService viewParserService;
    private final FormRuleExtractor ruleExtractor;
    private final FormPostProcessor postProcessor;
    private final FormAnalysisReporter reporter;
    private final List<FormPackageExtractor> packageExtractors;

    public FormAnalysisService() {
        this(new FormDirectoryDiscoveryService(), new ViewParserService(), FormRuleExtractor.none(),
                new FormPostProcessor(), new FormAnalysisReporter(), List.of(new ZipFormPackageExtractor()));
    }

    /**
     * Analyzes an extracted form directory or a form package file.
     */
    public AnalysisResult analyze(Path formPath, String formName) {
        if (Files.isDirectory(formPath)) {
            return analyzeDirectory(formPath, formName);
        }
        if (Files.isRegularFile(formPath)) {
            return analyzePackage(formPath, formName);
        }
        return AnalysisResult.failure("Form path does not exist: " + formPath);
    }

    public AnalysisResult analyzePackage(Path formPackage, String formName) {
        FormPackageExtractor extractor = packageExtractors.stream()
                .filter(e -> e.supports(formPackage))
                .findFirst()
                .orElse(null);
        if (extractor == null) {
            return AnalysisResult.failure("Unsupported form package: " + formPackage.getFileName());
        }

        try (ExtractedForm extracted = extractor.extract(formPackage)) {
            return analyzeDirectory(extracted.getDirectory(), formName != null ? formName : baseName(formPackage));
        } catch (FormExtractionException e) {
            log.error("Extraction failed: {}", e.getMessage());
            return AnalysisResult.failure(e.getMessage());
        }
    }

    public AnalysisResult analyzeDirectory(Path formDir, String formName) {
        long start = System.currentTimeMillis();
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        String name = formName != null ? formName : baseName(formDir);

        FormSourceFiles sources;
        try {
            sources = discoveryService.discover(formDir);
        } catch (IOException e) {
            log.error("Cannot read form directory {}: {}", formDir, e.getMessage());
            return AnalysisResult.failure("Cannot read form directory " + formDir + ": " + e.getMessage());
        }
        if (sources.isEmpty()) {
            return AnalysisResult.failure("No manifest or view files found in " + formDir);
        }
        if (sources.manifest() == null) {
            diagnostics.getWarnings().add("No " + FormDirectoryDiscoveryService.MANIFEST_FILE + " found in " + formDir);
        }

        log.info("Analyzing form {}: {} view(s), {} schema file(s)", name, sources.views().size(),
                sources.schemas().size());

        FormDefinition form = new FormDefinition(name);
        int viewsParsed = 0;
        for (Path viewFile : sources.views()) {
            try {
                ViewParseOutput output = viewParserService.parse(viewFile, diagnostics);
                form.getViews().add(output.view());
                form.getDynamicSections().addAll(output.dynamicSections());
                viewsParsed++;
            } catch (ViewLoadException e) {
                log.error("Skipping view {}: {}", viewFile.getFileName(), e.getMessage());
                diagnostics.getErrors().add(e.getMessage());
            }
        }

        try {
            form.getRules().addAll(ruleExtractor.extract(sources, diagnostics));
        } catch (RuntimeException e) {
            log.warn("Rule extraction failed: {}", e.getMessage(), e);
            diagnostics.getWarnings().add("Rule extraction failed: " + e.getMessage());
        }

        postProcessor.process(form, diagnostics);
        List<AnalysisMessage> messages = reporter.report(form, diagnostics);

        return AnalysisResult.builder()
                .success(true)
                .form(form)
                .messages(messages)
                .diagnostics(diagnostics)
                .viewsParsed(viewsParsed)
                .durationMillis(System.currentTimeMillis() - start)
                .build();
    }

    private static String baseName(Path path) {
        Path last = path.toAbsolutePath().normalize().getFileName();
        if (last == null) {
            return "form";
        }
        String fileName = last.toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
