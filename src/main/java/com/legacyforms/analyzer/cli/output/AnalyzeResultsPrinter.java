package com.legacyforms.analyzer.cli.output;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.legacyforms.analyzer.model.AnalysisMessage;
import com.legacyforms.analyzer.model.AnalysisResult;
import com.legacyforms.analyzer.model.DataColumn;
import com.legacyforms.analyzer.model.FormDefinition;
import com.legacyforms.analyzer.model.FormMetadata;
import com.legacyforms.analyzer.model.context.AnalyzerConfig;

/**
 * Responsible only for printing CLI output for the "analyze" command.
 * No validation, no execution.
 */
public class AnalyzeResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeResultsPrinter.class);

    public void printBanner(AnalyzerConfig config) {
        log.info("=================================================");
        log.info("InfoPath Form Analyzer");
        log.info("=================================================");
        log.info("Form: {}", config.getFormName());
        log.info("Input: {} ({})", config.getFormPath().toAbsolutePath(),
                config.isPackageInput() ? "package" : "directory");
        log.info("Output Directory: {}", config.getOutputDir());
        log.info("JSON Model: {}", config.isWriteJson() ? config.getJsonFile() : "skipped");
        log.info("Summary: {}", config.isWriteSummary() ? config.getSummaryFile() : "skipped");
        log.info("=================================================");
    }

    public void printSuccess(AnalysisResult result, AnalyzerConfig config) {
        FormDefinition form = result.getForm();
        FormMetadata metadata = form.getMetadata();

        log.info("");
        log.info("=================================================");
        log.info("ANALYSIS SUCCESSFUL");
        log.info("=================================================");
        log.info("Views Parsed: {}", result.getViewsParsed());
        log.info("Controls: {}", metadata.getTotalControls());
        log.info("Sections: {}", metadata.getTotalSections());
        log.info("Repeating Sections: {}", metadata.getRepeatingSectionCount());
        log.info("Dynamic Sections: {}", metadata.getDynamicSectionCount());
        log.info("Main Columns: {}", form.mainColumns().size());

        Map<String, List<DataColumn>> repeating = form.repeatingColumnsBySection();
        if (!repeating.isEmpty()) {
            log.info("");
            log.info("Repeating Groups:");
            repeating.forEach((name, columns) -> log.info("  {}: {} column(s)", name, columns.size()));
        }

        printMessages(result.getMessages());

        log.info("");
        if (config.isWriteJson()) {
            log.info("JSON Model: {}", config.getJsonFile());
        }
        if (config.isWriteSummary()) {
            log.info("Summary: {}", config.getSummaryFile());
        }
        log.info("Duration: {} ms", result.getDurationMillis());
        log.info("=================================================");
    }

    public void printFailure(AnalysisResult result) {
        log.error("");
        log.error("=================================================");
        log.error("ANALYSIS FAILED");
        log.error("=================================================");
        log.error("Error: {}", result.getErrorMessage());
    }

    public void printValidationErrors(List<String> errors) {
        log.error("Invalid options:");
        errors.forEach(e -> log.error("  - {}", e));
    }

    private void printMessages(List<AnalysisMessage> messages) {
        if (messages.isEmpty()) {
            return;
        }
        log.info("");
        log.info("Findings:");
        for (AnalysisMessage message : messages) {
            switch (message.getSeverity()) {
                case ERROR -> log.error("  [{}] {}", message.getSource(), message.getMessage());
                case WARNING -> log.warn("  [{}] {}", message.getSource(), message.getMessage());
                default -> log.info("  [{}] {}", message.getSource(), message.getMessage());
            }
        }
    }
}
