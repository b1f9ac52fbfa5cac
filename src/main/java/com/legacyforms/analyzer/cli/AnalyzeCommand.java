package com.legacyforms.analyzer.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.legacyforms.analyzer.cli.exception.OptionsValidationException;
import com.legacyforms.analyzer.cli.model.AnalyzeOptions;
import com.legacyforms.analyzer.cli.model.ValidatedAnalyzeOptions;
import com.legacyforms.analyzer.cli.output.AnalyzeResultsPrinter;
import com.legacyforms.analyzer.cli.validation.AnalyzeOptionsValidator;
import com.legacyforms.analyzer.export.FormJsonExporter;
import com.legacyforms.analyzer.export.FormSummaryReportWriter;
import com.legacyforms.analyzer.model.AnalysisResult;
import com.legacyforms.analyzer.model.context.AnalyzerConfig;
import com.legacyforms.analyzer.service.FormAnalysisService;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that analyzes one InfoPath form and writes its model.
 */
@Command(
        name = "analyze",
        mixinStandardHelpOptions = true,
        version = "infopath-form-analyzer 1.0.0",
        description = "Reconstructs views, controls, sections and data columns from an InfoPath form."
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Mixin
    private AnalyzeOptions options = new AnalyzeOptions();

    private final AnalyzeOptionsValidator validator = new AnalyzeOptionsValidator();
    private final AnalyzeResultsPrinter printer = new AnalyzeResultsPrinter();
    private final FormAnalysisService analysisService;
    private final FormJsonExporter jsonExporter = new FormJsonExporter();
    private final FormSummaryReportWriter summaryWriter = new FormSummaryReportWriter();

    public AnalyzeCommand() {
        this(new FormAnalysisService());
    }

    public AnalyzeCommand(FormAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @Override
    public Integer call() {
        ValidatedAnalyzeOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e.getErrors());
            return 1;
        }

        AnalyzerConfig config = toConfig(validated);
        printer.printBanner(config);

        try {
            AnalysisResult result = analysisService.analyze(config.getFormPath(), config.getFormName());
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }

            if (config.isWriteJson()) {
                jsonExporter.write(result.getForm(), config.getJsonFile());
            }
            if (config.isWriteSummary()) {
                summaryWriter.write(result.getForm(), result.getMessages(), config.getSummaryFile());
            }

            printer.printSuccess(result, config);
            return 0;
        } catch (Exception e) {
            log.error("Analysis failed with exception", e);
            return 1;
        }
    }

    private AnalyzerConfig toConfig(ValidatedAnalyzeOptions validated) {
        return AnalyzerConfig.builder()
                .formPath(options.getFormPath())
                .packageInput(validated.isPackageInput())
                .formName(validated.getFormName())
                .outputDir(validated.getNormalizedOutputDir())
                .jsonFile(validated.getJsonFile())
                .summaryFile(validated.getSummaryFile())
                .build();
    }
}
