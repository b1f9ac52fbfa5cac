package com.legacyforms.analyzer.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "analyze" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class AnalyzeOptions {

	@Option(names = { "--form", "-f" }, description = "Extracted form directory or .zip form package")
	private Path formPath;

	@Option(names = { "--name", "-n" }, description = "Form name (defaults to the directory or package name)")
	private String formName;

	@Option(names = { "--output-dir", "-o" }, description = "Output directory (defaults to current directory)")
	private Path outputDir;

	@Option(names = { "--skip-json" }, description = "Do not write the JSON form model")
	private boolean skipJson;

	@Option(names = { "--skip-summary" }, description = "Do not write the Markdown summary")
	private boolean skipSummary;

	@Option(names = { "--force" }, description = "Overwrite existing output files")
	private boolean force;
}
