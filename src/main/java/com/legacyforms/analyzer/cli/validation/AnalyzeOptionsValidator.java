package com.legacyforms.analyzer.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.legacyforms.analyzer.cli.exception.OptionsValidationException;
import com.legacyforms.analyzer.cli.model.AnalyzeOptions;
import com.legacyforms.analyzer.cli.model.ValidatedAnalyzeOptions;

public class AnalyzeOptionsValidator {

	public ValidatedAnalyzeOptions validate(AnalyzeOptions o) {
		List<String> errors = new ArrayList<>();

		boolean packageInput = false;
		if (o.getFormPath() == null) {
			errors.add("Form path is required (--form / -f).");
		} else if (!Files.exists(o.getFormPath())) {
			errors.add("Form path does not exist: " + o.getFormPath());
		} else if (Files.isRegularFile(o.getFormPath())) {
			packageInput = true;
			if (!fileName(o.getFormPath()).endsWith(".zip")) {
				errors.add("Form package must be a .zip file or an extracted directory: " + o.getFormPath());
			}
		}

		String formName = isBlank(o.getFormName()) ? defaultFormName(o.getFormPath()) : o.getFormName().trim();
		if (formName != null && !formName.matches("[\\w .-]+")) {
			errors.add("Form name may only contain letters, digits, spaces, '.', '_' and '-'. Got: " + formName);
		}

		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath()
				.normalize();
		if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
			errors.add("Output path is not a directory: " + normalizedOutputDir);
		}

		String baseName = formName == null ? "form" : formName;
		Path jsonFile = o.isSkipJson() ? null : normalizedOutputDir.resolve(baseName + ".json");
		Path summaryFile = o.isSkipSummary() ? null : normalizedOutputDir.resolve(baseName + "-summary.md");

		for (Path output : new Path[] { jsonFile, summaryFile }) {
			if (output != null && Files.exists(output) && !o.isForce()) {
				errors.add("Output file already exists: " + output + ". Use --force to overwrite.");
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedAnalyzeOptions(packageInput, formName, normalizedOutputDir, jsonFile, summaryFile);
	}

	private static String defaultFormName(Path formPath) {
		if (formPath == null) {
			return null;
		}
		Path last = formPath.toAbsolutePath().normalize().getFileName();
		if (last == null) {
			return "form";
		}
		String name = last.toString();
		int dot = name.lastIndexOf('.');
		return Files.isRegularFile(formPath) && dot > 0 ? name.substring(0, dot) : name;
	}

	private static String fileName(Path p) {
		Path last = p.toAbsolutePath().normalize().getFileName();
		return last == null ? "" : last.toString().toLowerCase(Locale.ROOT);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
