package com.legacyforms.analyzer.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps AnalyzeCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedAnalyzeOptions {
    boolean packageInput;
    String formName;
    Path normalizedOutputDir;
    Path jsonFile;
    Path summaryFile;
}
