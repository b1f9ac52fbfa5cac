package com.legacyforms.analyzer.model.context;

import java.nio.file.Path;

import lombok.Builder;
import lombok.Value;

/**
 * Settings for one analysis run, derived from validated CLI options. Output
 * files are null when the corresponding output is skipped.
 */
@Value
@Builder
public class AnalyzerConfig {
    Path formPath;
    boolean packageInput;
    String formName;
    Path outputDir;
    Path jsonFile;
    Path summaryFile;

    public boolean isWriteJson() {
        return jsonFile != null;
    }

    public boolean isWriteSummary() {
        return summaryFile != null;
    }
}
