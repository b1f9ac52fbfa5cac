package com.legacyforms.analyzer;

import com.legacyforms.analyzer.cli.AnalyzeCommand;

import picocli.CommandLine;

/**
 * Main entry point for the InfoPath Form Analyzer.
 * Reads an extracted form directory or a ZIP form package and reconstructs
 * its views, controls, sections and canonical data columns.
 */
public class InfoPathAnalyzerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AnalyzeCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
