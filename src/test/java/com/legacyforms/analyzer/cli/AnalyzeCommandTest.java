package com.legacyforms.analyzer.cli;

import static com.legacyforms.analyzer.ViewFixtures.NAME_AND_ITEMS_VIEW;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AnalyzeCommand.
 */
class AnalyzeCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testAnalyzeWritesModelAndSummary() throws IOException {
        Path formDir = Files.createDirectories(tempDir.resolve("Expenses"));
        Files.writeString(formDir.resolve("view1.xsl"), NAME_AND_ITEMS_VIEW);
        Path outDir = tempDir.resolve("out");

        int exitCode = new CommandLine(new AnalyzeCommand())
                .execute("--form", formDir.toString(), "--output-dir", outDir.toString());

        assertThat(exitCode).isZero();
        assertThat(outDir.resolve("Expenses.json")).exists();
        assertThat(Files.readString(outDir.resolve("Expenses-summary.md")))
                .contains("# Form: Expenses")
                .contains("### Items");
    }

    @Test
    void testSkipFlagsWriteNothing() throws IOException {
        Path formDir = Files.createDirectories(tempDir.resolve("Expenses"));
        Files.writeString(formDir.resolve("view1.xsl"), NAME_AND_ITEMS_VIEW);
        Path outDir = Files.createDirectories(tempDir.resolve("out"));

        int exitCode = new CommandLine(new AnalyzeCommand()).execute("-f", formDir.toString(),
                "-o", outDir.toString(), "--skip-json", "--skip-summary");

        assertThat(exitCode).isZero();
        try (Stream<Path> files = Files.list(outDir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void testMissingFormFails() {
        int exitCode = new CommandLine(new AnalyzeCommand())
                .execute("--form", tempDir.resolve("missing").toString(), "-o", tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void testEmptyFormDirectoryFails() throws IOException {
        Path formDir = Files.createDirectories(tempDir.resolve("Empty"));

        int exitCode = new CommandLine(new AnalyzeCommand())
                .execute("--form", formDir.toString(), "-o", tempDir.resolve("out").toString());

        assertThat(exitCode).isEqualTo(1);
    }
}
