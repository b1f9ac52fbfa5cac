package com.legacyforms.analyzer.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.legacyforms.analyzer.cli.exception.OptionsValidationException;
import com.legacyforms.analyzer.cli.model.AnalyzeOptions;
import com.legacyforms.analyzer.cli.model.ValidatedAnalyzeOptions;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AnalyzeOptionsValidator.
 */
class AnalyzeOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final AnalyzeOptionsValidator validator = new AnalyzeOptionsValidator();

    @Test
    void testDirectoryInputWithDefaults() throws IOException {
        Path formDir = Files.createDirectories(tempDir.resolve("Expenses"));
        Path outDir = tempDir.resolve("out");

        ValidatedAnalyzeOptions validated = validator.validate(options("-f", formDir.toString(), "-o", outDir.toString()));

        assertThat(validated.isPackageInput()).isFalse();
        assertThat(validated.getFormName()).isEqualTo("Expenses");
        assertThat(validated.getJsonFile()).isEqualTo(outDir.toAbsolutePath().normalize().resolve("Expenses.json"));
        assertThat(validated.getSummaryFile())
                .isEqualTo(outDir.toAbsolutePath().normalize().resolve("Expenses-summary.md"));
    }

    @Test
    void testPackageInputNameAndSkips() throws IOException {
        Path zip = Files.writeString(tempDir.resolve("Travel.zip"), "");

        ValidatedAnalyzeOptions validated = validator.validate(options("--form", zip.toString(),
                "--output-dir", tempDir.toString(), "--skip-json", "--skip-summary"));

        assertThat(validated.isPackageInput()).isTrue();
        assertThat(validated.getFormName()).isEqualTo("Travel");
        assertThat(validated.getJsonFile()).isNull();
        assertThat(validated.getSummaryFile()).isNull();
    }

    @Test
    void testExplicitNameIsTrimmed() throws IOException {
        Path formDir = Files.createDirectories(tempDir.resolve("form"));

        ValidatedAnalyzeOptions validated = validator.validate(options("-f", formDir.toString(),
                "-n", "  Travel Request ", "-o", tempDir.toString()));

        assertThat(validated.getFormName()).isEqualTo("Travel Request");
    }

    @Test
    void testFilesystemRootFallsBackToDefaultName() {
        Path root = tempDir.toAbsolutePath().getRoot();
        Path outDir = tempDir.resolve("out");

        ValidatedAnalyzeOptions validated = validator.validate(options("-f", root.toString(), "-o", outDir.toString()));

        assertThat(validated.getFormName()).isEqualTo("form");
        assertThat(validated.getJsonFile()).isEqualTo(outDir.toAbsolutePath().normalize().resolve("form.json"));
    }

    @Test
    void testMissingFormPath() {
        assertThatThrownBy(() -> validator.validate(options()))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("Form path is required");
    }

    @Test
    void testCollectsAllErrors() throws IOException {
        Path notZip = Files.writeString(tempDir.resolve("form.xsn"), "");
        Path outFile = Files.writeString(tempDir.resolve("out.txt"), "");

        OptionsValidationException e = catchThrowableOfType(
                () -> validator.validate(options("-f", notZip.toString(), "-n", "bad/name", "-o", outFile.toString())),
                OptionsValidationException.class);

        assertThat(e.getErrors()).hasSize(3);
        assertThat(e.getErrors()).anySatisfy(m -> assertThat(m).contains(".zip"));
        assertThat(e.getErrors()).anySatisfy(m -> assertThat(m).contains("Form name"));
        assertThat(e.getErrors()).anySatisfy(m -> assertThat(m).contains("not a directory"));
    }

    @Test
    void testExistingOutputRequiresForce() throws IOException {
        Path formDir = Files.createDirectories(tempDir.resolve("Expenses"));
        Files.writeString(tempDir.resolve("Expenses.json"), "{}");

        assertThatThrownBy(() -> validator.validate(options("-f", formDir.toString(), "-o", tempDir.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("--force");

        assertThatNoException().isThrownBy(() -> validator.validate(
                options("-f", formDir.toString(), "-o", tempDir.toString(), "--force")));
    }

    private static AnalyzeOptions options(String... args) {
        return CommandLine.populateCommand(new AnalyzeOptions(), args);
    }
}
