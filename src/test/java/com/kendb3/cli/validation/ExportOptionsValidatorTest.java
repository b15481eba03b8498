package com.kendb3.cli.validation;

import com.kendb3.cli.exception.OptionsValidationException;
import com.kendb3.cli.model.ExportOptions;
import com.kendb3.cli.model.ValidatedExportOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ExportOptionsValidator.
 */
class ExportOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final ExportOptionsValidator validator = new ExportOptionsValidator();

    private static ExportOptions parse(String... args) {
        ExportOptions options = new ExportOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }

    @Test
    void testValidOptions() {
        Path output = tempDir.resolve("out").resolve("models.ts");

        ValidatedExportOptions validated = validator.validate(parse("-o", output.toString()));

        assertThat(validated.getNormalizedOutputPath()).isEqualTo(output.toAbsolutePath().normalize());
        assertThat(validated.isOverwriting()).isFalse();
    }

    @Test
    void testExistingOutputNeedsForce() throws Exception {
        Path output = Files.writeString(tempDir.resolve("models.ts"), "");

        assertThatThrownBy(() -> validator.validate(parse("-o", output.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("Use --force to overwrite");

        ValidatedExportOptions forced = validator.validate(parse("-o", output.toString(), "--force"));
        assertThat(forced.isOverwriting()).isTrue();
    }

    @Test
    void testAllErrorsReportedTogether() {
        ExportOptions options = parse("-o", tempDir.toString(),
                "--endpoint-template", "api/v0/", "--generator-name", " ");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .hasSize(3)
                        .anySatisfy(error -> assertThat(error).startsWith("Output path is a directory"))
                        .anySatisfy(error -> assertThat(error).contains("must contain MODEL_NAME"))
                        .anySatisfy(error -> assertThat(error).startsWith("Generator name must not be blank")));
    }
}
