package com.kendb3.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the export-models command line.
 */
class ExportModelsCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testExportWritesDeclarations() throws Exception {
        Path output = tempDir.resolve("models.autogenerated.ts");

        int exitCode = new CommandLine(new ExportModelsCommand())
                .execute("-o", output.toString(), "--endpoint-template", "data/MODEL_NAME");

        assertThat(exitCode).isZero();
        assertThat(Files.readString(output))
                .contains("export class SubmissionRevision extends ModelBase {")
                .contains("?? 'data/MODEL_NAME'");
    }

    @Test
    void testExistingOutputWithoutForceFails() throws Exception {
        Path output = Files.writeString(tempDir.resolve("models.autogenerated.ts"), "keep");

        int exitCode = new CommandLine(new ExportModelsCommand()).execute("-o", output.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(Files.readString(output)).isEqualTo("keep");
    }

    @Test
    void testForceOverwrites() throws Exception {
        Path output = Files.writeString(tempDir.resolve("models.autogenerated.ts"), "old");

        int exitCode = new CommandLine(new ExportModelsCommand()).execute("-o", output.toString(), "-f");

        assertThat(exitCode).isZero();
        assertThat(Files.readString(output)).contains("THIS IS AN AUTOGENERATED FILE");
    }

    @Test
    void testMissingOutputIsUsageError() {
        int exitCode = new CommandLine(new ExportModelsCommand()).execute();

        assertThat(exitCode).isEqualTo(2);
    }
}
