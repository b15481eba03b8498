package com.kendb3.cli.model;

import com.kendb3.config.KenDb3Config;

import lombok.Getter;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Options of the "export-models" command. No validation, no execution logic.
 */
@Getter
public class ExportOptions {

    @Option(names = {"--output", "-o"}, required = true,
            description = "TypeScript file to write the model declarations to")
    private Path output;

    @Option(names = {"--endpoint-template"}, defaultValue = KenDb3Config.DEFAULT_ENDPOINT_TEMPLATE,
            description = "Data manager URL template; MODEL_NAME is replaced by the model API name (default: ${DEFAULT-VALUE})")
    private String endpointTemplate;

    @Option(names = {"--generator-name"}, defaultValue = KenDb3Config.DEFAULT_GENERATOR_NAME,
            description = "Generator name written to the file header")
    private String generatorName;

    @Option(names = {"--force", "-f"}, description = "Overwrite an existing output file")
    private boolean force;
}
