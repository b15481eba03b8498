package com.kendb3.cli;

import com.kendb3.KenDb3Models;
import com.kendb3.api.codegen.Autogenerators;
import com.kendb3.api.codegen.ExportResult;
import com.kendb3.api.codegen.TypeScriptModelExporter;
import com.kendb3.api.server.ModelRegistry;
import com.kendb3.cli.exception.OptionsValidationException;
import com.kendb3.cli.model.ExportOptions;
import com.kendb3.cli.model.ValidatedExportOptions;
import com.kendb3.cli.output.ExportResultsPrinter;
import com.kendb3.cli.validation.ExportOptionsValidator;
import com.kendb3.config.KenDb3Config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * CLI command exporting the API model declarations for the frontend build.
 */
@Command(
        name = "export-models",
        mixinStandardHelpOptions = true,
        version = "kendb3-api 1.0.0",
        description = "Writes TypeScript declarations of every registered API model."
)
public class ExportModelsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExportModelsCommand.class);

    @Mixin
    private ExportOptions options = new ExportOptions();

    private final ExportOptionsValidator validator = new ExportOptionsValidator();
    private final ExportResultsPrinter printer = new ExportResultsPrinter();
    private final Supplier<ModelRegistry> registrySupplier;

    public ExportModelsCommand() {
        this(KenDb3Models::createRegistry);
    }

    public ExportModelsCommand(Supplier<ModelRegistry> registrySupplier) {
        this.registrySupplier = registrySupplier;
    }

    @Override
    public Integer call() {
        try {
            ValidatedExportOptions validated = validator.validate(options);
            printer.printBanner(options, validated);

            KenDb3Config config = KenDb3Config.builder()
                    .outputPath(validated.getNormalizedOutputPath())
                    .endpointTemplate(options.getEndpointTemplate())
                    .generatorName(options.getGeneratorName())
                    .force(options.isForce())
                    .build();

            ModelRegistry registry = registrySupplier.get();
            TypeScriptModelExporter exporter = new TypeScriptModelExporter(config);

            AtomicReference<ExportResult> result = new AtomicReference<>();
            Autogenerators autogenerators = new Autogenerators();
            autogenerators.register(() -> result.set(exporter.export(registry)));
            autogenerators.run();

            if (!result.get().isSuccess()) {
                printer.printFailure(result.get());
                return 1;
            }
            printer.printSuccess(result.get());
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return 2;
        } catch (Exception e) {
            log.error("Export failed with exception", e);
            return 1;
        }
    }
}
