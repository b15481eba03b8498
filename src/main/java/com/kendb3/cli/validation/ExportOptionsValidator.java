package com.kendb3.cli.validation;

import com.kendb3.cli.exception.OptionsValidationException;
import com.kendb3.cli.model.ExportOptions;
import com.kendb3.cli.model.ValidatedExportOptions;
import com.kendb3.config.KenDb3Config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class ExportOptionsValidator {

    public ValidatedExportOptions validate(ExportOptions o) {
        List<String> errors = new ArrayList<>();

        Path outputPath = null;
        if (o.getOutput() == null) {
            errors.add("Output file is required (--output / -o).");
        } else {
            outputPath = o.getOutput().toAbsolutePath().normalize();
            if (Files.isDirectory(outputPath)) {
                errors.add("Output path is a directory: " + outputPath);
            } else if (Files.exists(outputPath) && !o.isForce()) {
                errors.add("Output file already exists: " + outputPath + ". Use --force to overwrite.");
            }
        }

        if (isBlank(o.getEndpointTemplate())) {
            errors.add("Endpoint template must not be blank (--endpoint-template).");
        } else if (!o.getEndpointTemplate().contains(KenDb3Config.MODEL_NAME_PLACEHOLDER)) {
            errors.add("Endpoint template must contain " + KenDb3Config.MODEL_NAME_PLACEHOLDER
                    + ". Got: " + o.getEndpointTemplate());
        }

        if (isBlank(o.getGeneratorName())) {
            errors.add("Generator name must not be blank (--generator-name).");
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        return new ValidatedExportOptions(outputPath, Files.exists(outputPath));
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
