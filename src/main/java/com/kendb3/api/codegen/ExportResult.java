package com.kendb3.api.codegen;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Result of a model declaration export.
 */
@Data
@Builder
public class ExportResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;

    private int modelsExported;
    private int fieldsExported;
    private int relationsWired;

    public static ExportResult failure(String errorMessage) {
        return ExportResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
