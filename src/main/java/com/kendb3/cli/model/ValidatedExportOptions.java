package com.kendb3.cli.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.nio.file.Path;

/**
 * Derived values needed by the executor. Keeps ExportModelsCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedExportOptions {
    Path normalizedOutputPath;
    boolean overwriting;
}
