package com.kendb3.cli.output;

import com.kendb3.api.codegen.ExportResult;
import com.kendb3.cli.model.ExportOptions;
import com.kendb3.cli.model.ValidatedExportOptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Responsible only for printing CLI output for the "export-models" command.
 */
public class ExportResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ExportResultsPrinter.class);

    public void printBanner(ExportOptions o, ValidatedExportOptions v) {
        log.info("=================================================");
        log.info("KenDB3 API Model Export");
        log.info("=================================================");
        log.info("Output File: {}", v.getNormalizedOutputPath());
        log.info("Endpoint Template: {}", o.getEndpointTemplate());
        if (v.isOverwriting()) {
            log.warn("Force mode enabled, will overwrite: {}", v.getNormalizedOutputPath());
        }
        log.info("=================================================");
    }

    public void printSuccess(ExportResult result) {
        log.info("");
        log.info("=================================================");
        log.info("EXPORT SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", result.getOutputPath());
        log.info("Models Exported: {}", result.getModelsExported());
        log.info("Fields Exported: {}", result.getFieldsExported());
        log.info("Relations Wired: {}", result.getRelationsWired());
        log.info("=================================================");
    }

    public void printFailure(ExportResult result) {
        log.error("Export failed: {}", result.getErrorMessage());
    }
}
