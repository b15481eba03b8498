package com.kendb3;

import com.kendb3.cli.ExportModelsCommand;
import picocli.CommandLine;

/**
 * Main entry point. Exports the TypeScript declarations of the KenDB3 API models
 * for the frontend build.
 */
public class KenDb3Application {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ExportModelsCommand()).execute(args);
        System.exit(exitCode);
    }
}
