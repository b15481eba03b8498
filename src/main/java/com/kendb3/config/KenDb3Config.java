package com.kendb3.config;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Configuration of the model declaration export.
 */
@Data
@Builder
public class KenDb3Config {

    public static final String MODEL_NAME_PLACEHOLDER = "MODEL_NAME";
    public static final String DEFAULT_ENDPOINT_TEMPLATE = "api/v0/" + MODEL_NAME_PLACEHOLDER;
    public static final String DEFAULT_GENERATOR_NAME = "com.kendb3.api.codegen.TypeScriptModelExporter";

    /**
     * File the TypeScript declarations are written to.
     */
    private Path outputPath;

    /**
     * Data manager URL, relative to the site origin; {@code MODEL_NAME} is
     * replaced by the model's API name.
     */
    @Builder.Default
    private String endpointTemplate = DEFAULT_ENDPOINT_TEMPLATE;

    @Builder.Default
    private String generatorName = DEFAULT_GENERATOR_NAME;

    /**
     * Overwrite an existing output file.
     */
    private boolean force;

    public String endpointFor(String apiName) {
        return endpointTemplate.replace(MODEL_NAME_PLACEHOLDER, apiName);
    }
}
