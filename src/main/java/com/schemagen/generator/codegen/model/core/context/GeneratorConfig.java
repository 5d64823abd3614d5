package com.schemagen.generator.codegen.model.core.context;

import java.nio.file.Path;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for the Python code generator.
 */
@Data
@Builder
public class GeneratorConfig {

    /**
     * JSON module description produced by the reflection step.
     */
    private Path inputFile;

    /**
     * Directory the generated {@code .py} files are written to.
     */
    private Path outputDir;

    /**
     * Suffix of generated file names, {@code <namespace>_<suffix>.py}.
     */
    @Builder.Default
    private String outputSuffix = "pkl";

    /**
     * Number of spaces per indentation level in generated code.
     */
    @Builder.Default
    private int indentWidth = 4;

    /**
     * Whether to overwrite existing output files.
     */
    private boolean force;

    /**
     * Whether this is a dry run (no files written).
     */
    private boolean dryRun;

    private boolean verbose;

    public String getIndent() {
        return " ".repeat(indentWidth);
    }
}
