package com.schemagen.generator;

import com.schemagen.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the schema-to-Python code generator.
 * Reads a reflected module description and writes one Python module of
 * data classes and loader glue per schema module.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
