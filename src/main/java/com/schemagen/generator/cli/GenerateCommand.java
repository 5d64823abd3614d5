package com.schemagen.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemagen.generator.cli.exception.OptionsValidationException;
import com.schemagen.generator.cli.model.GenerateOptions;
import com.schemagen.generator.cli.model.ValidatedGenerateOptions;
import com.schemagen.generator.cli.output.GenerateResultsPrinter;
import com.schemagen.generator.cli.validation.GenerateOptionsValidator;
import com.schemagen.generator.codegen.GeneratorResult;
import com.schemagen.generator.codegen.PythonCodeGenerator;
import com.schemagen.generator.codegen.model.core.context.GeneratorConfig;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command for generating Python data classes from a reflected module description.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "schema-python-codegen 1.0.0",
        description = "Generates Python data classes and loader glue from a reflected schema module description."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_GENERATION_FAILED = 1;
    static final int EXIT_INVALID_OPTIONS = 2;

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        if (options.isVerbose()) {
            enableDebugLogging();
        }

        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            log.error(e.getMessage());
            return EXIT_INVALID_OPTIONS;
        }

        printer.printBanner(options, validated);

        GeneratorConfig config = GeneratorConfig.builder()
                .inputFile(validated.getNormalizedInputFile())
                .outputDir(validated.getNormalizedOutputDir())
                .outputSuffix(options.getOutputSuffix())
                .indentWidth(options.getIndentWidth())
                .force(options.isForce())
                .dryRun(options.isDryRun())
                .verbose(options.isVerbose())
                .build();

        GeneratorResult result = new PythonCodeGenerator(config).generate();
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return EXIT_GENERATION_FAILED;
        }

        printer.printSuccess(options, result);
        return EXIT_OK;
    }

    private static void enableDebugLogging() {
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
            logbackRoot.setLevel(Level.DEBUG);
        }
    }
}
