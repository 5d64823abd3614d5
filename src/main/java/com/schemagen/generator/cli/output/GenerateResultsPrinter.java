package com.schemagen.generator.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemagen.generator.cli.model.GenerateOptions;
import com.schemagen.generator.cli.model.ValidatedGenerateOptions;
import com.schemagen.generator.codegen.GeneratorResult;
import com.schemagen.generator.codegen.model.GeneratedDocument;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("Schema Python Code Generator");
        log.info("=================================================");
        log.info("Module Description: {}", v.getNormalizedInputFile());
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("File Suffix: {}", o.getOutputSuffix());
        log.info("Indent Width: {}", o.getIndentWidth());
        log.info("Dry Run: {}", o.isDryRun());
        log.info("Force: {}", o.isForce());
        log.info("=================================================");
    }

    public void printSuccess(GenerateOptions o, GeneratorResult result) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", result.getOutputPath());
        log.info("Modules Processed: {}", result.getModulesProcessed());
        log.info("Declarations Generated: {}", result.getMembersGenerated());
        for (GeneratedDocument document : result.getDocuments()) {
            log.info("  {} ({} declarations)", document.getFileName(), document.getMemberCount());
        }
        if (o.isDryRun()) {
            log.info("Dry run: no files were written");
        } else {
            log.info("Files Written: {}", result.getFilesWritten());
        }
        log.info("=================================================");
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
    }
}
