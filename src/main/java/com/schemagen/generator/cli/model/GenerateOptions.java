package com.schemagen.generator.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--input", "-i" }, required = true, description = "JSON module description produced by the reflection step")
	private Path inputFile;

	@Option(names = { "--output-dir", "-o" }, description = "Output directory (defaults to current directory)")
	private Path outputDir;

	@Option(names = { "--suffix" }, defaultValue = "pkl", description = "Suffix of generated file names: <module>_<suffix>.py (default: pkl)")
	private String outputSuffix;

	@Option(names = { "--indent-width" }, defaultValue = "4", description = "Spaces per indentation level in generated code (default: 4)")
	private int indentWidth;

	@Option(names = { "--dry-run" }, description = "Generate and report, but do not write any file")
	private boolean dryRun;

	@Option(names = { "--force", "-f" }, description = "Overwrite existing output files")
	private boolean force;

	@Option(names = { "--verbose", "-v" }, description = "Enable debug logging")
	private boolean verbose;

	// ---- Getters (no setters needed; picocli sets fields reflectively) ----

}
