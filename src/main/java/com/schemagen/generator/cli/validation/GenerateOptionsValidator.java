package com.schemagen.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.schemagen.generator.cli.exception.OptionsValidationException;
import com.schemagen.generator.cli.model.GenerateOptions;
import com.schemagen.generator.cli.model.ValidatedGenerateOptions;

public class GenerateOptionsValidator {

	static final int MAX_INDENT_WIDTH = 8;

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getInputFile() == null) {
			errors.add("Module description is required (--input / -i).");
		} else if (!Files.isRegularFile(o.getInputFile())) {
			errors.add("Module description does not exist or is not a file: " + o.getInputFile());
		}

		if (isBlank(o.getOutputSuffix())) {
			errors.add("File name suffix must not be blank (--suffix).");
		} else if (!o.getOutputSuffix().matches("[A-Za-z0-9_]+")) {
			errors.add("File name suffix may only contain letters, digits and '_'. Got: " + o.getOutputSuffix());
		}

		if (o.getIndentWidth() < 1 || o.getIndentWidth() > MAX_INDENT_WIDTH) {
			errors.add("Indent width must be in range 1-" + MAX_INDENT_WIDTH + ". Got: " + o.getIndentWidth());
		}

		// Normalize output dir; it is created on write when missing
		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath()
				.normalize();

		if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
			errors.add("Output path exists and is not a directory: " + normalizedOutputDir);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(o.getInputFile().toAbsolutePath().normalize(), normalizedOutputDir);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
