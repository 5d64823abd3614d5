package com.schemagen.generator.cli.validation;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.schemagen.generator.cli.exception.OptionsValidationException;
import com.schemagen.generator.cli.model.GenerateOptions;
import com.schemagen.generator.cli.model.ValidatedGenerateOptions;

import picocli.CommandLine;

/**
 * Unit tests for GenerateOptionsValidator.
 */
class GenerateOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private Path input;

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();

    @BeforeEach
    void setUp() throws IOException {
        input = Files.writeString(tempDir.resolve("modules.json"), "{\"modules\": []}");
    }

    @Test
    void testValidOptions() {
        ValidatedGenerateOptions validated = validator.validate(parse(
                "--input", input.toString(), "--output-dir", tempDir.resolve("out").toString()));

        assertThat(validated.getNormalizedInputFile()).isEqualTo(input.toAbsolutePath().normalize());
        assertThat(validated.getNormalizedOutputDir()).isEqualTo(tempDir.resolve("out").toAbsolutePath().normalize());
    }

    @Test
    void testDefaults() {
        GenerateOptions options = parse("-i", input.toString());

        assertThat(options.getOutputSuffix()).isEqualTo("pkl");
        assertThat(options.getIndentWidth()).isEqualTo(4);
        assertThat(options.isDryRun()).isFalse();
        assertThat(options.isForce()).isFalse();
        assertThat(validator.validate(options).getNormalizedOutputDir())
                .isEqualTo(Path.of(".").toAbsolutePath().normalize());
    }

    @Test
    void testMissingInputFile() {
        GenerateOptions options = parse("--input", tempDir.resolve("missing.json").toString());

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .satisfies(e -> assertThat(((OptionsValidationException) e).getErrors())
                        .anyMatch(error -> error.contains("missing.json")));
    }

    @Test
    void testAllErrorsAreCollected() {
        GenerateOptions options = parse("--input", tempDir.toString(),
                "--suffix", "my-suffix", "--indent-width", "0");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageStartingWith("3 invalid option(s):")
                .hasMessageContaining("  - File name suffix may only contain")
                .satisfies(e -> assertThat(((OptionsValidationException) e).getErrors()).hasSize(3));
    }

    @Test
    void testIndentWidthUpperBound() {
        assertThatCode(() -> validator.validate(parse("-i", input.toString(), "--indent-width", "8")))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> validator.validate(parse("-i", input.toString(), "--indent-width", "9")))
                .isInstanceOf(OptionsValidationException.class);
    }

    @Test
    void testOutputDirIsAFile() {
        GenerateOptions options = parse("-i", input.toString(), "-o", input.toString());

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .satisfies(e -> assertThat(((OptionsValidationException) e).getErrors())
                        .anyMatch(error -> error.contains("not a directory")));
    }

    private static GenerateOptions parse(String... args) {
        GenerateOptions options = new GenerateOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }
}
