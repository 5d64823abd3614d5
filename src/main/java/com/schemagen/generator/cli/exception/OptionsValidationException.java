package com.schemagen.generator.cli.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Every problem found in the options of one {@code generate} invocation.
 */
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super(errors.size() + " invalid option(s):" + System.lineSeparator()
                + errors.stream().map(e -> "  - " + e).collect(Collectors.joining(System.lineSeparator())));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
