package com.schemagen.generator.codegen.exception;

/**
 * Raised when a module description cannot be read or is malformed.
 */
public class ModuleDescriptionException extends CodegenException {

    private static final long serialVersionUID = 1L;

    public ModuleDescriptionException(String message) {
        super(message);
    }

    public ModuleDescriptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
