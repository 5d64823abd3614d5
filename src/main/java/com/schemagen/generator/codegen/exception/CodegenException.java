package com.schemagen.generator.codegen.exception;

/**
 * Base class for errors that abort generation of a namespace.
 */
public class CodegenException extends Exception {

    private static final long serialVersionUID = 1L;

    public CodegenException(String message) {
        super(message);
    }

    public CodegenException(String message, Throwable cause) {
        super(message, cause);
    }
}
