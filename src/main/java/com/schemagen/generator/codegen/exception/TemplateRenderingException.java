package com.schemagen.generator.codegen.exception;

/**
 * Raised when a FreeMarker template cannot be loaded or processed.
 */
public class TemplateRenderingException extends CodegenException {

    private static final long serialVersionUID = 1L;

    public TemplateRenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
