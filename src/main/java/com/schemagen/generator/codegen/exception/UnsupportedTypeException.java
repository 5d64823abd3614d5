package com.schemagen.generator.codegen.exception;

import com.schemagen.generator.model.SourceLocation;

/**
 * Raised when a type expression has no Python rendering.
 */
public class UnsupportedTypeException extends CodegenException {

    private static final long serialVersionUID = 1L;

    private final String typeDisplay;
    private final transient SourceLocation location;

    public UnsupportedTypeException(String typeDisplay, SourceLocation location, String reason) {
        super("Unsupported type `" + typeDisplay + "` at " + location.display() + ": " + reason);
        this.typeDisplay = typeDisplay;
        this.location = location;
    }

    public String getTypeDisplay() {
        return typeDisplay;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
