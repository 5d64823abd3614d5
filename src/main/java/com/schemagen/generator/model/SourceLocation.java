package com.schemagen.generator.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Position of a declaration in the schema source it was reflected from.
 */
@Value
public class SourceLocation {

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0);

    @NonNull
    String uri;

    /**
     * 1-based line number, or 0 when the reflection did not report one.
     */
    int line;

    public static SourceLocation of(String uri, int line) {
        return new SourceLocation(uri == null ? UNKNOWN.getUri() : uri, Math.max(line, 0));
    }

    public String display() {
        return line > 0 ? uri + ":" + line : uri;
    }

    @Override
    public String toString() {
        return display();
    }
}
