package com.schemagen.generator.codegen.writer;

import lombok.NonNull;
import lombok.Value;

/**
 * One line of generated source with its indentation level.
 */
@Value
public class SourceLine {

    int indentLevel;

    @NonNull
    String text;

    public boolean isBlank() {
        return text.isBlank();
    }

    /**
     * Renders the line; blank lines never carry indentation.
     */
    public String render(String indent) {
        if (isBlank()) {
            return "";
        }
        return indent.repeat(indentLevel) + text;
    }
}
