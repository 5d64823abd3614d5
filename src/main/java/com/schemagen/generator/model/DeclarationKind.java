package com.schemagen.generator.model;

/**
 * Kind of a reflected declaration.
 */
public enum DeclarationKind {
    MODULE("module"),
    CLASS("class"),
    ENUM("enum"),
    TYPE_ALIAS("typealias");

    private final String displayName;

    DeclarationKind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Keyword used for this kind in the schema language.
     */
    public String getDisplayName() {
        return displayName;
    }
}
