package com.schemagen.generator.model;

import java.util.Objects;
import java.util.Optional;

import lombok.Getter;

/**
 * Base class for all declarations of a reflected schema module.
 */
@Getter
public abstract class Declaration {
    protected final String name;
    protected final String moduleName;
    protected final SourceLocation location;
    protected final String renamedTo;

    protected Declaration(String name, String moduleName, SourceLocation location, String renamedTo) {
        this.name = Objects.requireNonNull(name, "name");
        this.moduleName = Objects.requireNonNull(moduleName, "moduleName");
        this.location = location != null ? location : SourceLocation.UNKNOWN;
        this.renamedTo = renamedTo;
    }

    public abstract DeclarationKind getKind();

    /**
     * Fully qualified source name, {@code Module#Name}.
     */
    public String getQualifiedName() {
        return moduleName + "#" + name;
    }

    /**
     * Target name requested by a rename annotation, if any.
     */
    public Optional<String> getRenamedTo() {
        return Optional.ofNullable(renamedTo).filter(s -> !s.isBlank());
    }

    @Override
    public String toString() {
        return getKind().getDisplayName() + " " + getQualifiedName();
    }
}
