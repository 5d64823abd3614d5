package com.schemagen.generator.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * An enumeration of string values (a type alias of a union of string literals).
 */
@Getter
public class EnumDeclaration extends Declaration {
    private final List<String> values;

    @Builder
    public EnumDeclaration(String name, String moduleName, SourceLocation location, String renamedTo,
                           @Singular List<String> values) {
        super(name, moduleName, location, renamedTo);
        this.values = List.copyOf(new LinkedHashSet<>(values != null ? values : new ArrayList<>()));
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.ENUM;
    }
}
