package com.schemagen.generator.model;

import java.util.Objects;

import com.schemagen.generator.model.type.TypeExpression;

import lombok.Builder;
import lombok.Getter;

/**
 * A named alias for a type expression.
 */
@Getter
public class TypeAliasDeclaration extends Declaration {
    private final TypeExpression aliasedType;

    @Builder
    public TypeAliasDeclaration(String name, String moduleName, SourceLocation location, String renamedTo,
                                TypeExpression aliasedType) {
        super(name, moduleName, location, renamedTo);
        this.aliasedType = Objects.requireNonNull(aliasedType, "aliasedType");
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.TYPE_ALIAS;
    }
}
