package com.schemagen.generator.model.type;

import lombok.NonNull;
import lombok.Value;

/**
 * Reference to a class, enum or type alias by its qualified source name
 * ({@code Module#Name}, or {@code Module} for a module class).
 */
@Value
public final class DeclaredType implements TypeExpression {

    @NonNull
    String qualifiedName;

    public static DeclaredType of(String qualifiedName) {
        return new DeclaredType(qualifiedName);
    }

    @Override
    public <R, X extends Exception> R accept(TypeExpressionVisitor<R, X> visitor) throws X {
        return visitor.visitDeclared(this);
    }

    @Override
    public String display() {
        return qualifiedName;
    }
}
