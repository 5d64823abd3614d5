package com.schemagen.generator.model.type;

import lombok.NonNull;
import lombok.Value;

@Value
public final class PrimitiveType implements TypeExpression {

    @NonNull
    PrimitiveKind kind;

    public static PrimitiveType of(PrimitiveKind kind) {
        return new PrimitiveType(kind);
    }

    @Override
    public <R, X extends Exception> R accept(TypeExpressionVisitor<R, X> visitor) throws X {
        return visitor.visitPrimitive(this);
    }

    @Override
    public String display() {
        return kind.getSchemaNames().get(0);
    }
}
