package com.schemagen.generator.model.type;

import lombok.NonNull;
import lombok.Value;

@Value
public final class NullableType implements TypeExpression {

    @NonNull
    TypeExpression inner;

    public static NullableType of(TypeExpression inner) {
        return new NullableType(inner);
    }

    @Override
    public <R, X extends Exception> R accept(TypeExpressionVisitor<R, X> visitor) throws X {
        return visitor.visitNullable(this);
    }

    @Override
    public String display() {
        return inner.display() + "?";
    }
}
