package com.schemagen.generator.model.type;

import lombok.NonNull;
import lombok.Value;

@Value
public final class StringLiteralType implements TypeExpression {

    @NonNull
    String value;

    public static StringLiteralType of(String value) {
        return new StringLiteralType(value);
    }

    @Override
    public <R, X extends Exception> R accept(TypeExpressionVisitor<R, X> visitor) throws X {
        return visitor.visitStringLiteral(this);
    }

    @Override
    public String display() {
        return "\"" + value + "\"";
    }
}
