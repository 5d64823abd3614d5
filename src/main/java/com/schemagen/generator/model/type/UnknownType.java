package com.schemagen.generator.model.type;

import com.schemagen.generator.model.SourceLocation;

import lombok.NonNull;
import lombok.Value;

/**
 * A type shape the reflection reported but that has no Python counterpart
 * (for example a constrained or module type). Rendering it is an error.
 */
@Value
public final class UnknownType implements TypeExpression {

    @NonNull
    String displayForm;

    @NonNull
    SourceLocation location;

    @Override
    public <R, X extends Exception> R accept(TypeExpressionVisitor<R, X> visitor) throws X {
        return visitor.visitUnknown(this);
    }

    @Override
    public String display() {
        return displayForm;
    }
}
