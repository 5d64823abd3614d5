package com.schemagen.generator.model.type;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import lombok.NonNull;
import lombok.Value;

@Value
public final class FunctionType implements TypeExpression {

    @NonNull
    List<TypeExpression> parameters;

    @NonNull
    TypeExpression returnType;

    public FunctionType(List<TypeExpression> parameters, TypeExpression returnType) {
        this.parameters = List.copyOf(parameters);
        this.returnType = Objects.requireNonNull(returnType, "returnType");
    }

    @Override
    public <R, X extends Exception> R accept(TypeExpressionVisitor<R, X> visitor) throws X {
        return visitor.visitFunction(this);
    }

    @Override
    public String display() {
        return "("
                + parameters.stream().map(TypeExpression::display).collect(Collectors.joining(", "))
                + ") -> " + returnType.display();
    }
}
