package com.schemagen.generator.model.type;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import lombok.NonNull;
import lombok.Value;

/**
 * A parameterized type such as {@code List<A>} or {@code Mapping<String, A>}.
 */
@Value
public final class GenericType implements TypeExpression {

    @NonNull
    TypeExpression base;

    @NonNull
    List<TypeExpression> arguments;

    public GenericType(TypeExpression base, List<TypeExpression> arguments) {
        this.base = Objects.requireNonNull(base, "base");
        this.arguments = List.copyOf(arguments);
    }

    public static GenericType of(TypeExpression base, TypeExpression... arguments) {
        return new GenericType(base, List.of(arguments));
    }

    @Override
    public <R, X extends Exception> R accept(TypeExpressionVisitor<R, X> visitor) throws X {
        return visitor.visitGeneric(this);
    }

    @Override
    public String display() {
        if (arguments.isEmpty()) {
            return base.display();
        }
        return base.display() + "<"
                + arguments.stream().map(TypeExpression::display).collect(Collectors.joining(", "))
                + ">";
    }
}
