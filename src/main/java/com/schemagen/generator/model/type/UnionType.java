package com.schemagen.generator.model.type;

import java.util.List;
import java.util.stream.Collectors;

import lombok.NonNull;
import lombok.Value;

/**
 * Union of alternatives, kept in source order.
 */
@Value
public final class UnionType implements TypeExpression {

    @NonNull
    List<TypeExpression> members;

    public UnionType(List<TypeExpression> members) {
        this.members = List.copyOf(members);
    }

    public static UnionType of(TypeExpression... members) {
        return new UnionType(List.of(members));
    }

    @Override
    public <R, X extends Exception> R accept(TypeExpressionVisitor<R, X> visitor) throws X {
        return visitor.visitUnion(this);
    }

    @Override
    public String display() {
        return members.stream().map(TypeExpression::display).collect(Collectors.joining("|"));
    }
}
