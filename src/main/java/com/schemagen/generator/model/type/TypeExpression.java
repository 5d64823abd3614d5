package com.schemagen.generator.model.type;

/**
 * Source-language neutral description of a property or alias type.
 *
 * The set of shapes is closed; every consumer dispatches through
 * {@link TypeExpressionVisitor}, so a new shape fails to compile until every
 * visitor handles it.
 */
public sealed interface TypeExpression
        permits PrimitiveType, NullableType, UnionType, DeclaredType, StringLiteralType,
        GenericType, FunctionType, UnknownType {

    <R, X extends Exception> R accept(TypeExpressionVisitor<R, X> visitor) throws X;

    /**
     * Human readable form, used in diagnostics.
     */
    String display();
}
