package com.schemagen.generator.model.type;

/**
 * Exhaustive visitor over {@link TypeExpression} shapes.
 *
 * @param <R> result type
 * @param <X> checked exception the visitor may raise
 */
public interface TypeExpressionVisitor<R, X extends Exception> {
    R visitPrimitive(PrimitiveType type) throws X;
    R visitNullable(NullableType type) throws X;
    R visitUnion(UnionType type) throws X;
    R visitDeclared(DeclaredType type) throws X;
    R visitStringLiteral(StringLiteralType type) throws X;
    R visitGeneric(GenericType type) throws X;
    R visitFunction(FunctionType type) throws X;
    R visitUnknown(UnknownType type) throws X;
}
