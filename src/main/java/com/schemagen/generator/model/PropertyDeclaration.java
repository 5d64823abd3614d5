package com.schemagen.generator.model;

import java.util.Optional;

import com.schemagen.generator.model.type.TypeExpression;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A typed property of a class or module.
 */
@Value
@Builder
public class PropertyDeclaration {

    @NonNull
    String name;

    @NonNull
    TypeExpression type;

    String docComment;

    public Optional<String> getDocComment() {
        return Optional.ofNullable(docComment).filter(s -> !s.isBlank());
    }
}
