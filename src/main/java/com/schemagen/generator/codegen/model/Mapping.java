package com.schemagen.generator.codegen.model;

import com.schemagen.generator.model.Declaration;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Binds a declaration to its target identifier and namespace.
 *
 * Produced upstream with rename annotations already applied.
 */
@Value
@Builder
public class Mapping {

    @NonNull
    Declaration declaration;

    @NonNull
    String namespace;

    @NonNull
    String targetName;
}
