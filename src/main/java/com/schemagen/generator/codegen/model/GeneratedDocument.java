package com.schemagen.generator.codegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Generated source of one namespace, ready to be written.
 */
@Value
@Builder
public class GeneratedDocument {

    @NonNull
    String namespace;

    @NonNull
    String fileName;

    @NonNull
    String content;

    int memberCount;
}
