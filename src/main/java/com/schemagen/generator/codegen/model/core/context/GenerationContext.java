package com.schemagen.generator.codegen.model.core.context;

import com.schemagen.generator.codegen.model.MappingTable;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Per-namespace state handed explicitly to every component of a generation run.
 */
@Value
@Builder(toBuilder = true)
public class GenerationContext {

    /**
     * Namespace being generated.
     */
    @NonNull
    String namespace;

    @NonNull
    MappingTable mappings;

    /**
     * One level of indentation in generated code.
     */
    @NonNull
    @Builder.Default
    String indent = "    ";

    @NonNull
    @Builder.Default
    String outputSuffix = "pkl";
}
