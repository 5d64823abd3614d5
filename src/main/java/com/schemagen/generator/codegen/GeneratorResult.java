package com.schemagen.generator.codegen;

import java.nio.file.Path;
import java.util.List;

import com.schemagen.generator.codegen.model.GeneratedDocument;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Result of a generation run.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;

    @Singular
    private List<GeneratedDocument> documents;

    private int modulesProcessed;
    private int membersGenerated;
    private int filesWritten;

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
