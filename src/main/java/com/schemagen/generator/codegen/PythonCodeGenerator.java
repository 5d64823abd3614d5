package com.schemagen.generator.codegen;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemagen.generator.codegen.exception.CodegenException;
import com.schemagen.generator.codegen.model.GeneratedDocument;
import com.schemagen.generator.codegen.model.MappingTable;
import com.schemagen.generator.codegen.model.core.context.GenerationContext;
import com.schemagen.generator.codegen.model.core.context.GeneratorConfig;
import com.schemagen.generator.codegen.util.FileWriteUtil;
import com.schemagen.generator.input.MappingFactory;
import com.schemagen.generator.input.ModuleDescriptionLoader;
import com.schemagen.generator.model.ModuleInfo;

/**
 * Main generator: turns a module description into one Python file per namespace.
 *
 * Files are written only after every namespace generated successfully.
 */
public class PythonCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(PythonCodeGenerator.class);

    private final GeneratorConfig config;
    private final ModuleDescriptionLoader loader;
    private final MappingFactory mappingFactory;
    private final NamespaceGenerator namespaceGenerator;

    public PythonCodeGenerator(GeneratorConfig config) {
        this.config = config;
        this.loader = new ModuleDescriptionLoader();
        this.mappingFactory = new MappingFactory();
        this.namespaceGenerator = new NamespaceGenerator();
    }

    /**
     * Loads the configured input file and generates every module in it.
     */
    public GeneratorResult generate() {
        try {
            log.info("Starting code generation...");

            log.info("Step 1: Loading module description from {}", config.getInputFile());
            List<ModuleInfo> modules = loader.load(config.getInputFile());
            if (modules.isEmpty()) {
                return GeneratorResult.failure("No modules found in " + config.getInputFile());
            }
            return generate(modules);
        } catch (CodegenException e) {
            log.error("Generation failed: {}", e.getMessage());
            return GeneratorResult.failure(e.getMessage());
        }
    }

    /**
     * Generates every module of an already loaded description.
     */
    public GeneratorResult generate(List<ModuleInfo> modules) {
        try {
            log.info("Step 2: Resolving target names for {} module(s)", modules.size());
            MappingTable mappings = mappingFactory.create(modules);

            log.info("Step 3: Generating namespaces...");
            List<GeneratedDocument> documents = generateDocuments(modules, mappings);
            checkDistinctFileNames(documents);

            Path outputDir = resolveOutputDir();
            int written = 0;
            if (config.isDryRun()) {
                log.info("Step 4: Dry run, skipping write of {} file(s)", documents.size());
            } else {
                log.info("Step 4: Writing {} file(s) to {}", documents.size(), outputDir);
                written = writeDocuments(documents, outputDir);
            }

            return GeneratorResult.builder()
                    .success(true)
                    .outputPath(outputDir)
                    .documents(documents)
                    .modulesProcessed(modules.size())
                    .membersGenerated(documents.stream().mapToInt(GeneratedDocument::getMemberCount).sum())
                    .filesWritten(written)
                    .build();
        } catch (CodegenException e) {
            log.error("Generation failed: {}", e.getMessage());
            return GeneratorResult.failure(e.getMessage());
        } catch (IOException e) {
            log.error("Failed to write generated files", e);
            return GeneratorResult.failure("Failed to write generated files: " + e.getMessage());
        }
    }

    /**
     * Generates the documents of {@code modules} in input order without writing them.
     *
     * @throws CodegenException on the first namespace that fails
     */
    public List<GeneratedDocument> generateDocuments(List<ModuleInfo> modules, MappingTable mappings)
            throws CodegenException {
        List<GeneratedDocument> documents = new ArrayList<>(modules.size());
        for (ModuleInfo module : modules) {
            GenerationContext context = GenerationContext.builder()
                    .namespace(module.getName())
                    .mappings(mappings)
                    .indent(config.getIndent())
                    .outputSuffix(config.getOutputSuffix())
                    .build();
            documents.add(namespaceGenerator.generate(module, context));
        }
        return documents;
    }

    /**
     * Fails when two namespaces map to the same output file, e.g. {@code a.b} and {@code a_b}.
     */
    static void checkDistinctFileNames(List<GeneratedDocument> documents) throws CodegenException {
        Map<String, GeneratedDocument> byFileName = new HashMap<>();
        for (GeneratedDocument document : documents) {
            GeneratedDocument previous = byFileName.putIfAbsent(document.getFileName(), document);
            if (previous != null) {
                throw new CodegenException("Namespaces `" + previous.getNamespace() + "` and `"
                        + document.getNamespace() + "` both generate " + document.getFileName()
                        + ". Rename one of the modules.");
            }
        }
    }

    private int writeDocuments(List<GeneratedDocument> documents, Path outputDir)
            throws IOException, CodegenException {
        if (!config.isForce()) {
            for (GeneratedDocument document : documents) {
                Path target = outputDir.resolve(document.getFileName());
                if (Files.exists(target)) {
                    throw new CodegenException("Output file already exists: " + target
                            + ". Use --force to overwrite.");
                }
            }
        }
        for (GeneratedDocument document : documents) {
            Path target = outputDir.resolve(document.getFileName());
            FileWriteUtil.safeWriteString(target, document.getContent());
            log.debug("Wrote {}", target);
        }
        return documents.size();
    }

    private Path resolveOutputDir() {
        Path outputDir = config.getOutputDir() != null ? config.getOutputDir() : Path.of(".");
        return outputDir.toAbsolutePath().normalize();
    }
}
