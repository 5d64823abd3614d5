package com.schemagen.generator.codegen;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemagen.generator.codegen.assemble.NamespaceAssembler;
import com.schemagen.generator.codegen.exception.CodegenException;
import com.schemagen.generator.codegen.exception.UnsupportedTypeException;
import com.schemagen.generator.codegen.header.HeaderRenderer;
import com.schemagen.generator.codegen.member.ClassGenerator;
import com.schemagen.generator.codegen.member.EnumGenerator;
import com.schemagen.generator.codegen.member.TypeAliasGenerator;
import com.schemagen.generator.codegen.model.GeneratedDocument;
import com.schemagen.generator.codegen.model.GeneratedMember;
import com.schemagen.generator.codegen.model.Mapping;
import com.schemagen.generator.codegen.model.core.context.GenerationContext;
import com.schemagen.generator.codegen.naming.NameResolver;
import com.schemagen.generator.codegen.order.DependencyOrderer;
import com.schemagen.generator.codegen.render.TypeRenderer;
import com.schemagen.generator.codegen.util.PythonNamingUtil;
import com.schemagen.generator.model.ClassDeclaration;
import com.schemagen.generator.model.Declaration;
import com.schemagen.generator.model.EnumDeclaration;
import com.schemagen.generator.model.ModuleInfo;
import com.schemagen.generator.model.TypeAliasDeclaration;

/**
 * Generates the document of a single namespace.
 *
 * Steps: check name uniqueness (among members and against names the
 * document binds itself), generate every member body, order the
 * members, assemble the document. Any failure aborts the namespace; nothing
 * is returned for it.
 */
public class NamespaceGenerator {
    private static final Logger log = LoggerFactory.getLogger(NamespaceGenerator.class);

    private final NameResolver nameResolver;
    private final DependencyOrderer dependencyOrderer;
    private final NamespaceAssembler assembler;
    private final ClassGenerator classGenerator;
    private final EnumGenerator enumGenerator;
    private final TypeAliasGenerator typeAliasGenerator;

    public NamespaceGenerator() {
        TypeRenderer typeRenderer = new TypeRenderer();
        this.nameResolver = new NameResolver();
        this.dependencyOrderer = new DependencyOrderer();
        this.assembler = new NamespaceAssembler(new HeaderRenderer(), typeRenderer);
        this.classGenerator = new ClassGenerator(typeRenderer);
        this.enumGenerator = new EnumGenerator();
        this.typeAliasGenerator = new TypeAliasGenerator(typeRenderer);
    }

    /**
     * Generates the document for {@code module}.
     *
     * @param context context whose namespace is the module's name
     */
    public GeneratedDocument generate(ModuleInfo module, GenerationContext context) throws CodegenException {
        if (!module.getName().equals(context.getNamespace())) {
            throw new IllegalArgumentException("Context namespace " + context.getNamespace()
                    + " does not match module " + module.getName());
        }
        log.info("Generating namespace {}", context.getNamespace());

        List<Mapping> ownMappings = context.getMappings().forNamespace(context.getNamespace());
        nameResolver.checkUnique(ownMappings);
        nameResolver.checkNotBound(ownMappings, assembler.boundNames(module, context));

        List<Declaration> declarations = module.getAllDeclarations();
        List<GeneratedMember> members = new ArrayList<>(declarations.size());
        for (int i = 0; i < declarations.size(); i++) {
            members.add(generateMember(declarations.get(i), i, context));
        }

        List<GeneratedMember> ordered = dependencyOrderer.order(members);
        String content = assembler.assemble(module, context, ordered);

        String fileName = PythonNamingUtil.fileName(context.getNamespace(), context.getOutputSuffix());
        log.info("Generated {} ({} members)", fileName, ordered.size());
        return GeneratedDocument.builder()
                .namespace(context.getNamespace())
                .fileName(fileName)
                .content(content)
                .memberCount(ordered.size())
                .build();
    }

    private GeneratedMember generateMember(Declaration declaration, int index, GenerationContext context)
            throws UnsupportedTypeException {
        if (declaration instanceof ClassDeclaration clazz) {
            return classGenerator.generate(clazz, index, context);
        }
        if (declaration instanceof EnumDeclaration enumeration) {
            return enumGenerator.generate(enumeration, index, context);
        }
        if (declaration instanceof TypeAliasDeclaration alias) {
            return typeAliasGenerator.generate(alias, index, context);
        }
        throw new IllegalStateException("No generator for " + declaration);
    }
}
