package com.schemagen.generator.codegen.assemble;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemagen.generator.codegen.exception.TemplateRenderingException;
import com.schemagen.generator.codegen.header.HeaderRenderer;
import com.schemagen.generator.codegen.model.GeneratedMember;
import com.schemagen.generator.codegen.model.Mapping;
import com.schemagen.generator.codegen.model.core.context.GenerationContext;
import com.schemagen.generator.codegen.render.TypeRenderer;
import com.schemagen.generator.codegen.util.PythonNamingUtil;
import com.schemagen.generator.codegen.writer.SourceBlock;
import com.schemagen.generator.model.ClassDeclaration;
import com.schemagen.generator.model.Declaration;
import com.schemagen.generator.model.EnumDeclaration;
import com.schemagen.generator.model.ModuleInfo;
import com.schemagen.generator.model.PropertyDeclaration;
import com.schemagen.generator.model.TypeAliasDeclaration;

/**
 * Concatenates the pieces of one namespace into the final document.
 *
 * Layout:
 * <pre>
 * header comment
 * fixed imports
 * imports of referenced foreign namespaces
 * auxiliary text contributed by members (deduplicated)
 * (two blank lines)
 * member bodies, one blank line apart
 * convenience loader, inside the module root class
 * </pre>
 * The result ends with exactly one newline and is not modified afterwards.
 */
public class NamespaceAssembler {
    private static final Logger log = LoggerFactory.getLogger(NamespaceAssembler.class);

    static final List<String> TYPING_NAMES = List.of(
            "Any", "Callable", "Dict", "List", "Literal", "Optional", "Set", "Tuple", "Union");

    static final List<String> PREAMBLE = List.of(
            "from __future__ import annotations",
            "from typing import " + String.join(", ", TYPING_NAMES),
            "from dataclasses import dataclass",
            "import pkl"
    );

    static final String ENUM_IMPORT = "from enum import Enum";

    private final HeaderRenderer headerRenderer;
    private final TypeRenderer typeRenderer;

    public NamespaceAssembler(HeaderRenderer headerRenderer, TypeRenderer typeRenderer) {
        this.headerRenderer = headerRenderer;
        this.typeRenderer = typeRenderer;
    }

    /**
     * Assembles the document of {@code module} from members already in emission order.
     *
     * @throws IllegalStateException if the last member is not the module root class
     */
    public String assemble(ModuleInfo module, GenerationContext context, List<GeneratedMember> orderedMembers)
            throws TemplateRenderingException {
        if (orderedMembers.isEmpty() || !orderedMembers.get(orderedMembers.size() - 1).isModuleRootClass()) {
            throw new IllegalStateException("Members of namespace " + context.getNamespace()
                    + " must end with the module root class");
        }
        GeneratedMember root = orderedMembers.get(orderedMembers.size() - 1);

        SourceBlock.Builder document = SourceBlock.builder();
        document.append(headerRenderer.render(module));
        PREAMBLE.forEach(document::line);

        Set<String> foreignNamespaces = collectForeignNamespaces(module, context);
        for (String namespace : foreignNamespaces) {
            document.line(importLine(namespace, context));
        }

        for (String auxiliary : collectAuxiliaryText(orderedMembers)) {
            document.append(SourceBlock.ofText(auxiliary));
        }

        document.blankLine().blankLine();
        for (int i = 0; i < orderedMembers.size(); i++) {
            if (i > 0) {
                document.blankLine();
            }
            document.append(orderedMembers.get(i).getBody());
        }

        document.blankLine();
        document.append(loaderStub(context.getNamespace(), root.getTargetName()).indented(1));

        log.debug("Assembled namespace {} with {} members and {} foreign imports",
                context.getNamespace(), orderedMembers.size(), foreignNamespaces.size());
        return document.build().render(context.getIndent()) + "\n";
    }

    /**
     * Module-level names the document of {@code module} binds besides its members,
     * each mapped to the statement that binds it. A member with one of these
     * names would shadow the binding.
     */
    public Map<String, String> boundNames(ModuleInfo module, GenerationContext context) {
        Map<String, String> bound = new LinkedHashMap<>();
        bound.put("annotations", PREAMBLE.get(0));
        TYPING_NAMES.forEach(name -> bound.put(name, PREAMBLE.get(1)));
        bound.put("dataclass", PREAMBLE.get(2));
        bound.put("pkl", PREAMBLE.get(3));
        if (module.getDeclarations().stream().anyMatch(d -> d instanceof EnumDeclaration)) {
            bound.put("Enum", ENUM_IMPORT);
        }
        for (String namespace : collectForeignNamespaces(module, context)) {
            bound.put(PythonNamingUtil.moduleAlias(namespace), importLine(namespace, context));
        }
        return bound;
    }

    /**
     * Convenience loader that evaluates a module source into the generated root type.
     */
    static SourceBlock loaderStub(String namespace, String moduleTypeName) {
        return SourceBlock.builder()
                .line("@classmethod")
                .open("def load_pkl(cls, source):")
                .line("# Load the Pkl module at the given source and evaluate it into `"
                        + namespace + "." + moduleTypeName + "`.")
                .line("# - Parameter source: The source of the Pkl module.")
                .line("config = pkl.load(source, parser=pkl.Parser(namespace = globals()))")
                .line("return config")
                .close()
                .build();
    }

    /**
     * Auxiliary texts in order of first occurrence, duplicates dropped.
     */
    static Set<String> collectAuxiliaryText(List<GeneratedMember> members) {
        Set<String> auxiliary = new LinkedHashSet<>();
        for (GeneratedMember member : members) {
            member.getAuxiliaryText().ifPresent(auxiliary::add);
        }
        return auxiliary;
    }

    private static String importLine(String namespace, GenerationContext context) {
        return "import " + PythonNamingUtil.moduleName(namespace, context.getOutputSuffix())
                + " as " + PythonNamingUtil.moduleAlias(namespace);
    }

    private Set<String> collectForeignNamespaces(ModuleInfo module, GenerationContext context) {
        Set<String> namespaces = new TreeSet<>();
        for (Declaration declaration : module.getAllDeclarations()) {
            if (declaration instanceof ClassDeclaration clazz) {
                for (PropertyDeclaration property : clazz.getProperties()) {
                    namespaces.addAll(typeRenderer.foreignNamespaces(property.getType(), context));
                }
                clazz.getSuperclass()
                        .flatMap(qualifiedName -> context.getMappings().find(qualifiedName))
                        .map(Mapping::getNamespace)
                        .filter(ns -> !ns.equals(context.getNamespace()))
                        .ifPresent(namespaces::add);
            } else if (declaration instanceof TypeAliasDeclaration alias) {
                namespaces.addAll(typeRenderer.foreignNamespaces(alias.getAliasedType(), context));
            }
        }
        return namespaces;
    }
}
