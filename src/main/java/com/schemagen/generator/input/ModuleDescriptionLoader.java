package com.schemagen.generator.input;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.schemagen.generator.codegen.exception.ModuleDescriptionException;
import com.schemagen.generator.input.model.ModuleDescriptionDocument;
import com.schemagen.generator.model.ClassDeclaration;
import com.schemagen.generator.model.Declaration;
import com.schemagen.generator.model.EnumDeclaration;
import com.schemagen.generator.model.ModuleInfo;
import com.schemagen.generator.model.PropertyDeclaration;
import com.schemagen.generator.model.SourceLocation;
import com.schemagen.generator.model.TypeAliasDeclaration;

/**
 * Reads a JSON module description (see {@link ModuleDescriptionDocument}) into
 * {@link ModuleInfo}s, preserving declaration order.
 */
public class ModuleDescriptionLoader {
    private static final Logger log = LoggerFactory.getLogger(ModuleDescriptionLoader.class);

    private static final ObjectMapper JSON = new ObjectMapper();

    private final TypeExpressionParser typeParser = new TypeExpressionParser();

    public List<ModuleInfo> load(Path path) throws ModuleDescriptionException {
        String json;
        try {
            json = Files.readString(path);
        } catch (IOException e) {
            throw new ModuleDescriptionException("Cannot read module description " + path, e);
        }
        return parse(json);
    }

    public List<ModuleInfo> parse(String json) throws ModuleDescriptionException {
        ModuleDescriptionDocument document;
        try {
            document = JSON.readValue(json, ModuleDescriptionDocument.class);
        } catch (JsonProcessingException e) {
            throw new ModuleDescriptionException("Malformed module description: " + e.getOriginalMessage(), e);
        }
        if (document == null || document.modules == null) {
            throw new ModuleDescriptionException("Module description has no 'modules' list");
        }

        List<ModuleInfo> modules = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (ModuleDescriptionDocument.Module module : document.modules) {
            ModuleInfo info = toModuleInfo(module);
            if (!names.add(info.getName())) {
                throw new ModuleDescriptionException("Module " + info.getName() + " is described more than once");
            }
            modules.add(info);
        }
        log.info("Loaded {} module(s)", modules.size());
        return modules;
    }

    private ModuleInfo toModuleInfo(ModuleDescriptionDocument.Module module) throws ModuleDescriptionException {
        String name = requireName(module.name, "module");
        String uri = module.uri != null ? module.uri : "file:///" + name + ".pkl";

        ClassDeclaration moduleClass = ClassDeclaration.builder()
                .name(name)
                .moduleName(name)
                .location(SourceLocation.of(uri, lineOf(module.line)))
                .renamedTo(module.rename)
                .superclass(module.superclass)
                .properties(toProperties(module.properties, SourceLocation.of(uri, lineOf(module.line))))
                .moduleClass(true)
                .build();

        ModuleInfo.ModuleInfoBuilder builder = ModuleInfo.builder()
                .name(name)
                .uri(uri)
                .open(module.open)
                .docComment(module.doc)
                .moduleClass(moduleClass);

        if (module.declarations != null) {
            for (ModuleDescriptionDocument.Declaration declaration : module.declarations) {
                builder.declaration(toDeclaration(declaration, name, uri));
            }
        }
        ModuleInfo info = builder.build();
        log.debug("Module {}: {} declarations", name, info.getDeclarations().size());
        return info;
    }

    private Declaration toDeclaration(ModuleDescriptionDocument.Declaration d, String moduleName, String uri)
            throws ModuleDescriptionException {
        String name = requireName(d.name, "declaration in module " + moduleName);
        SourceLocation location = SourceLocation.of(uri, lineOf(d.line));
        String kind = d.kind == null ? "" : d.kind.toLowerCase(Locale.ROOT);

        return switch (kind) {
            case "class" -> ClassDeclaration.builder()
                    .name(name)
                    .moduleName(moduleName)
                    .location(location)
                    .renamedTo(d.rename)
                    .superclass(d.superclass)
                    .abstractClass(d.abstractClass)
                    .properties(toProperties(d.properties, location))
                    .build();
            case "enum" -> EnumDeclaration.builder()
                    .name(name)
                    .moduleName(moduleName)
                    .location(location)
                    .renamedTo(d.rename)
                    .values(d.values != null ? d.values : List.of())
                    .build();
            case "typealias", "type_alias" -> TypeAliasDeclaration.builder()
                    .name(name)
                    .moduleName(moduleName)
                    .location(location)
                    .renamedTo(d.rename)
                    .aliasedType(typeParser.parse(d.type, location))
                    .build();
            default -> throw new ModuleDescriptionException("Unknown declaration kind '" + d.kind
                    + "' for " + moduleName + "#" + name + " at " + location.display());
        };
    }

    private List<PropertyDeclaration> toProperties(List<ModuleDescriptionDocument.Property> properties,
                                                   SourceLocation owner) throws ModuleDescriptionException {
        List<PropertyDeclaration> result = new ArrayList<>();
        if (properties == null) {
            return result;
        }
        for (ModuleDescriptionDocument.Property p : properties) {
            result.add(PropertyDeclaration.builder()
                    .name(requireName(p.name, "property at " + owner.display()))
                    .type(typeParser.parse(p.type, owner))
                    .docComment(p.doc)
                    .build());
        }
        return result;
    }

    private static String requireName(String name, String what) throws ModuleDescriptionException {
        if (name == null || name.isBlank()) {
            throw new ModuleDescriptionException("Missing name for " + what);
        }
        return name;
    }

    private static int lineOf(Integer line) {
        return line == null ? 0 : line;
    }
}
