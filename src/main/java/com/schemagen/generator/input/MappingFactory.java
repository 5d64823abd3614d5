package com.schemagen.generator.input;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemagen.generator.codegen.model.Mapping;
import com.schemagen.generator.codegen.model.MappingTable;
import com.schemagen.generator.model.ClassDeclaration;
import com.schemagen.generator.model.Declaration;
import com.schemagen.generator.model.ModuleInfo;

/**
 * Assigns target identifiers: the rename annotation when present, otherwise
 * the source name. The module class defaults to {@value #DEFAULT_MODULE_CLASS_NAME}.
 *
 * Uniqueness is not checked here.
 */
public class MappingFactory {
    private static final Logger log = LoggerFactory.getLogger(MappingFactory.class);

    public static final String DEFAULT_MODULE_CLASS_NAME = "ModuleClass";

    public MappingTable create(List<ModuleInfo> modules) {
        List<Mapping> mappings = new ArrayList<>();
        for (ModuleInfo module : modules) {
            for (Declaration declaration : module.getAllDeclarations()) {
                mappings.add(Mapping.builder()
                        .declaration(declaration)
                        .namespace(module.getName())
                        .targetName(targetName(declaration))
                        .build());
            }
        }
        log.debug("Created {} mappings", mappings.size());
        return MappingTable.of(mappings);
    }

    static String targetName(Declaration declaration) {
        return declaration.getRenamedTo().orElseGet(() ->
                declaration instanceof ClassDeclaration clazz && clazz.isModuleClass()
                        ? DEFAULT_MODULE_CLASS_NAME
                        : declaration.getName());
    }
}
