package com.schemagen.generator.codegen.assemble;

import static com.schemagen.generator.ModuleFixtures.context;
import static com.schemagen.generator.ModuleFixtures.mappingsFor;
import static com.schemagen.generator.ModuleFixtures.module;
import static com.schemagen.generator.ModuleFixtures.moduleClass;
import static com.schemagen.generator.ModuleFixtures.property;
import static org.assertj.core.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.schemagen.generator.codegen.header.HeaderRenderer;
import com.schemagen.generator.codegen.model.GeneratedMember;
import com.schemagen.generator.codegen.model.core.context.GenerationContext;
import com.schemagen.generator.codegen.render.TypeRenderer;
import com.schemagen.generator.codegen.writer.SourceBlock;
import com.schemagen.generator.model.ClassDeclaration;
import com.schemagen.generator.model.DeclarationKind;
import com.schemagen.generator.model.EnumDeclaration;
import com.schemagen.generator.model.ModuleInfo;
import com.schemagen.generator.model.type.DeclaredType;

/**
 * Unit tests for NamespaceAssembler.
 */
class NamespaceAssemblerTest {

    private final NamespaceAssembler assembler = new NamespaceAssembler(new HeaderRenderer(), new TypeRenderer());

    @Test
    void testMinimalDocument() throws Exception {
        ModuleInfo module = module("MyModule", moduleClass("MyModule"));
        GenerationContext context = context("MyModule", mappingsFor(module));

        String content = assembler.assemble(module, context, List.of(root("ModuleClass", "class ModuleClass:\n    pass")));

        assertThat(content).isEqualTo("""
                # Code generated from Pkl module `MyModule`. DO NOT EDIT.
                from __future__ import annotations
                from typing import Any, Callable, Dict, List, Literal, Optional, Set, Tuple, Union
                from dataclasses import dataclass
                import pkl


                class ModuleClass:
                    pass

                    @classmethod
                    def load_pkl(cls, source):
                        # Load the Pkl module at the given source and evaluate it into `MyModule.ModuleClass`.
                        # - Parameter source: The source of the Pkl module.
                        config = pkl.load(source, parser=pkl.Parser(namespace = globals()))
                        return config
                """);
    }

    @Test
    void testAuxiliaryTextIsDeduplicated() throws Exception {
        ModuleInfo module = module("M", moduleClass("M"));
        GenerationContext context = context("M", mappingsFor(module));
        List<GeneratedMember> members = List.of(
                member("E1", "from enum import Enum"),
                member("E2", "from enum import Enum"),
                member("E3", "import re"),
                root("ModuleClass", "class ModuleClass:\n    pass"));

        String content = assembler.assemble(module, context, members);

        assertThat(content).containsOnlyOnce("from enum import Enum");
        assertThat(content).contains("import pkl\nfrom enum import Enum\nimport re\n\n\nclass E1:");
        assertThat(content).contains("class E1:\n    pass\n\nclass E2:");
    }

    @Test
    void testForeignImportsAreSortedAndUnique() throws Exception {
        ModuleInfo zoo = module("zoo", moduleClass("zoo"),
                ClassDeclaration.builder().name("Cage").moduleName("zoo").build());
        ModuleInfo geo = module("com.geo", moduleClass("com.geo"),
                ClassDeclaration.builder().name("Point").moduleName("com.geo").build());
        ClassDeclaration local = ClassDeclaration.builder().name("Local").moduleName("M")
                .superclass("zoo#Cage")
                .property(property("where", DeclaredType.of("com.geo#Point")))
                .property(property("cage", DeclaredType.of("zoo#Cage")))
                .build();
        ModuleInfo module = module("M", moduleClass("M"), local);
        GenerationContext context = context("M", mappingsFor(zoo, geo, module)).toBuilder()
                .outputSuffix("gen")
                .build();

        String content = assembler.assemble(module, context, List.of(root("ModuleClass", "class ModuleClass:\n    pass")));

        assertThat(content).contains("import pkl\nimport com_geo_gen as com_geo\nimport zoo_gen as zoo\n\n\n");
    }

    @Test
    void testBoundNames() {
        ModuleInfo geo = module("com.geo", moduleClass("com.geo"),
                ClassDeclaration.builder().name("Point").moduleName("com.geo").build());
        ClassDeclaration local = ClassDeclaration.builder().name("Local").moduleName("M")
                .property(property("where", DeclaredType.of("com.geo#Point")))
                .build();
        ModuleInfo module = module("M", moduleClass("M"), local);

        Map<String, String> bound = assembler.boundNames(module, context("M", mappingsFor(geo, module)));

        assertThat(bound).containsEntry("com_geo", "import com_geo_pkl as com_geo")
                .containsEntry("dataclass", "from dataclasses import dataclass")
                .containsEntry("pkl", "import pkl")
                .containsKeys("annotations", "Optional", "Union", "List", "Literal")
                .doesNotContainKey("Enum")
                .doesNotContainKey("Local");

        ModuleInfo withEnum = module("M", moduleClass("M"),
                EnumDeclaration.builder().name("Color").moduleName("M").value("red").build());
        assertThat(assembler.boundNames(withEnum, context("M", mappingsFor(withEnum))))
                .containsEntry("Enum", "from enum import Enum");
    }

    @Test
    void testOutputEndsWithSingleNewline() throws Exception {
        ModuleInfo module = module("M", moduleClass("M"));

        String content = assembler.assemble(module, context("M", mappingsFor(module)),
                List.of(root("ModuleClass", "class ModuleClass:\n    pass")));

        assertThat(content).endsWith("return config\n");
    }

    @Test
    void testMissingRootFails() {
        ModuleInfo module = module("M", moduleClass("M"));
        GenerationContext context = context("M", mappingsFor(module));

        assertThatThrownBy(() -> assembler.assemble(module, context, List.of(member("E", null))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("module root class");
        assertThatThrownBy(() -> assembler.assemble(module, context, List.of()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testRootNotLastFails() {
        ModuleInfo module = module("M", moduleClass("M"));
        GenerationContext context = context("M", mappingsFor(module));
        List<GeneratedMember> members = List.of(root("ModuleClass", "class ModuleClass:\n    pass"), member("E", null));

        assertThatThrownBy(() -> assembler.assemble(module, context, members))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testCollectAuxiliaryTextKeepsFirstOccurrenceOrder() {
        List<GeneratedMember> members = List.of(member("A", "b"), member("B", "a"), member("C", "b"), member("D", null));

        assertThat(NamespaceAssembler.collectAuxiliaryText(members)).containsExactly("b", "a");
    }

    private static GeneratedMember member(String name, String auxiliaryText) {
        return GeneratedMember.builder()
                .targetName(name)
                .kind(DeclarationKind.CLASS)
                .body(SourceBlock.ofText("class " + name + ":\n    pass"))
                .auxiliaryText(auxiliaryText)
                .build();
    }

    private static GeneratedMember root(String name, String body) {
        return GeneratedMember.builder()
                .targetName(name)
                .kind(DeclarationKind.MODULE)
                .body(SourceBlock.ofText(body))
                .moduleRootClass(true)
                .build();
    }
}
