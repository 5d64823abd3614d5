package com.schemagen.generator.codegen.member;

import static com.schemagen.generator.ModuleFixtures.context;
import static com.schemagen.generator.ModuleFixtures.mappingsFor;
import static com.schemagen.generator.ModuleFixtures.module;
import static com.schemagen.generator.ModuleFixtures.moduleClass;
import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.schemagen.generator.codegen.model.GeneratedMember;
import com.schemagen.generator.model.DeclarationKind;
import com.schemagen.generator.model.EnumDeclaration;
import com.schemagen.generator.model.ModuleInfo;

/**
 * Unit tests for EnumGenerator.
 */
class EnumGeneratorTest {

    private final EnumGenerator generator = new EnumGenerator();

    @Test
    void testEnumBody() {
        EnumDeclaration color = EnumDeclaration.builder().name("Color").moduleName("M")
                .value("red").value("dark-blue").value("lightGray")
                .build();

        GeneratedMember member = generate(color);

        assertThat(member.getKind()).isEqualTo(DeclarationKind.ENUM);
        assertThat(member.getAuxiliaryText()).contains("from enum import Enum");
        assertThat(member.getBody().render("    ")).isEqualTo("""
                class Color(str, Enum):
                    RED = "red"
                    DARK_BLUE = "dark-blue"
                    LIGHT_GRAY = "lightGray\"""");
    }

    @Test
    void testCollidingConstantsGetSuffix() {
        EnumDeclaration size = EnumDeclaration.builder().name("Size").moduleName("M")
                .value("x-large").value("x_large").value("xLarge")
                .build();

        assertThat(generate(size).getBody().render("    ")).isEqualTo("""
                class Size(str, Enum):
                    X_LARGE = "x-large"
                    X_LARGE_2 = "x_large"
                    X_LARGE_3 = "xLarge\"""");
    }

    @Test
    void testControlCharacterInValueIsEscaped() {
        EnumDeclaration marker = EnumDeclaration.builder().name("Marker").moduleName("M")
                .value("end\u0000").build();

        assertThat(generate(marker).getBody().render("    ")).contains("END_ = \"end\\x00\"");
    }

    @Test
    void testEmptyEnum() {
        EnumDeclaration empty = EnumDeclaration.builder().name("Nothing").moduleName("M").build();

        assertThat(generate(empty).getBody().render("    ")).isEqualTo("class Nothing(str, Enum):\n    pass");
    }

    @Test
    void testRenamedEnum() {
        EnumDeclaration mode = EnumDeclaration.builder().name("Mode").moduleName("M").renamedTo("RunMode")
                .value("fast").build();

        assertThat(generate(mode).getBody().render("    ")).startsWith("class RunMode(str, Enum):");
    }

    private GeneratedMember generate(EnumDeclaration declaration) {
        ModuleInfo module = module("M", moduleClass("M"), declaration);
        return generator.generate(declaration, 0, context("M", mappingsFor(module)));
    }
}
