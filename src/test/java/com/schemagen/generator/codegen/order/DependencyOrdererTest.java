package com.schemagen.generator.codegen.order;

import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.schemagen.generator.codegen.model.GeneratedMember;
import com.schemagen.generator.codegen.writer.SourceBlock;
import com.schemagen.generator.model.DeclarationKind;

/**
 * Unit tests for DependencyOrderer.
 */
class DependencyOrdererTest {

    private final DependencyOrderer orderer = new DependencyOrderer();

    @Test
    void testTypeAliasesComeFirst() {
        List<GeneratedMember> members = List.of(
                member("A", DeclarationKind.CLASS, 0, null),
                member("T1", DeclarationKind.TYPE_ALIAS, 1, null),
                member("E", DeclarationKind.ENUM, 2, null),
                member("T2", DeclarationKind.TYPE_ALIAS, 3, null));

        assertThat(names(orderer.order(members))).containsExactly("T1", "T2", "A", "E");
    }

    @Test
    void testSubclassFollowsSuperclass() {
        List<GeneratedMember> members = List.of(
                member("Dog", DeclarationKind.CLASS, 0, "Animal"),
                member("Puppy", DeclarationKind.CLASS, 1, "Dog"),
                member("Animal", DeclarationKind.CLASS, 2, null),
                member("Rock", DeclarationKind.CLASS, 3, null));

        assertThat(names(orderer.order(members))).containsExactly("Animal", "Dog", "Puppy", "Rock");
    }

    @Test
    void testModuleRootComesLast() {
        List<GeneratedMember> members = List.of(
                root("ModuleClass", 3, null),
                member("A", DeclarationKind.CLASS, 0, null),
                member("E", DeclarationKind.ENUM, 1, null),
                member("T", DeclarationKind.TYPE_ALIAS, 2, null));

        assertThat(names(orderer.order(members))).containsExactly("T", "A", "E", "ModuleClass");
    }

    @Test
    void testModuleRootExtendingMemberClass() {
        List<GeneratedMember> members = List.of(
                member("Txt", DeclarationKind.TYPE_ALIAS, 0, null),
                member("E", DeclarationKind.ENUM, 1, null),
                member("A", DeclarationKind.CLASS, 2, null),
                root("B", 3, "A"));

        assertThat(names(orderer.order(members))).containsExactly("Txt", "E", "A", "B");
    }

    @Test
    void testDeclarationOrderKeptOtherwise() {
        List<GeneratedMember> members = List.of(
                member("C", DeclarationKind.CLASS, 0, null),
                member("B", DeclarationKind.ENUM, 1, null),
                member("A", DeclarationKind.CLASS, 2, null));

        assertThat(names(orderer.order(members))).containsExactly("C", "B", "A");
    }

    @Test
    void testOrderIndependentOfInputOrder() {
        List<GeneratedMember> members = new ArrayList<>(List.of(
                member("T", DeclarationKind.TYPE_ALIAS, 0, null),
                member("Sub", DeclarationKind.CLASS, 1, "Base"),
                member("Base", DeclarationKind.CLASS, 2, null),
                member("E", DeclarationKind.ENUM, 3, null),
                root("ModuleClass", 4, "Sub")));
        List<String> expected = names(orderer.order(members));

        Collections.reverse(members);
        assertThat(names(orderer.order(members))).isEqualTo(expected);
        assertThat(expected).containsExactly("T", "Base", "Sub", "E", "ModuleClass");
    }

    @Test
    void testInheritanceCycleFails() {
        List<GeneratedMember> members = List.of(
                member("A", DeclarationKind.CLASS, 0, "B"),
                member("B", DeclarationKind.CLASS, 1, "A"));

        assertThatThrownBy(() -> orderer.order(members))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cycle");
    }

    @Test
    void testMultipleRootsFail() {
        List<GeneratedMember> members = List.of(root("X", 0, null), root("Y", 1, null));

        assertThatThrownBy(() -> orderer.order(members))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("X, Y");
    }

    @Test
    void testEmptyInput() {
        assertThat(orderer.order(List.of())).isEmpty();
    }

    private static GeneratedMember member(String name, DeclarationKind kind, int index, String superclass) {
        return GeneratedMember.builder()
                .targetName(name)
                .kind(kind)
                .declarationIndex(index)
                .body(SourceBlock.ofText(name))
                .superclassName(superclass)
                .build();
    }

    private static GeneratedMember root(String name, int index, String superclass) {
        return member(name, DeclarationKind.MODULE, index, superclass).toBuilder().moduleRootClass(true).build();
    }

    private static List<String> names(List<GeneratedMember> members) {
        return members.stream().map(GeneratedMember::getTargetName).toList();
    }
}
