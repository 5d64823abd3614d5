package com.schemagen.generator.codegen.render;

import static com.schemagen.generator.ModuleFixtures.at;
import static com.schemagen.generator.ModuleFixtures.context;
import static com.schemagen.generator.ModuleFixtures.mappingsFor;
import static com.schemagen.generator.ModuleFixtures.module;
import static com.schemagen.generator.ModuleFixtures.moduleClass;
import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.schemagen.generator.codegen.exception.UnsupportedTypeException;
import com.schemagen.generator.codegen.model.MappingTable;
import com.schemagen.generator.codegen.model.core.context.GenerationContext;
import com.schemagen.generator.model.ClassDeclaration;
import com.schemagen.generator.model.ModuleInfo;
import com.schemagen.generator.model.SourceLocation;
import com.schemagen.generator.model.type.DeclaredType;
import com.schemagen.generator.model.type.FunctionType;
import com.schemagen.generator.model.type.GenericType;
import com.schemagen.generator.model.type.NullableType;
import com.schemagen.generator.model.type.PrimitiveKind;
import com.schemagen.generator.model.type.PrimitiveType;
import com.schemagen.generator.model.type.StringLiteralType;
import com.schemagen.generator.model.type.TypeExpression;
import com.schemagen.generator.model.type.UnionType;
import com.schemagen.generator.model.type.UnknownType;

/**
 * Unit tests for TypeRenderer.
 */
class TypeRendererTest {

    private final TypeRenderer renderer = new TypeRenderer();

    private GenerationContext context;

    @BeforeEach
    void setUp() {
        ModuleInfo birds = module("Birds", moduleClass("Birds"),
                cls("Birds", "A"), cls("Birds", "B"),
                ClassDeclaration.builder().name("Nest").moduleName("Birds").renamedTo("BirdNest").build());
        ModuleInfo geo = module("com.example.Geo", moduleClass("com.example.Geo"), cls("com.example.Geo", "Point"));
        MappingTable mappings = mappingsFor(birds, geo);
        context = context("Birds", mappings);
    }

    @Test
    void testNullableString() throws Exception {
        assertThat(render(NullableType.of(PrimitiveType.of(PrimitiveKind.STRING)))).isEqualTo("Optional[str]");
    }

    @Test
    void testUnionOfDeclaredTypes() throws Exception {
        assertThat(render(UnionType.of(DeclaredType.of("Birds#A"), DeclaredType.of("Birds#B"))))
                .isEqualTo("Union[A, B]");
    }

    @Test
    void testUnionKeepsSourceOrder() throws Exception {
        assertThat(render(UnionType.of(DeclaredType.of("Birds#B"), PrimitiveType.of(PrimitiveKind.INT),
                DeclaredType.of("Birds#A"))))
                .isEqualTo("Union[B, int, A]");
    }

    @Test
    void testSingleMemberUnionRendersMember() throws Exception {
        assertThat(render(UnionType.of(PrimitiveType.of(PrimitiveKind.BOOLEAN)))).isEqualTo("bool");
    }

    @Test
    void testStringLiteral() throws Exception {
        assertThat(render(StringLiteralType.of("x"))).isEqualTo("Literal[\"x\"]");
    }

    @Test
    void testStringLiteralIsEscaped() throws Exception {
        assertThat(render(StringLiteralType.of("say \"hi\"\\"))).isEqualTo("Literal[\"say \\\"hi\\\"\\\\\"]");
    }

    @Test
    void testGenericList() throws Exception {
        assertThat(render(GenericType.of(PrimitiveType.of(PrimitiveKind.LIST), DeclaredType.of("Birds#A"))))
                .isEqualTo("List[A]");
    }

    @Test
    void testGenericMappingWithNestedArguments() throws Exception {
        TypeExpression type = GenericType.of(PrimitiveType.of(PrimitiveKind.MAPPING),
                PrimitiveType.of(PrimitiveKind.STRING),
                GenericType.of(PrimitiveType.of(PrimitiveKind.LISTING),
                        NullableType.of(DeclaredType.of("Birds#B"))));

        assertThat(render(type)).isEqualTo("Dict[str, List[Optional[B]]]");
    }

    @Test
    void testGenericWithoutArgumentsRendersBase() throws Exception {
        assertThat(render(GenericType.of(PrimitiveType.of(PrimitiveKind.SET)))).isEqualTo("Set");
    }

    @Test
    void testFunction() throws Exception {
        TypeExpression type = new FunctionType(
                List.of(PrimitiveType.of(PrimitiveKind.INT), DeclaredType.of("Birds#A")),
                PrimitiveType.of(PrimitiveKind.STRING));

        assertThat(render(type)).isEqualTo("Callable[[int, A], str]");
    }

    @Test
    void testPrimitiveSpellings() throws Exception {
        assertThat(render(PrimitiveType.of(PrimitiveKind.INT))).isEqualTo("int");
        assertThat(render(PrimitiveType.of(PrimitiveKind.FLOAT))).isEqualTo("float");
        assertThat(render(PrimitiveType.of(PrimitiveKind.ANY))).isEqualTo("Any");
        assertThat(render(PrimitiveType.of(PrimitiveKind.NULL))).isEqualTo("None");
        assertThat(render(PrimitiveType.of(PrimitiveKind.DURATION))).isEqualTo("pkl.Duration");
        assertThat(render(PrimitiveType.of(PrimitiveKind.MAP))).isEqualTo("Dict");
    }

    @Test
    void testNestedNullableCollapses() throws Exception {
        TypeExpression type = NullableType.of(NullableType.of(PrimitiveType.of(PrimitiveKind.INT)));

        assertThat(render(type)).isEqualTo("Optional[int]");
    }

    @Test
    void testRenamedDeclarationUsesTargetName() throws Exception {
        assertThat(render(DeclaredType.of("Birds#Nest"))).isEqualTo("BirdNest");
    }

    @Test
    void testForeignDeclarationIsQualified() throws Exception {
        assertThat(render(DeclaredType.of("com.example.Geo#Point"))).isEqualTo("com_example_Geo.Point");
    }

    @Test
    void testSameDeclarationUnqualifiedInItsOwnNamespace() throws Exception {
        GenerationContext geoContext = context.toBuilder().namespace("com.example.Geo").build();

        assertThat(renderer.render(DeclaredType.of("com.example.Geo#Point"), geoContext, at(1)))
                .isEqualTo("Point");
    }

    @Test
    void testUnknownTypeFailsWithDisplayAndLocation() {
        SourceLocation location = SourceLocation.of("file:///Birds.pkl", 12);
        TypeExpression type = GenericType.of(PrimitiveType.of(PrimitiveKind.LIST),
                new UnknownType("String(!isEmpty)", location));

        assertThatThrownBy(() -> render(type))
                .isInstanceOf(UnsupportedTypeException.class)
                .hasMessageContaining("String(!isEmpty)")
                .hasMessageContaining("file:///Birds.pkl:12")
                .satisfies(e -> {
                    UnsupportedTypeException ute = (UnsupportedTypeException) e;
                    assertThat(ute.getTypeDisplay()).isEqualTo("String(!isEmpty)");
                    assertThat(ute.getLocation()).isEqualTo(location);
                });
    }

    @Test
    void testUnmappedDeclarationFails() {
        assertThatThrownBy(() -> render(DeclaredType.of("Birds#Missing")))
                .isInstanceOf(UnsupportedTypeException.class)
                .hasMessageContaining("Birds#Missing");
    }

    @Test
    void testForeignNamespaces() {
        TypeExpression type = UnionType.of(
                DeclaredType.of("com.example.Geo#Point"),
                DeclaredType.of("Birds#A"),
                GenericType.of(PrimitiveType.of(PrimitiveKind.LIST), DeclaredType.of("com.example.Geo#Point")));

        assertThat(renderer.foreignNamespaces(type, context)).containsExactly("com.example.Geo");
    }

    private String render(TypeExpression type) throws UnsupportedTypeException {
        return renderer.render(type, context, at(1));
    }

    private static ClassDeclaration cls(String module, String name) {
        return ClassDeclaration.builder().name(name).moduleName(module).build();
    }
}
