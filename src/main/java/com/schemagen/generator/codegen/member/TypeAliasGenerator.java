package com.schemagen.generator.codegen.member;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemagen.generator.codegen.exception.UnsupportedTypeException;
import com.schemagen.generator.codegen.model.GeneratedMember;
import com.schemagen.generator.codegen.model.core.context.GenerationContext;
import com.schemagen.generator.codegen.render.TypeRenderer;
import com.schemagen.generator.codegen.writer.SourceBlock;
import com.schemagen.generator.model.TypeAliasDeclaration;

/**
 * Generates {@code Name = <type>} for a type alias.
 */
public class TypeAliasGenerator extends AbstractMemberGenerator<TypeAliasDeclaration> {
    private static final Logger log = LoggerFactory.getLogger(TypeAliasGenerator.class);

    private final TypeRenderer typeRenderer;

    public TypeAliasGenerator(TypeRenderer typeRenderer) {
        this.typeRenderer = typeRenderer;
    }

    @Override
    public GeneratedMember generate(TypeAliasDeclaration declaration, int declarationIndex,
                                    GenerationContext context) throws UnsupportedTypeException {
        String name = targetName(declaration, context);
        String type = typeRenderer.render(declaration.getAliasedType(), context, declaration.getLocation());
        log.debug("Generated type alias {} = {}", name, type);

        return GeneratedMember.builder()
                .targetName(name)
                .kind(declaration.getKind())
                .declarationIndex(declarationIndex)
                .body(SourceBlock.builder().line(name + " = " + type).build())
                .build();
    }
}
