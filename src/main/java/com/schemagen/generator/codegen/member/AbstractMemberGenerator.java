package com.schemagen.generator.codegen.member;

import com.schemagen.generator.codegen.model.Mapping;
import com.schemagen.generator.codegen.model.core.context.GenerationContext;
import com.schemagen.generator.model.Declaration;

/**
 * Shared lookups for member generators.
 */
abstract class AbstractMemberGenerator<D extends Declaration> implements MemberGenerator<D> {

    /**
     * Target identifier assigned upstream to {@code declaration}.
     */
    protected String targetName(D declaration, GenerationContext context) {
        return context.getMappings().find(declaration.getQualifiedName())
                .map(Mapping::getTargetName)
                .orElseThrow(() -> new IllegalStateException(
                        "No mapping for " + declaration + " in namespace " + context.getNamespace()));
    }
}
