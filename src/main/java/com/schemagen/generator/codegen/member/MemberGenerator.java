package com.schemagen.generator.codegen.member;

import com.schemagen.generator.codegen.exception.UnsupportedTypeException;
import com.schemagen.generator.codegen.model.GeneratedMember;
import com.schemagen.generator.codegen.model.core.context.GenerationContext;
import com.schemagen.generator.model.Declaration;

/**
 * Produces the generated body of one kind of declaration.
 */
public interface MemberGenerator<D extends Declaration> {

    /**
     * @param declarationIndex position of the declaration in the reflected module
     * @throws UnsupportedTypeException if a type used by the declaration cannot be rendered
     */
    GeneratedMember generate(D declaration, int declarationIndex, GenerationContext context)
            throws UnsupportedTypeException;
}
