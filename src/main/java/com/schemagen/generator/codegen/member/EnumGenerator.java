package com.schemagen.generator.codegen.member;

import java.util.HashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemagen.generator.codegen.model.GeneratedMember;
import com.schemagen.generator.codegen.model.core.context.GenerationContext;
import com.schemagen.generator.codegen.util.PythonNamingUtil;
import com.schemagen.generator.codegen.writer.SourceBlock;
import com.schemagen.generator.model.EnumDeclaration;

/**
 * Generates a string-valued Python enum from an enumeration of string values.
 *
 * Constant names are derived from the values; a constant name that is
 * already taken gets a numeric suffix ({@code RED}, {@code RED_2}).
 */
public class EnumGenerator extends AbstractMemberGenerator<EnumDeclaration> {
    private static final Logger log = LoggerFactory.getLogger(EnumGenerator.class);

    static final String ENUM_IMPORT = "from enum import Enum";

    @Override
    public GeneratedMember generate(EnumDeclaration declaration, int declarationIndex, GenerationContext context) {
        String name = targetName(declaration, context);

        SourceBlock.Builder body = SourceBlock.builder().open("class " + name + "(str, Enum):");
        if (declaration.getValues().isEmpty()) {
            body.line("pass");
        }
        Set<String> usedNames = new HashSet<>();
        for (String value : declaration.getValues()) {
            String constant = uniqueConstant(PythonNamingUtil.toEnumConstant(value), usedNames);
            body.line(constant + " = " + PythonNamingUtil.quote(value));
        }
        body.close();

        log.debug("Generated enum {} with {} values", name, declaration.getValues().size());
        return GeneratedMember.builder()
                .targetName(name)
                .kind(declaration.getKind())
                .declarationIndex(declarationIndex)
                .body(body.build())
                .auxiliaryText(ENUM_IMPORT)
                .build();
    }

    private static String uniqueConstant(String base, Set<String> usedNames) {
        String candidate = base;
        int suffix = 2;
        while (!usedNames.add(candidate)) {
            candidate = base + "_" + suffix++;
        }
        return candidate;
    }
}
