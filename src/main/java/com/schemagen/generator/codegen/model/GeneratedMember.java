package com.schemagen.generator.codegen.model;

import java.util.Optional;

import com.schemagen.generator.codegen.writer.SourceBlock;
import com.schemagen.generator.model.DeclarationKind;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Output of a member generator: one top-level declaration of the generated document.
 */
@Value
@Builder(toBuilder = true)
public class GeneratedMember {

    @NonNull
    String targetName;

    @NonNull
    DeclarationKind kind;

    /**
     * Position of the source declaration in the reflected input, used as the ordering tie-break.
     */
    int declarationIndex;

    @NonNull
    SourceBlock body;

    /**
     * Text emitted once per namespace above all members (imports, shared constants).
     */
    String auxiliaryText;

    boolean moduleRootClass;

    /**
     * Target name of the direct superclass when it is generated in the same namespace.
     */
    String superclassName;

    public Optional<String> getAuxiliaryText() {
        return Optional.ofNullable(auxiliaryText).filter(s -> !s.isBlank());
    }

    public Optional<String> getSuperclassName() {
        return Optional.ofNullable(superclassName);
    }

    public boolean isTypeAlias() {
        return kind == DeclarationKind.TYPE_ALIAS;
    }
}
