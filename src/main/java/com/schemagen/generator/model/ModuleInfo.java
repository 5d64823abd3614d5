package com.schemagen.generator.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Reflected description of one schema module: the unit that becomes one
 * generated namespace.
 *
 * Pure structure only.
 */
@Value
@Builder(toBuilder = true)
public class ModuleInfo {

    /**
     * Module name, also the name of the generated namespace.
     */
    @NonNull
    String name;

    @NonNull
    String uri;

    /**
     * Whether the module is open (or abstract) and may be amended by other modules.
     */
    boolean open;

    String docComment;

    /**
     * The class representing the module itself.
     */
    @NonNull
    ClassDeclaration moduleClass;

    /**
     * Classes, enums and type aliases in declaration order.
     */
    @NonNull
    @Singular
    List<Declaration> declarations;

    public Optional<String> getDocComment() {
        return Optional.ofNullable(docComment).filter(s -> !s.isBlank());
    }

    /**
     * Member declarations followed by the module class.
     */
    public List<Declaration> getAllDeclarations() {
        List<Declaration> all = new ArrayList<>(declarations);
        all.add(moduleClass);
        return all;
    }
}
