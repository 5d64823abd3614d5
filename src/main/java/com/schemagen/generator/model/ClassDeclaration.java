package com.schemagen.generator.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * A class declaration. The class representing the module itself carries
 * {@code moduleClass = true} and reports {@link DeclarationKind#MODULE}.
 */
@Getter
public class ClassDeclaration extends Declaration {
    private final String superclass;
    private final List<PropertyDeclaration> properties;
    private final boolean moduleClass;
    private final boolean abstractClass;

    @Builder
    public ClassDeclaration(String name, String moduleName, SourceLocation location, String renamedTo,
                            String superclass, @Singular List<PropertyDeclaration> properties,
                            boolean moduleClass, boolean abstractClass) {
        super(name, moduleName, location, renamedTo);
        this.superclass = superclass;
        this.properties = List.copyOf(properties != null ? properties : new ArrayList<>());
        this.moduleClass = moduleClass;
        this.abstractClass = abstractClass;
    }

    @Override
    public DeclarationKind getKind() {
        return moduleClass ? DeclarationKind.MODULE : DeclarationKind.CLASS;
    }

    @Override
    public String getQualifiedName() {
        return moduleClass ? moduleName : super.getQualifiedName();
    }

    /**
     * Qualified name of the direct superclass, if the reflection recorded one.
     */
    public Optional<String> getSuperclass() {
        return Optional.ofNullable(superclass).filter(s -> !s.isBlank());
    }
}
