package com.schemagen.generator.codegen.model;

import java.util.List;
import java.util.Optional;

import com.schemagen.generator.model.Declaration;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A group of declarations that resolve to the same target identifier in one namespace.
 */
@Value
@Builder
public class NameCollision {

    @NonNull
    String namespace;

    @NonNull
    String targetName;

    @NonNull
    @Singular
    List<Declaration> declarations;

    /**
     * Statement of the generated document that already binds {@link #targetName}
     * (an import or the fixed preamble), or {@code null} when the declarations
     * collide with each other.
     */
    String boundBy;

    public Optional<String> getBoundBy() {
        return Optional.ofNullable(boundBy);
    }

    /**
     * Diagnostic listing every conflicting declaration and how to resolve the conflict.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        if (boundBy == null) {
            sb.append("Conflict: multiple declarations have been renamed to `").append(targetName)
                    .append("` in namespace `").append(namespace).append("`:\n");
        } else {
            sb.append("Conflict: `").append(targetName).append("` in namespace `").append(namespace)
                    .append("` is already bound by `").append(boundBy).append("`:\n");
        }
        for (Declaration declaration : declarations) {
            sb.append("  * ").append(declaration.getKind().getDisplayName())
                    .append(" `").append(declaration.getQualifiedName()).append("`")
                    .append(" (").append(declaration.getLocation().display()).append(")\n");
        }
        Declaration example = declarations.get(declarations.size() - 1);
        sb.append("\nResolve this by adding a rename annotation to one of them, for example:\n\n");
        sb.append("  @python.Name { value = \"").append(targetName).append("2\" }\n");
        sb.append("  ").append(example.getKind().getDisplayName()).append(" ").append(example.getName());
        return sb.toString();
    }
}
