package com.schemagen.generator.codegen.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import com.schemagen.generator.codegen.exception.UnsupportedTypeException;
import com.schemagen.generator.codegen.model.Mapping;
import com.schemagen.generator.codegen.model.core.context.GenerationContext;
import com.schemagen.generator.codegen.util.PythonNamingUtil;
import com.schemagen.generator.model.SourceLocation;
import com.schemagen.generator.model.type.DeclaredType;
import com.schemagen.generator.model.type.FunctionType;
import com.schemagen.generator.model.type.GenericType;
import com.schemagen.generator.model.type.NullableType;
import com.schemagen.generator.model.type.PrimitiveType;
import com.schemagen.generator.model.type.StringLiteralType;
import com.schemagen.generator.model.type.TypeExpression;
import com.schemagen.generator.model.type.TypeExpressionVisitor;
import com.schemagen.generator.model.type.UnionType;
import com.schemagen.generator.model.type.UnknownType;

/**
 * Renders type expressions as Python type annotations.
 *
 * <ul>
 *   <li>{@code String?} → {@code Optional[str]}</li>
 *   <li>{@code A|B} → {@code Union[A, B]}</li>
 *   <li>{@code "x"} → {@code Literal["x"]}</li>
 *   <li>{@code List<A>} → {@code List[A]}</li>
 *   <li>{@code (A, B) -> C} → {@code Callable[[A, B], C]}</li>
 *   <li>a declaration of another namespace → {@code Other.A}</li>
 * </ul>
 *
 * Stateless; one instance can serve every namespace of a run.
 */
public class TypeRenderer {

    /**
     * Renders {@code type} as seen from {@code context}'s namespace.
     *
     * @param location where the type occurs, reported when rendering fails
     * @throws UnsupportedTypeException if the expression, or any part of it, has no Python form
     */
    public String render(TypeExpression type, GenerationContext context, SourceLocation location)
            throws UnsupportedTypeException {
        return type.accept(new RenderingVisitor(context, location));
    }

    /**
     * Namespaces other than the context's that {@code type} refers to, sorted.
     * References without a mapping are ignored here; rendering reports them.
     */
    public Set<String> foreignNamespaces(TypeExpression type, GenerationContext context) {
        Set<String> namespaces = new TreeSet<>();
        type.accept(new ForeignNamespaceCollector(context, namespaces));
        return namespaces;
    }

    private static final class RenderingVisitor implements TypeExpressionVisitor<String, UnsupportedTypeException> {
        private final GenerationContext context;
        private final SourceLocation location;

        RenderingVisitor(GenerationContext context, SourceLocation location) {
            this.context = context;
            this.location = location;
        }

        @Override
        public String visitPrimitive(PrimitiveType type) {
            return type.getKind().getPythonName();
        }

        @Override
        public String visitNullable(NullableType type) throws UnsupportedTypeException {
            TypeExpression inner = type.getInner();
            while (inner instanceof NullableType nested) {
                inner = nested.getInner();
            }
            return "Optional[" + inner.accept(this) + "]";
        }

        @Override
        public String visitUnion(UnionType type) throws UnsupportedTypeException {
            List<TypeExpression> members = type.getMembers();
            if (members.isEmpty()) {
                throw new UnsupportedTypeException(type.display(), location, "union without members");
            }
            if (members.size() == 1) {
                return members.get(0).accept(this);
            }
            return "Union[" + renderAll(members) + "]";
        }

        @Override
        public String visitDeclared(DeclaredType type) throws UnsupportedTypeException {
            Mapping mapping = context.getMappings().find(type.getQualifiedName())
                    .orElseThrow(() -> new UnsupportedTypeException(type.display(), location,
                            "no generated declaration for `" + type.getQualifiedName() + "`"));
            if (mapping.getNamespace().equals(context.getNamespace())) {
                return mapping.getTargetName();
            }
            return PythonNamingUtil.moduleAlias(mapping.getNamespace()) + "." + mapping.getTargetName();
        }

        @Override
        public String visitStringLiteral(StringLiteralType type) {
            return "Literal[" + PythonNamingUtil.quote(type.getValue()) + "]";
        }

        @Override
        public String visitGeneric(GenericType type) throws UnsupportedTypeException {
            String base = type.getBase().accept(this);
            if (type.getArguments().isEmpty()) {
                return base;
            }
            return base + "[" + renderAll(type.getArguments()) + "]";
        }

        @Override
        public String visitFunction(FunctionType type) throws UnsupportedTypeException {
            return "Callable[[" + renderAll(type.getParameters()) + "], "
                    + type.getReturnType().accept(this) + "]";
        }

        @Override
        public String visitUnknown(UnknownType type) throws UnsupportedTypeException {
            throw new UnsupportedTypeException(type.getDisplayForm(), type.getLocation(),
                    "no Python equivalent");
        }

        private String renderAll(List<TypeExpression> types) throws UnsupportedTypeException {
            List<String> rendered = new ArrayList<>(types.size());
            for (TypeExpression t : types) {
                rendered.add(t.accept(this));
            }
            return String.join(", ", rendered);
        }
    }

    private static final class ForeignNamespaceCollector implements TypeExpressionVisitor<Void, RuntimeException> {
        private final GenerationContext context;
        private final Set<String> namespaces;

        ForeignNamespaceCollector(GenerationContext context, Set<String> namespaces) {
            this.context = context;
            this.namespaces = namespaces;
        }

        @Override
        public Void visitPrimitive(PrimitiveType type) {
            return null;
        }

        @Override
        public Void visitNullable(NullableType type) {
            return type.getInner().accept(this);
        }

        @Override
        public Void visitUnion(UnionType type) {
            type.getMembers().forEach(m -> m.accept(this));
            return null;
        }

        @Override
        public Void visitDeclared(DeclaredType type) {
            context.getMappings().find(type.getQualifiedName())
                    .map(Mapping::getNamespace)
                    .filter(ns -> !ns.equals(context.getNamespace()))
                    .ifPresent(namespaces::add);
            return null;
        }

        @Override
        public Void visitStringLiteral(StringLiteralType type) {
            return null;
        }

        @Override
        public Void visitGeneric(GenericType type) {
            type.getBase().accept(this);
            type.getArguments().forEach(a -> a.accept(this));
            return null;
        }

        @Override
        public Void visitFunction(FunctionType type) {
            type.getParameters().forEach(p -> p.accept(this));
            return type.getReturnType().accept(this);
        }

        @Override
        public Void visitUnknown(UnknownType type) {
            return null;
        }
    }
}
