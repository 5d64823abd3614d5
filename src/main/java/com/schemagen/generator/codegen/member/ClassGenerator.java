package com.schemagen.generator.codegen.member;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemagen.generator.codegen.exception.UnsupportedTypeException;
import com.schemagen.generator.codegen.model.GeneratedMember;
import com.schemagen.generator.codegen.model.Mapping;
import com.schemagen.generator.codegen.model.core.context.GenerationContext;
import com.schemagen.generator.codegen.render.TypeRenderer;
import com.schemagen.generator.codegen.util.PythonNamingUtil;
import com.schemagen.generator.codegen.writer.SourceBlock;
import com.schemagen.generator.model.ClassDeclaration;
import com.schemagen.generator.model.PropertyDeclaration;

/**
 * Generates a {@code @dataclass} for a class or for the module class.
 *
 * The body lists one annotated field per property and ends with the
 * {@code _registered_identifier} the runtime uses to match evaluated objects
 * to generated classes. The convenience loader is not part of this body.
 */
public class ClassGenerator extends AbstractMemberGenerator<ClassDeclaration> {
    private static final Logger log = LoggerFactory.getLogger(ClassGenerator.class);

    private final TypeRenderer typeRenderer;

    public ClassGenerator(TypeRenderer typeRenderer) {
        this.typeRenderer = typeRenderer;
    }

    @Override
    public GeneratedMember generate(ClassDeclaration declaration, int declarationIndex,
                                    GenerationContext context) throws UnsupportedTypeException {
        String name = targetName(declaration, context);
        Optional<Mapping> superMapping = declaration.getSuperclass()
                .flatMap(qualifiedName -> context.getMappings().find(qualifiedName));

        String header = "class " + name + superMapping.map(m -> "(" + baseClass(m, context) + ")").orElse("") + ":";

        SourceBlock.Builder body = SourceBlock.builder()
                .line("@dataclass")
                .open(header);
        Set<String> fieldNames = new HashSet<>();
        for (PropertyDeclaration property : declaration.getProperties()) {
            property.getDocComment().ifPresent(doc -> doc.lines()
                    .forEach(l -> body.line(l.isBlank() ? "#" : "# " + l.strip())));
            String type = typeRenderer.render(property.getType(), context, declaration.getLocation());
            body.line(fieldName(property.getName(), fieldNames, declaration) + ": " + type);
        }
        if (!declaration.getProperties().isEmpty()) {
            body.blankLine();
        }
        body.line("_registered_identifier = " + PythonNamingUtil.quote(declaration.getQualifiedName()));
        body.close();

        String superclassName = superMapping
                .filter(m -> m.getNamespace().equals(context.getNamespace()))
                .map(Mapping::getTargetName)
                .orElse(null);
        if (declaration.getSuperclass().isPresent() && superMapping.isEmpty()) {
            log.debug("Superclass {} of {} is not generated; emitting {} without a base class",
                    declaration.getSuperclass().get(), declaration.getQualifiedName(), name);
        }

        log.debug("Generated class {} with {} properties", name, declaration.getProperties().size());
        return GeneratedMember.builder()
                .targetName(name)
                .kind(declaration.getKind())
                .declarationIndex(declarationIndex)
                .body(body.build())
                .moduleRootClass(declaration.isModuleClass())
                .superclassName(superclassName)
                .build();
    }

    private static String fieldName(String propertyName, Set<String> used, ClassDeclaration owner) {
        String base = PythonNamingUtil.toIdentifier(propertyName);
        String candidate = base;
        int suffix = 2;
        while (!used.add(candidate)) {
            candidate = base + "_" + suffix++;
        }
        if (!candidate.equals(propertyName) && !candidate.equals(propertyName + "_")) {
            log.warn("Property `{}` of {} is emitted as `{}`", propertyName, owner.getQualifiedName(), candidate);
        }
        return candidate;
    }

    private static String baseClass(Mapping superMapping, GenerationContext context) {
        if (superMapping.getNamespace().equals(context.getNamespace())) {
            return superMapping.getTargetName();
        }
        return PythonNamingUtil.moduleAlias(superMapping.getNamespace()) + "." + superMapping.getTargetName();
    }
}
