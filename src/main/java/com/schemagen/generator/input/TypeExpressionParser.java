package com.schemagen.generator.input;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.schemagen.generator.codegen.exception.ModuleDescriptionException;
import com.schemagen.generator.model.SourceLocation;
import com.schemagen.generator.model.type.DeclaredType;
import com.schemagen.generator.model.type.FunctionType;
import com.schemagen.generator.model.type.GenericType;
import com.schemagen.generator.model.type.NullableType;
import com.schemagen.generator.model.type.PrimitiveKind;
import com.schemagen.generator.model.type.PrimitiveType;
import com.schemagen.generator.model.type.StringLiteralType;
import com.schemagen.generator.model.type.TypeExpression;
import com.schemagen.generator.model.type.UnionType;
import com.schemagen.generator.model.type.UnknownType;

/**
 * Converts the JSON form of a type into a {@link TypeExpression}.
 *
 * Shapes the generator has no variant for become {@link UnknownType}, so the
 * failure surfaces when (and only if) the type is rendered.
 */
public class TypeExpressionParser {

    public TypeExpression parse(JsonNode node, SourceLocation location) throws ModuleDescriptionException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new ModuleDescriptionException("Missing type at " + location.display());
        }
        if (node.isTextual()) {
            return primitive(node.asText(), location);
        }
        if (!node.isObject()) {
            throw new ModuleDescriptionException("Type must be a string or an object at "
                    + location.display() + ": " + node);
        }

        String kind = node.path("kind").asText("");
        return switch (kind) {
            case "primitive" -> primitive(requireText(node, "name", location), location);
            case "nullable" -> NullableType.of(parse(node.get("inner"), location));
            case "union" -> new UnionType(parseAll(node.get("members"), location));
            case "declared" -> DeclaredType.of(requireText(node, "ref", location));
            case "literal", "stringLiteral" -> StringLiteralType.of(requireText(node, "value", location));
            case "generic" -> new GenericType(parse(node.get("base"), location),
                    parseAll(node.get("args"), location));
            case "function" -> new FunctionType(parseAll(node.get("params"), location),
                    parse(node.get("returns"), location));
            default -> new UnknownType(node.path("display").asText(kind.isEmpty() ? node.toString() : kind),
                    location);
        };
    }

    private List<TypeExpression> parseAll(JsonNode array, SourceLocation location)
            throws ModuleDescriptionException {
        List<TypeExpression> types = new ArrayList<>();
        if (array == null || array.isNull()) {
            return types;
        }
        if (!array.isArray()) {
            throw new ModuleDescriptionException("Expected a list of types at " + location.display());
        }
        for (JsonNode element : array) {
            types.add(parse(element, location));
        }
        return types;
    }

    private static TypeExpression primitive(String name, SourceLocation location) {
        return PrimitiveKind.fromSchemaName(name)
                .<TypeExpression>map(PrimitiveType::of)
                .orElseGet(() -> new UnknownType(name, location));
    }

    private static String requireText(JsonNode node, String field, SourceLocation location)
            throws ModuleDescriptionException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new ModuleDescriptionException("Type of kind '" + node.path("kind").asText()
                    + "' requires a string '" + field + "' at " + location.display());
        }
        return value.asText();
    }
}
