package com.schemagen.generator.input.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON form of the reflection dump consumed by the generator.
 *
 * <pre>
 * {
 *   "modules": [{
 *     "name": "Birds", "uri": "file:///birds.pkl", "open": false,
 *     "doc": "...", "rename": null, "line": 1, "superclass": null,
 *     "properties": [{"name": "birds", "type": ...}],
 *     "declarations": [
 *       {"kind": "typealias", "name": "Txt", "line": 3, "type": "String"},
 *       {"kind": "enum", "name": "Color", "line": 4, "values": ["red", "green"]},
 *       {"kind": "class", "name": "Bird", "line": 6, "superclass": "Birds#Animal",
 *        "properties": [...]}
 *     ]
 *   }]
 * }
 * </pre>
 *
 * Types are either a primitive name ({@code "String"}) or an object with a
 * {@code kind} of primitive, nullable, union, declared, literal, generic or function.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModuleDescriptionDocument {
    public List<Module> modules;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Module {
        public String name;
        public String uri;
        public boolean open;
        @JsonAlias({"docComment"})
        public String doc;
        /** Rename annotation of the module class. */
        public String rename;
        public Integer line;
        @JsonAlias({"extends"})
        public String superclass;
        public List<Property> properties;
        public List<Declaration> declarations;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Declaration {
        /** class, enum or typealias. */
        public String kind;
        public String name;
        public Integer line;
        public String rename;
        @JsonAlias({"extends"})
        public String superclass;
        @JsonProperty("abstract")
        public boolean abstractClass;
        public List<Property> properties;
        public List<String> values;
        public JsonNode type;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Property {
        public String name;
        @JsonAlias({"docComment"})
        public String doc;
        public JsonNode type;
    }
}
