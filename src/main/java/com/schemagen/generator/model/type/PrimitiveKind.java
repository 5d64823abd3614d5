package com.schemagen.generator.model.type;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Built-in schema types and their Python spelling.
 */
public enum PrimitiveKind {
    STRING("str", "String", "Char"),
    INT("int", "Int", "Int8", "Int16", "Int32", "UInt", "UInt8", "UInt16", "UInt32"),
    FLOAT("float", "Float"),
    NUMBER("float", "Number"),
    BOOLEAN("bool", "Boolean"),
    ANY("Any", "Any", "Dynamic"),
    NULL("None", "Null"),
    OBJECT("object", "Object", "Typed"),
    DURATION("pkl.Duration", "Duration"),
    DATA_SIZE("pkl.DataSize", "DataSize"),
    LIST("List", "List"),
    SET("Set", "Set"),
    MAP("Dict", "Map"),
    LISTING("List", "Listing"),
    MAPPING("Dict", "Mapping"),
    PAIR("Tuple", "Pair");

    private final String pythonName;
    private final List<String> schemaNames;

    PrimitiveKind(String pythonName, String... schemaNames) {
        this.pythonName = pythonName;
        this.schemaNames = List.of(schemaNames);
    }

    public String getPythonName() {
        return pythonName;
    }

    public List<String> getSchemaNames() {
        return schemaNames;
    }

    /**
     * Looks up a kind by one of its schema spellings, ignoring case.
     */
    public static Optional<PrimitiveKind> fromSchemaName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(kind -> kind.schemaNames.stream()
                        .anyMatch(n -> n.toLowerCase(Locale.ROOT).equals(wanted)))
                .findFirst();
    }
}
