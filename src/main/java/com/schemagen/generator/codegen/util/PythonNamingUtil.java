package com.schemagen.generator.codegen.util;

import java.util.Set;

/**
 * Utility for Python naming conventions.
 */
public class PythonNamingUtil {

    private static final Set<String> PYTHON_KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break",
            "class", "continue", "def", "del", "elif", "else", "except", "finally", "for",
            "from", "global", "if", "import", "in", "is", "lambda", "nonlocal", "not", "or",
            "pass", "raise", "return", "try", "while", "with", "yield"
    );

    private PythonNamingUtil() {
        // Utility class
    }

    /**
     * Name under which a namespace is imported by other generated modules.
     * {@code com.example.Birds} becomes {@code com_example_Birds}.
     */
    public static String moduleAlias(String namespace) {
        String alias = namespace.replaceAll("[^A-Za-z0-9_]", "_");
        if (alias.isEmpty() || Character.isDigit(alias.charAt(0))) {
            alias = "_" + alias;
        }
        return alias;
    }

    /**
     * Python module name of a generated namespace, {@code <namespace>_<suffix>}.
     */
    public static String moduleName(String namespace, String suffix) {
        return moduleAlias(namespace) + "_" + suffix;
    }

    /**
     * Output file name of a generated namespace, {@code <namespace>_<suffix>.py}.
     */
    public static String fileName(String namespace, String suffix) {
        return moduleName(namespace, suffix) + ".py";
    }

    public static boolean isKeyword(String name) {
        return PYTHON_KEYWORDS.contains(name);
    }

    /**
     * Appends {@code _} to names that are reserved words in Python.
     */
    public static String escapeKeyword(String name) {
        return isKeyword(name) ? name + "_" : name;
    }

    /**
     * Turns a schema identifier into a valid Python identifier: characters
     * outside {@code [A-Za-z0-9_]} become {@code _}, a leading digit is
     * prefixed with {@code _} and reserved words are escaped.
     * {@code my-prop} becomes {@code my_prop}.
     */
    public static String toIdentifier(String name) {
        String identifier = name.replaceAll("[^A-Za-z0-9_]", "_");
        if (identifier.isEmpty() || Character.isDigit(identifier.charAt(0))) {
            identifier = "_" + identifier;
        }
        return escapeKeyword(identifier);
    }

    /**
     * Converts an enum value to an UPPER_SNAKE_CASE constant name.
     * "dark-blue" becomes DARK_BLUE, "2xl" becomes _2XL, "" becomes EMPTY.
     */
    public static String toEnumConstant(String value) {
        if (value == null || value.isEmpty()) {
            return "EMPTY";
        }
        String result = value.replaceAll("([a-z0-9])([A-Z])", "$1_$2")
                .replaceAll("[^A-Za-z0-9_]+", "_")
                .toUpperCase();
        if (result.replace("_", "").isEmpty()) {
            return "_" + result;
        }
        if (Character.isDigit(result.charAt(0))) {
            result = "_" + result;
        }
        return escapeKeyword(result);
    }

    /**
     * Quotes a value as a double-quoted Python string literal. Control
     * characters other than newline, carriage return and tab become {@code \xNN}.
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
