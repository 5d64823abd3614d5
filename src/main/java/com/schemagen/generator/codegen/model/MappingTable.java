package com.schemagen.generator.codegen.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only table of mappings for one generation run, looked up by the
 * qualified source name of the mapped declaration.
 */
public final class MappingTable {

    private final List<Mapping> mappings;
    private final Map<String, Mapping> byQualifiedName = new LinkedHashMap<>();

    private MappingTable(List<Mapping> mappings) {
        this.mappings = List.copyOf(mappings);
        for (Mapping mapping : this.mappings) {
            byQualifiedName.putIfAbsent(mapping.getDeclaration().getQualifiedName(), mapping);
        }
    }

    public static MappingTable of(List<Mapping> mappings) {
        return new MappingTable(mappings);
    }

    public List<Mapping> getMappings() {
        return mappings;
    }

    public Optional<Mapping> find(String qualifiedName) {
        return Optional.ofNullable(byQualifiedName.get(qualifiedName));
    }

    /**
     * Mappings whose target namespace is {@code namespace}, in table order.
     */
    public List<Mapping> forNamespace(String namespace) {
        return mappings.stream()
                .filter(m -> m.getNamespace().equals(namespace))
                .collect(Collectors.toList());
    }
}
