package com.schemagen.generator.codegen.naming;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemagen.generator.codegen.exception.NameCollisionException;
import com.schemagen.generator.codegen.model.Mapping;
import com.schemagen.generator.codegen.model.NameCollision;

/**
 * Verifies that target identifiers are unique within each namespace.
 *
 * Names are assigned upstream; this class only checks them.
 */
public class NameResolver {
    private static final Logger log = LoggerFactory.getLogger(NameResolver.class);

    /**
     * Fails if two or more mappings share a namespace and target identifier.
     *
     * @throws NameCollisionException listing every collision group found
     */
    public void checkUnique(List<Mapping> mappings) throws NameCollisionException {
        List<NameCollision> collisions = findCollisions(mappings);
        if (!collisions.isEmpty()) {
            log.error("Found {} name collision(s)", collisions.size());
            throw new NameCollisionException(collisions);
        }
        log.debug("Checked {} mappings for name collisions", mappings.size());
    }

    /**
     * Fails if a target identifier is also a name the generated document binds
     * itself, such as an imported namespace alias or a name from the fixed preamble.
     *
     * @param boundNames name bound by the document mapped to the statement binding it
     * @throws NameCollisionException listing every shadowing declaration
     */
    public void checkNotBound(List<Mapping> mappings, Map<String, String> boundNames)
            throws NameCollisionException {
        List<NameCollision> collisions = findBoundCollisions(mappings, boundNames);
        if (!collisions.isEmpty()) {
            log.error("Found {} declaration(s) shadowing generated bindings", collisions.size());
            throw new NameCollisionException(collisions);
        }
    }

    public List<NameCollision> findBoundCollisions(List<Mapping> mappings, Map<String, String> boundNames) {
        List<NameCollision> collisions = new ArrayList<>();
        for (Mapping mapping : mappings) {
            String statement = boundNames.get(mapping.getTargetName());
            if (statement != null) {
                collisions.add(NameCollision.builder()
                        .namespace(mapping.getNamespace())
                        .targetName(mapping.getTargetName())
                        .declaration(mapping.getDeclaration())
                        .boundBy(statement)
                        .build());
            }
        }
        return collisions;
    }

    /**
     * Groups mappings by (namespace, target identifier) and returns every group
     * with more than one member, in order of first occurrence.
     */
    public List<NameCollision> findCollisions(List<Mapping> mappings) {
        Map<List<String>, List<Mapping>> groups = new LinkedHashMap<>();
        for (Mapping mapping : mappings) {
            groups.computeIfAbsent(List.of(mapping.getNamespace(), mapping.getTargetName()),
                    k -> new ArrayList<>()).add(mapping);
        }

        List<NameCollision> collisions = new ArrayList<>();
        for (List<Mapping> group : groups.values()) {
            if (group.size() < 2) {
                continue;
            }
            NameCollision.NameCollisionBuilder collision = NameCollision.builder()
                    .namespace(group.get(0).getNamespace())
                    .targetName(group.get(0).getTargetName());
            group.forEach(m -> collision.declaration(m.getDeclaration()));
            collisions.add(collision.build());
        }
        return collisions;
    }
}
