package com.schemagen.generator.codegen.exception;

import java.util.List;
import java.util.stream.Collectors;

import com.schemagen.generator.codegen.model.NameCollision;

/**
 * Raised when two or more declarations map to the same target identifier
 * within one namespace.
 */
public class NameCollisionException extends CodegenException {

    private static final long serialVersionUID = 1L;

    private final transient List<NameCollision> collisions;

    public NameCollisionException(List<NameCollision> collisions) {
        super(collisions.stream().map(NameCollision::describe).collect(Collectors.joining("\n\n")));
        this.collisions = List.copyOf(collisions);
    }

    public List<NameCollision> getCollisions() {
        return collisions;
    }
}
