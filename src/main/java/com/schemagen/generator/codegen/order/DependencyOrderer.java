package com.schemagen.generator.codegen.order;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemagen.generator.codegen.model.GeneratedMember;

/**
 * Computes the emission order of the members of one namespace.
 *
 * The order is a topological sort of a graph with an edge from every
 * superclass to each of its subclasses and an edge from every other class or
 * enum to the module root class. Among members that are ready at the same
 * time, type aliases come before classes and enums, then lower declaration
 * index first. As a result:
 * <ol>
 *   <li>all type aliases precede all classes and enums;</li>
 *   <li>a class follows its superclass when both are in the namespace;</li>
 *   <li>the module root class comes last;</li>
 *   <li>otherwise declaration order is kept.</li>
 * </ol>
 */
public class DependencyOrderer {
    private static final Logger log = LoggerFactory.getLogger(DependencyOrderer.class);

    private static final Comparator<GeneratedMember> TIE_BREAK = Comparator
            .comparingInt((GeneratedMember m) -> m.isTypeAlias() ? 0 : 1)
            .thenComparingInt(GeneratedMember::getDeclarationIndex)
            .thenComparing(GeneratedMember::getTargetName);

    /**
     * Returns {@code members} in emission order.
     *
     * @throws IllegalStateException if inheritance forms a cycle or more than one
     *                               member is flagged as module root
     */
    public List<GeneratedMember> order(List<GeneratedMember> members) {
        List<GeneratedMember> roots = members.stream()
                .filter(GeneratedMember::isModuleRootClass)
                .collect(Collectors.toList());
        if (roots.size() > 1) {
            throw new IllegalStateException("More than one module root class: "
                    + roots.stream().map(GeneratedMember::getTargetName).collect(Collectors.joining(", ")));
        }
        GeneratedMember root = roots.isEmpty() ? null : roots.get(0);

        Map<String, GeneratedMember> byName = new LinkedHashMap<>();
        for (GeneratedMember member : members) {
            byName.putIfAbsent(member.getTargetName(), member);
        }

        Map<GeneratedMember, List<GeneratedMember>> successors = new IdentityHashMap<>();
        Map<GeneratedMember, Integer> inDegree = new IdentityHashMap<>();
        for (GeneratedMember member : members) {
            successors.put(member, new ArrayList<>());
            inDegree.put(member, 0);
        }

        for (GeneratedMember member : members) {
            member.getSuperclassName()
                    .map(byName::get)
                    .filter(parent -> parent != member)
                    .ifPresent(parent -> addEdge(parent, member, successors, inDegree));

            if (root != null && member != root && !member.isTypeAlias()) {
                addEdge(member, root, successors, inDegree);
            }
        }

        PriorityQueue<GeneratedMember> ready = new PriorityQueue<>(TIE_BREAK);
        for (GeneratedMember member : members) {
            if (inDegree.get(member) == 0) {
                ready.add(member);
            }
        }

        List<GeneratedMember> ordered = new ArrayList<>(members.size());
        while (!ready.isEmpty()) {
            GeneratedMember next = ready.poll();
            ordered.add(next);
            for (GeneratedMember successor : successors.get(next)) {
                int remaining = inDegree.merge(successor, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(successor);
                }
            }
        }

        if (ordered.size() != members.size()) {
            String stuck = members.stream()
                    .filter(m -> inDegree.get(m) > 0)
                    .map(GeneratedMember::getTargetName)
                    .collect(Collectors.joining(", "));
            throw new IllegalStateException("Dependency cycle among generated members: " + stuck);
        }

        log.debug("Emission order: {}",
                ordered.stream().map(GeneratedMember::getTargetName).collect(Collectors.joining(", ")));
        return ordered;
    }

    private static void addEdge(GeneratedMember from, GeneratedMember to,
                                Map<GeneratedMember, List<GeneratedMember>> successors,
                                Map<GeneratedMember, Integer> inDegree) {
        successors.get(from).add(to);
        inDegree.merge(to, 1, Integer::sum);
    }
}
