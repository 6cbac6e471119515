package com.phillippitts.speakruntime.service.resource;

import com.phillippitts.speakruntime.exception.CircularDependencyException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed dependency edges between registered resource ids.
 *
 * <p>Each node maps to the ids it depends on, in declaration order. The graph is kept acyclic by
 * {@link #add(String, Set)}. Not thread-safe; the registry guards it with its lock.
 */
final class DependencyGraph {

    private final Map<String, Set<String>> dependencies = new LinkedHashMap<>();

    /**
     * Adds a node with its dependency edges.
     *
     * @throws CircularDependencyException if any dependency can already reach {@code id};
     *         the graph is left unchanged
     */
    void add(String id, Set<String> dependsOn) {
        for (String dependency : dependsOn) {
            if (reaches(dependency, id)) {
                throw new CircularDependencyException(id, dependency);
            }
        }
        dependencies.put(id, Collections.unmodifiableSet(new LinkedHashSet<>(dependsOn)));
    }

    /**
     * Adds an edge without the cycle check. Only used to simulate corrupted dependency data.
     */
    void addEdgeUnchecked(String from, String to) {
        Set<String> current = new LinkedHashSet<>(dependencies.getOrDefault(from, Set.of()));
        current.add(to);
        dependencies.put(from, Collections.unmodifiableSet(current));
    }

    /**
     * Removes a node, its outgoing edges and any edges pointing at it.
     */
    void remove(String id) {
        dependencies.remove(id);
        for (Map.Entry<String, Set<String>> e : dependencies.entrySet()) {
            if (e.getValue().contains(id)) {
                Set<String> pruned = new LinkedHashSet<>(e.getValue());
                pruned.remove(id);
                e.setValue(Collections.unmodifiableSet(pruned));
            }
        }
    }

    boolean contains(String id) {
        return dependencies.containsKey(id);
    }

    Set<String> dependenciesOf(String id) {
        return dependencies.getOrDefault(id, Set.of());
    }

    /**
     * @return ids that directly depend on {@code id}, in registration order
     */
    List<String> dependentsOf(String id) {
        List<String> result = new ArrayList<>();
        for (Map.Entry<String, Set<String>> e : dependencies.entrySet()) {
            if (e.getValue().contains(id)) {
                result.add(e.getKey());
            }
        }
        return result;
    }

    boolean hasEdge(String from, String to) {
        return dependenciesOf(from).contains(to);
    }

    int size() {
        return dependencies.size();
    }

    // Iterative DFS over dependency edges
    private boolean reaches(String from, String target) {
        Deque<String> stack = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        stack.push(from);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (current.equals(target)) {
                return true;
            }
            if (!visited.add(current)) {
                continue;
            }
            for (String next : dependenciesOf(current)) {
                stack.push(next);
            }
        }
        return false;
    }
}
