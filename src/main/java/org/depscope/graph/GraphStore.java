package org.depscope.graph;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * In-memory adjacency model of a dependency graph: package name to the set of its direct
 * dependency names.
 *
 * <p>Every name that appears as a dependency is also present as a key (with an empty set
 * if nothing else is known about it), so traversal code never has to handle an unknown node.
 * Keys carry no ordering guarantee; callers that need a deterministic order sort explicitly.</p>
 *
 * <p>The store is populated once by a loader and only read afterwards. It is not thread-safe.</p>
 */
public final class GraphStore {

    private final Map<String, Set<String>> adjacency = new HashMap<>();

    /**
     * Guarantees that {@code name} is a key, with an empty dependency set if it was absent.
     *
     * @param name The package name.
     * @throws IllegalArgumentException If the name is null or empty.
     */
    public void ensureNode(String name) {
        requireName(name);
        adjacency.computeIfAbsent(name, k -> new LinkedHashSet<>());
    }

    /**
     * Records that {@code from} directly depends on {@code to}. Both become keys.
     *
     * @param from The dependent package.
     * @param to   The dependency.
     * @throws IllegalArgumentException If either name is null or empty.
     */
    public void addEdge(String from, String to) {
        ensureNode(from);
        ensureNode(to);
        adjacency.get(from).add(to);
    }

    /**
     * Returns the direct dependencies of a package as a read-only view.
     *
     * @param name The package name.
     * @return The dependency set, or an empty set if the package is absent.
     */
    public Set<String> dependenciesOf(String name) {
        Set<String> deps = adjacency.get(name);
        return deps == null ? Set.of() : Collections.unmodifiableSet(deps);
    }

    public boolean contains(String name) {
        return adjacency.containsKey(name);
    }

    /**
     * @return A read-only view of all package names.
     */
    public Set<String> nodes() {
        return Collections.unmodifiableSet(adjacency.keySet());
    }

    public int size() {
        return adjacency.size();
    }

    public int edgeCount() {
        int count = 0;
        for (Set<String> deps : adjacency.values()) {
            count += deps.size();
        }
        return count;
    }

    private static void requireName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Package name must not be null or empty");
        }
    }

    @Override
    public String toString() {
        return "GraphStore{nodes=" + size() + ", edges=" + edgeCount() + "}";
    }
}
