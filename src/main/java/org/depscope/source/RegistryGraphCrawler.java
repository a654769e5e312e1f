package org.depscope.source;

import org.depscope.graph.GraphStore;
import org.depscope.graph.NameFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.HashSet;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;

/**
 * Builds the dependency graph of a root package from its manifest dependencies plus registry
 * lookups for everything below them.
 *
 * <p>The crawl is breadth-first and stops expanding at {@code maxDepth} (root is depth 0), so
 * packages at the depth limit stay leaves. Excluded names are neither added nor looked up. A
 * package whose dependencies are unknown becomes a leaf.</p>
 */
public final class RegistryGraphCrawler {

    private static final Logger log = LoggerFactory.getLogger(RegistryGraphCrawler.class);

    private final RegistryClient registry;

    public RegistryGraphCrawler(RegistryClient registry) {
        this.registry = registry;
    }

    /**
     * @param root             The root package; it is not looked up in the registry.
     * @param rootDependencies Direct dependencies of the root, e.g. from its manifest.
     * @param maxDepth         Deepest level that still gets expanded is {@code maxDepth - 1}.
     * @param filter           Exclusion rule.
     * @return The crawled graph. Always contains {@code root}.
     */
    public GraphStore crawl(String root, Collection<String> rootDependencies, int maxDepth, NameFilter filter) {
        GraphStore graph = new GraphStore();
        graph.ensureNode(root);

        Set<String> expanded = new HashSet<>();
        expanded.add(root);
        Queue<Pending> queue = new ArrayDeque<>();
        for (String dep : filter.retainSorted(rootDependencies)) {
            graph.addEdge(root, dep);
            queue.add(new Pending(dep, 1));
        }

        int lookups = 0;
        int unknown = 0;
        while (!queue.isEmpty()) {
            Pending next = queue.poll();
            if (next.depth() >= maxDepth || !expanded.add(next.name())) {
                continue;
            }
            lookups++;
            Optional<Set<String>> deps = registry.fetchDependencies(next.name());
            if (deps.isEmpty()) {
                unknown++;
                continue;
            }
            for (String dep : filter.retainSorted(deps.get())) {
                graph.addEdge(next.name(), dep);
                queue.add(new Pending(dep, next.depth() + 1));
            }
        }
        log.info("Crawled {} from '{}' ({} registry lookups, {} unknown)", graph, root, lookups, unknown);
        return graph;
    }

    private record Pending(String name, int depth) {}
}
