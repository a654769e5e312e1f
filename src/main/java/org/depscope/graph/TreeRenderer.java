package org.depscope.graph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Renders the dependency tree below a root package as box-drawing text lines.
 *
 * <p>The walk is depth-first and bounded by {@code maxDepth}. A package that already appears
 * on its own ancestor chain is printed once more with a {@value #CYCLIC_MARKER} suffix and is not
 * expanded. The ancestor chain is copied per child, so sibling subtrees never see each other's
 * packages as ancestors. Shared dependencies reached through different branches are printed in
 * full under each branch.</p>
 *
 * <p>Children are sorted ascending, so the output depends only on the graph, the root, the depth
 * limit and the filter.</p>
 */
public final class TreeRenderer {

    public static final String CYCLIC_MARKER = " (cyclic)";

    static final String BRANCH = "├── ";
    static final String LAST_BRANCH = "└── ";
    static final String CONTINUATION = "│   ";
    static final String BLANK = "    ";

    /**
     * Renders the tree.
     *
     * @param graph    The graph to walk. Only read.
     * @param root     The root package. It is never filtered.
     * @param maxDepth The deepest level whose children are still listed relative to the root
     *                 (root is level 0). Must be positive.
     * @param filter   Exclusion rule applied to every non-root package.
     * @return One line per emitted package, or an empty list if the root is not in the graph.
     * @throws IllegalArgumentException If {@code maxDepth} is not positive.
     */
    public List<String> render(GraphStore graph, String root, int maxDepth, NameFilter filter) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, was " + maxDepth);
        }
        List<String> lines = new ArrayList<>();
        if (!graph.contains(root)) {
            return lines;
        }
        visit(graph, root, 0, maxDepth, filter, Set.of(), "", "", lines);
        return lines;
    }

    private void visit(GraphStore graph,
                       String node,
                       int depth,
                       int maxDepth,
                       NameFilter filter,
                       Set<String> ancestors,
                       String linePrefix,
                       String childPrefix,
                       List<String> lines) {
        if (ancestors.contains(node)) {
            lines.add(linePrefix + node + CYCLIC_MARKER);
            return;
        }
        lines.add(linePrefix + node);
        if (depth >= maxDepth) {
            return;
        }

        List<String> children = filter.retainSorted(graph.dependenciesOf(node));
        for (int i = 0; i < children.size(); i++) {
            boolean last = i == children.size() - 1;
            Set<String> branchAncestors = new LinkedHashSet<>(ancestors);
            branchAncestors.add(node);
            visit(graph,
                    children.get(i),
                    depth + 1,
                    maxDepth,
                    filter,
                    branchAncestors,
                    childPrefix + (last ? LAST_BRANCH : BRANCH),
                    childPrefix + (last ? BLANK : CONTINUATION),
                    lines);
        }
    }
}
