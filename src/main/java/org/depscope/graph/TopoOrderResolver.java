package org.depscope.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes the loading order of everything reachable from a start package: a depth-first
 * post-order in which every dependency precedes the packages depending on it.
 *
 * <p>Dependencies are visited in ascending name order, which makes the result deterministic.
 * Reaching a package that is still on the active chain records it as a cycle point and stops
 * that branch; the cycle is broken at its first repetition. Packages already completed are not
 * revisited, so shared sub-dependencies appear once.</p>
 *
 * <p>The depth-first walk keeps its own frame stack instead of recursing, so long dependency
 * chains do not exhaust the thread stack.</p>
 */
public final class TopoOrderResolver {

    /**
     * Computes the loading order starting at {@code start}.
     *
     * @param graph  The graph to walk. Only read.
     * @param start  The start package. If the filter excludes it, the result is empty.
     * @param filter Exclusion rule; excluded packages and edges into them are ignored.
     * @return The order and the detected cycle points.
     */
    public LoadOrder computeLoadOrder(GraphStore graph, String start, NameFilter filter) {
        Walk walk = new Walk(graph, filter);
        if (!filter.excludes(start)) {
            walk.run(start);
        }
        return new LoadOrder(walk.order, walk.cycles);
    }

    private static final class Walk {

        private final GraphStore graph;
        private final NameFilter filter;

        private final Set<String> visited = new HashSet<>();
        private final Set<String> onStack = new HashSet<>();
        private final Set<String> cycles = new LinkedHashSet<>();
        private final List<String> order = new ArrayList<>();
        private final Deque<Frame> frames = new ArrayDeque<>();

        Walk(GraphStore graph, NameFilter filter) {
            this.graph = graph;
            this.filter = filter;
        }

        void run(String start) {
            enter(start);
            while (!frames.isEmpty()) {
                Frame top = frames.peek();
                if (top.pending.hasNext()) {
                    enter(top.pending.next());
                } else {
                    frames.pop();
                    onStack.remove(top.name);
                    visited.add(top.name);
                    order.add(top.name);
                }
            }
        }

        private void enter(String name) {
            if (onStack.contains(name)) {
                cycles.add(name);
                return;
            }
            if (visited.contains(name)) {
                return;
            }
            onStack.add(name);
            // Children are already filtered here, so no frame is ever opened for an excluded name.
            frames.push(new Frame(name, filter.retainSorted(graph.dependenciesOf(name)).iterator()));
        }
    }

    private static final class Frame {
        final String name;
        final Iterator<String> pending;

        Frame(String name, Iterator<String> pending) {
            this.name = name;
            this.pending = pending;
        }
    }
}
