package org.depscope.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Result of a loading-order computation.
 *
 * @param order  Package names with every dependency before its dependents (cycles excepted).
 * @param cycles Names at which a still-active ancestor was met again. This marks where each
 *               cycle was broken, not every member of it.
 */
public record LoadOrder(List<String> order, Set<String> cycles) {

    public LoadOrder {
        order = List.copyOf(order);
        cycles = Collections.unmodifiableSet(new LinkedHashSet<>(cycles));
    }

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }

    /**
     * @return The cycle names that also appear in {@link #order()}, sorted ascending.
     */
    public List<String> reportedCycles() {
        List<String> reported = new ArrayList<>();
        for (String name : order) {
            if (cycles.contains(name)) {
                reported.add(name);
            }
        }
        reported.sort(null);
        return reported;
    }
}
