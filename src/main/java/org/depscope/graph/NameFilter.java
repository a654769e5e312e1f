package org.depscope.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Case-sensitive substring exclusion rule. A package whose name contains the substring is
 * treated as if it, and every edge into it, did not exist.
 *
 * @param substring The excluded substring; empty disables filtering.
 */
public record NameFilter(String substring) {

    /** A filter that excludes nothing. */
    public static final NameFilter NONE = new NameFilter("");

    public NameFilter {
        substring = substring == null ? "" : substring;
    }

    public static NameFilter of(String substring) {
        return substring == null || substring.isEmpty() ? NONE : new NameFilter(substring);
    }

    public boolean isActive() {
        return !substring.isEmpty();
    }

    public boolean excludes(String name) {
        return isActive() && name.contains(substring);
    }

    /**
     * Drops excluded names and sorts the rest in ascending natural order.
     *
     * @param names The candidate names.
     * @return A new, mutable, sorted list.
     */
    public List<String> retainSorted(Collection<String> names) {
        List<String> kept = new ArrayList<>(names.size());
        for (String name : names) {
            if (!excludes(name)) {
                kept.add(name);
            }
        }
        kept.sort(null);
        return kept;
    }
}
