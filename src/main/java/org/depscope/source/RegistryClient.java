package org.depscope.source;

import java.util.Optional;
import java.util.Set;

/**
 * Looks up the direct dependencies of a published package.
 */
public interface RegistryClient {

    /**
     * @param packageName The package to look up.
     * @return The names of its direct normal dependencies, or {@link Optional#empty()} when they
     *         are unknown (unknown package, network or parse failure). Never throws for those.
     */
    Optional<Set<String>> fetchDependencies(String packageName);
}
