package org.depscope.source;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Memoizes another {@link RegistryClient}, "unknown" results included. Create one per command
 * invocation and let it go afterwards; it holds no state beyond that.
 */
public final class CachingRegistryClient implements RegistryClient {

    private final RegistryClient delegate;
    private final Map<String, Optional<Set<String>>> cache = new HashMap<>();

    public CachingRegistryClient(RegistryClient delegate) {
        this.delegate = delegate;
    }

    @Override
    public Optional<Set<String>> fetchDependencies(String packageName) {
        return cache.computeIfAbsent(packageName,
                name -> delegate.fetchDependencies(name).map(Set::copyOf));
    }

    public int cachedCount() {
        return cache.size();
    }
}
