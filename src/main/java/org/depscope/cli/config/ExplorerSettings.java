package org.depscope.cli.config;

import com.typesafe.config.Config;

import java.time.Duration;

/**
 * Typed view of the {@code depscope} configuration block.
 *
 * @param maxDepth         Default tree depth limit; positive.
 * @param filter           Default exclusion substring; empty disables filtering.
 * @param manifestFileName Manifest file looked up in a repository.
 * @param testGraphFile    Edge-list file used in test mode when no repository is given.
 * @param registryBaseUrl  Crates endpoint of the registry API.
 * @param registryTimeout  Connect and request timeout for registry and manifest fetches.
 * @param userAgent        {@code User-Agent} header sent with every request.
 */
public record ExplorerSettings(
        int maxDepth,
        String filter,
        String manifestFileName,
        String testGraphFile,
        String registryBaseUrl,
        Duration registryTimeout,
        String userAgent
) {

    static final String ROOT = "depscope";

    public ExplorerSettings {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("max-depth must be a positive integer, was " + maxDepth);
        }
        filter = filter == null ? "" : filter;
    }

    /**
     * @throws com.typesafe.config.ConfigException If a key is missing or has the wrong type.
     * @throws IllegalArgumentException            If the configured depth is not positive.
     */
    public static ExplorerSettings from(final Config config) {
        Config c = config.getConfig(ROOT);
        return new ExplorerSettings(
                c.getInt("max-depth"),
                c.getString("filter"),
                c.getString("manifest-file-name"),
                c.getString("test-graph-file"),
                c.getString("registry.base-url"),
                c.getDuration("registry.timeout"),
                c.getString("registry.user-agent"));
    }

    /**
     * Applies command-line values on top of the configured ones.
     *
     * @param maxDepthOverride Depth from the command line, or {@code null}.
     * @param filterOverride   Filter from the command line, or {@code null}.
     */
    public ExplorerSettings withOverrides(final Integer maxDepthOverride, final String filterOverride) {
        return new ExplorerSettings(
                maxDepthOverride != null ? maxDepthOverride : maxDepth,
                filterOverride != null ? filterOverride : filter,
                manifestFileName,
                testGraphFile,
                registryBaseUrl,
                registryTimeout,
                userAgent);
    }
}
