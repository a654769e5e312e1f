package org.depscope.cli;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.SortedSet;

import org.depscope.cli.config.ExplorerSettings;
import org.depscope.graph.GraphStore;
import org.depscope.graph.NameFilter;
import org.depscope.source.CachingRegistryClient;
import org.depscope.source.CratesIoRegistryClient;
import org.depscope.source.GraphLoader;
import org.depscope.source.GraphSourceException;
import org.depscope.source.ManifestLocator;
import org.depscope.source.ManifestParser;
import org.depscope.source.RegistryGraphCrawler;
import org.depscope.source.TextFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the graph a command works on, either from an edge-list file (test mode) or from a
 * manifest plus registry lookups.
 */
public final class GraphSources {

    private static final Logger log = LoggerFactory.getLogger(GraphSources.class);

    private final TextFetcher fetcher;

    public GraphSources(TextFetcher fetcher) {
        this.fetcher = fetcher;
    }

    public GraphStore load(GraphOptions options, ExplorerSettings settings) throws GraphSourceException {
        if (options.testMode) {
            return loadEdgeList(options.repository != null ? options.repository : settings.testGraphFile());
        }
        return crawlRegistry(options.packageName, options.repository, settings);
    }

    private GraphStore loadEdgeList(String file) throws GraphSourceException {
        Path path = Path.of(file);
        try {
            return GraphLoader.load(path);
        } catch (NoSuchFileException e) {
            throw new GraphSourceException("Graph file not found: " + path.toAbsolutePath(), e);
        } catch (IOException e) {
            throw new GraphSourceException("Could not read graph file " + path.toAbsolutePath() + ": " + e.getMessage(), e);
        }
    }

    private GraphStore crawlRegistry(String root, String repository, ExplorerSettings settings)
            throws GraphSourceException {
        String manifest = new ManifestLocator(fetcher, settings.manifestFileName()).read(repository);

        ManifestParser parser = new ManifestParser();
        SortedSet<String> rootDependencies;
        try {
            rootDependencies = parser.dependencyNames(manifest);
            Optional<String> declared = parser.packageName(manifest);
            if (declared.isPresent() && !declared.get().equals(root)) {
                log.warn("Manifest declares package '{}', analysing it as '{}'", declared.get(), root);
            }
        } catch (IOException e) {
            throw new GraphSourceException("Could not parse manifest: " + e.getMessage(), e);
        }
        log.info("Manifest lists {} direct dependencies of '{}'", rootDependencies.size(), root);

        CachingRegistryClient registry = new CachingRegistryClient(
                new CratesIoRegistryClient(fetcher, settings.registryBaseUrl()));
        GraphStore graph = new RegistryGraphCrawler(registry)
                .crawl(root, rootDependencies, settings.maxDepth(), NameFilter.of(settings.filter()));
        log.debug("Registry answers cached for {} packages", registry.cachedCount());
        return graph;
    }
}
