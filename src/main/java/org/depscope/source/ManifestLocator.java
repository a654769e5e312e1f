package org.depscope.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds and reads the manifest named by a repository argument: a local directory or file,
 * a direct manifest URL, or a GitHub repository URL.
 */
public final class ManifestLocator {

    private static final Logger log = LoggerFactory.getLogger(ManifestLocator.class);

    private static final Pattern GITHUB_REPO = Pattern.compile(
            "^https?://github\\.com/([^/]+)/([^/?#]+?)(?:\\.git)?(?:[/?#].*)?$");
    private static final String RAW_GITHUB = "https://raw.githubusercontent.com/%s/%s/HEAD/%s";

    private final TextFetcher fetcher;
    private final String manifestFileName;

    public ManifestLocator(TextFetcher fetcher, String manifestFileName) {
        this.fetcher = fetcher;
        this.manifestFileName = manifestFileName;
    }

    /**
     * Reads the manifest text for a repository argument.
     *
     * @param repository Local path or http(s) URL.
     * @return The manifest text.
     * @throws GraphSourceException If the manifest cannot be located or read.
     */
    public String read(String repository) throws GraphSourceException {
        if (repository == null || repository.isBlank()) {
            throw new GraphSourceException("No repository given");
        }
        if (TextFetcher.isHttpUrl(repository)) {
            String url = manifestUrl(repository);
            log.info("Fetching manifest from {}", url);
            try {
                return fetcher.fetch(url);
            } catch (IOException e) {
                throw new GraphSourceException("Could not fetch manifest from " + url + ": " + e.getMessage(), e);
            }
        }

        Path path = Path.of(repository);
        Path manifest = Files.isDirectory(path) ? path.resolve(manifestFileName) : path;
        if (!Files.isRegularFile(manifest)) {
            throw new GraphSourceException("Manifest not found: " + manifest.toAbsolutePath());
        }
        log.info("Reading manifest from {}", manifest.toAbsolutePath());
        try {
            return Files.readString(manifest, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new GraphSourceException("Could not read manifest " + manifest.toAbsolutePath() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Maps a repository URL to the URL of its manifest.
     */
    String manifestUrl(String repositoryUrl) {
        if (repositoryUrl.endsWith(".toml")) {
            return repositoryUrl;
        }
        Matcher github = GITHUB_REPO.matcher(repositoryUrl);
        if (github.matches()) {
            return String.format(RAW_GITHUB, github.group(1), github.group(2), manifestFileName);
        }
        String base = repositoryUrl.endsWith("/") ? repositoryUrl : repositoryUrl + "/";
        return base + manifestFileName;
    }
}
