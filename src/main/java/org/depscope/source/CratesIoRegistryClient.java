package org.depscope.source;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * {@link RegistryClient} for the crates.io web API.
 *
 * <p>Two requests per package: the crate record (to pick the newest stable version) and that
 * version's dependency list. Only {@code kind == "normal"} dependencies are returned; dev and
 * build dependencies of published crates are not part of the loading graph.</p>
 */
public final class CratesIoRegistryClient implements RegistryClient {

    private static final Logger log = LoggerFactory.getLogger(CratesIoRegistryClient.class);

    private final TextFetcher fetcher;
    private final String baseUrl;

    /**
     * @param fetcher HTTP access.
     * @param baseUrl The crates endpoint, e.g. {@code https://crates.io/api/v1/crates}.
     */
    public CratesIoRegistryClient(TextFetcher fetcher, String baseUrl) {
        this.fetcher = fetcher;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public Optional<Set<String>> fetchDependencies(String packageName) {
        String crate = URLEncoder.encode(packageName, StandardCharsets.UTF_8);
        try {
            String version = latestVersion(fetcher.fetch(baseUrl + "/" + crate));
            String versionPath = URLEncoder.encode(version, StandardCharsets.UTF_8);
            Set<String> deps = normalDependencies(
                    fetcher.fetch(baseUrl + "/" + crate + "/" + versionPath + "/dependencies"));
            log.debug("{} {} has {} normal dependencies", packageName, version, deps.size());
            return Optional.of(deps);
        } catch (IOException | JsonParseException | IllegalStateException
                 | ClassCastException | UnsupportedOperationException e) {
            log.warn("Dependencies of '{}' are unknown, treating it as a leaf: {}", packageName, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Reads {@code crate.max_stable_version}, falling back to {@code crate.max_version}.
     *
     * @throws IOException If neither is present.
     */
    static String latestVersion(String crateJson) throws IOException {
        JsonObject crate = JsonParser.parseString(crateJson).getAsJsonObject().getAsJsonObject("crate");
        if (crate == null) {
            throw new IOException("Response has no 'crate' object");
        }
        for (String field : new String[] {"max_stable_version", "max_version"}) {
            JsonElement value = crate.get(field);
            if (value != null && !value.isJsonNull() && !value.getAsString().isEmpty()) {
                return value.getAsString();
            }
        }
        throw new IOException("Crate record carries no version");
    }

    /**
     * Collects {@code crate_id} of every {@code kind == "normal"} entry.
     *
     * @throws IOException If the response has no dependency array.
     */
    static Set<String> normalDependencies(String dependenciesJson) throws IOException {
        JsonArray entries = JsonParser.parseString(dependenciesJson).getAsJsonObject().getAsJsonArray("dependencies");
        if (entries == null) {
            throw new IOException("Response has no 'dependencies' array");
        }
        Set<String> names = new LinkedHashSet<>();
        for (JsonElement element : entries) {
            JsonObject entry = element.getAsJsonObject();
            JsonElement kind = entry.get("kind");
            JsonElement crateId = entry.get("crate_id");
            if (kind != null && "normal".equals(kind.getAsString()) && crateId != null) {
                names.add(crateId.getAsString());
            }
        }
        return names;
    }
}
