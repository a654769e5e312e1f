package org.depscope.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Extracts dependency names from a Cargo manifest ({@code Cargo.toml}).
 *
 * <p>Keys of every dependency table are collected; version specifiers, whether plain strings
 * or inline tables, are discarded.</p>
 */
public final class ManifestParser {

    /** Dotted paths of the tables whose keys are dependency names. */
    static final List<List<String>> DEPENDENCY_SECTIONS = List.of(
            List.of("dependencies"),
            List.of("dev-dependencies"),
            List.of("build-dependencies"),
            List.of("workspace", "dependencies"),
            List.of("workspace", "dev-dependencies"));

    private final TomlMapper mapper = new TomlMapper();

    /**
     * @param manifestText The manifest text.
     * @return The sorted union of dependency names across all dependency tables.
     * @throws IOException If the text is not valid TOML.
     */
    public SortedSet<String> dependencyNames(String manifestText) throws IOException {
        JsonNode root = mapper.readTree(manifestText);
        SortedSet<String> names = new TreeSet<>();
        for (List<String> section : DEPENDENCY_SECTIONS) {
            JsonNode table = at(root, section);
            if (table == null || !table.isObject()) continue;
            Iterator<String> keys = table.fieldNames();
            while (keys.hasNext()) {
                names.add(keys.next());
            }
        }
        return names;
    }

    /**
     * @param manifestText The manifest text.
     * @return The {@code [package].name} value, if present.
     * @throws IOException If the text is not valid TOML.
     */
    public Optional<String> packageName(String manifestText) throws IOException {
        JsonNode name = at(mapper.readTree(manifestText), List.of("package", "name"));
        return name != null && name.isTextual() ? Optional.of(name.asText()) : Optional.empty();
    }

    private static JsonNode at(JsonNode root, List<String> path) {
        JsonNode current = root;
        for (String segment : path) {
            if (current == null) return null;
            current = current.get(segment);
        }
        return current;
    }
}
