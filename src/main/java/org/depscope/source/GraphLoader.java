package org.depscope.source;

import org.depscope.graph.GraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Builds a {@link GraphStore} from the line-based edge-list format:
 * <pre>
 *   # comment
 *   serde: serde_derive itoa
 *   serde_derive: proc-macro2 quote syn
 * </pre>
 *
 * <p>Parsing is permissive. Blank lines, comment lines and lines without a colon are skipped.
 * Names and tokens are taken verbatim. Every dependency token becomes a node even if it never
 * appears on the left-hand side.</p>
 */
public final class GraphLoader {

    private static final Logger log = LoggerFactory.getLogger(GraphLoader.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private GraphLoader() {}

    /**
     * Parses edge-list text. Never fails; malformed lines are skipped.
     *
     * @param content The edge-list text.
     * @return A new graph.
     */
    public static GraphStore parse(String content) {
        GraphStore graph = new GraphStore();
        String[] lines = content.split("\\r?\\n");
        int skipped = 0;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty() || line.startsWith("#")) continue;

            int colon = line.indexOf(':');
            if (colon < 0) {
                log.debug("Skipping line {} without ':' separator: {}", i + 1, line);
                skipped++;
                continue;
            }
            String name = line.substring(0, colon).trim();
            if (name.isEmpty()) {
                log.debug("Skipping line {} with empty package name", i + 1);
                skipped++;
                continue;
            }

            graph.ensureNode(name);
            String rest = line.substring(colon + 1).trim();
            if (rest.isEmpty()) continue;
            for (String token : WHITESPACE.split(rest)) {
                graph.addEdge(name, token);
            }
        }
        log.debug("Parsed edge list: {} ({} malformed lines skipped)", graph, skipped);
        return graph;
    }

    /**
     * Loads an edge-list file.
     *
     * @param path The file to read.
     * @return A new graph.
     * @throws IOException If the file cannot be read.
     */
    public static GraphStore load(Path path) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        log.info("Loaded edge list from {}", path.toAbsolutePath());
        return parse(content);
    }
}
