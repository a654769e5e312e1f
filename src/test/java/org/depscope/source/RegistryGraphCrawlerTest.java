package org.depscope.source;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.depscope.graph.GraphStore;
import org.depscope.graph.NameFilter;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class RegistryGraphCrawlerTest {

    /** Answers from a fixed table and remembers what was asked. */
    private static final class TableRegistry implements RegistryClient {
        private final Map<String, Set<String>> table;
        final List<String> lookups = new ArrayList<>();

        TableRegistry(Map<String, Set<String>> table) {
            this.table = table;
        }

        @Override
        public Optional<Set<String>> fetchDependencies(String packageName) {
            lookups.add(packageName);
            return Optional.ofNullable(table.get(packageName));
        }
    }

    private static TableRegistry serdeRegistry() {
        return new TableRegistry(Map.of(
                "serde", Set.of("serde_derive"),
                "serde_derive", Set.of("proc-macro2", "quote", "syn"),
                "syn", Set.of("unicode-ident"),
                "quote", Set.of("proc-macro2"),
                "proc-macro2", Set.of("unicode-ident"),
                "unicode-ident", Set.of()));
    }

    @Test
    void expandsBreadthFirstUpToMaxDepth() {
        TableRegistry registry = serdeRegistry();

        GraphStore graph = new RegistryGraphCrawler(registry)
                .crawl("demo", List.of("serde", "anyhow"), 3, NameFilter.NONE);

        assertThat(graph.nodes()).containsExactlyInAnyOrder(
                "demo", "anyhow", "serde", "serde_derive", "proc-macro2", "quote", "syn");
        assertThat(graph.dependenciesOf("demo")).containsExactlyInAnyOrder("anyhow", "serde");
        assertThat(graph.dependenciesOf("serde_derive")).containsExactlyInAnyOrder("proc-macro2", "quote", "syn");
        assertThat(graph.dependenciesOf("syn")).isEmpty();
        assertThat(registry.lookups).containsExactly("anyhow", "serde", "serde_derive");
    }

    @Test
    void depthOneOnlyUsesRootDependencies() {
        TableRegistry registry = serdeRegistry();

        GraphStore graph = new RegistryGraphCrawler(registry).crawl("demo", List.of("serde"), 1, NameFilter.NONE);

        assertThat(graph.nodes()).containsExactlyInAnyOrder("demo", "serde");
        assertThat(registry.lookups).isEmpty();
    }

    @Test
    void excludedNamesAreNeitherAddedNorLookedUp() {
        TableRegistry registry = serdeRegistry();

        GraphStore graph = new RegistryGraphCrawler(registry)
                .crawl("demo", List.of("serde"), 5, NameFilter.of("macro"));

        assertThat(graph.nodes()).doesNotContain("proc-macro2");
        assertThat(graph.nodes()).contains("quote", "syn", "unicode-ident");
        assertThat(registry.lookups).doesNotContain("proc-macro2");
    }

    @Test
    void registryCycleTerminates() {
        TableRegistry registry = new TableRegistry(Map.of(
                "a", Set.of("b"),
                "b", Set.of("a")));

        GraphStore graph = new RegistryGraphCrawler(registry).crawl("root", List.of("a"), 50, NameFilter.NONE);

        assertThat(graph.dependenciesOf("b")).containsExactly("a");
        assertThat(registry.lookups).containsExactly("a", "b");
    }

    @Test
    void rootWithoutDependenciesIsASingleNode() {
        GraphStore graph = new RegistryGraphCrawler(serdeRegistry()).crawl("demo", List.of(), 3, NameFilter.NONE);

        assertThat(graph.size()).isEqualTo(1);
        assertThat(graph.contains("demo")).isTrue();
    }
}
