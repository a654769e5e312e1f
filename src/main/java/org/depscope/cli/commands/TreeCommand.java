package org.depscope.cli.commands;

import java.util.List;

import org.depscope.cli.config.ExplorerSettings;
import org.depscope.graph.GraphStore;
import org.depscope.graph.NameFilter;
import org.depscope.graph.TreeRenderer;

import picocli.CommandLine.Command;

/**
 * CLI command that prints the dependency tree of a package.
 */
@Command(
    name = "tree",
    mixinStandardHelpOptions = true,
    description = "Print the dependency tree of a package, marking repeated ancestors as (cyclic)"
)
public class TreeCommand extends AbstractGraphCommand {

    @Override
    protected List<String> produce(GraphStore graph, String root, ExplorerSettings settings) {
        return new TreeRenderer().render(graph, root, settings.maxDepth(), NameFilter.of(settings.filter()));
    }
}
