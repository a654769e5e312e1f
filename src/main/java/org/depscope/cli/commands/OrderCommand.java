package org.depscope.cli.commands;

import java.util.List;

import org.depscope.cli.config.ExplorerSettings;
import org.depscope.graph.GraphStore;
import org.depscope.graph.LoadOrder;
import org.depscope.graph.LoadOrderFormatter;
import org.depscope.graph.NameFilter;
import org.depscope.graph.TopoOrderResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;

/**
 * CLI command that prints the loading order of a package: dependencies before dependents.
 */
@Command(
    name = "order",
    mixinStandardHelpOptions = true,
    description = "Print the loading order of a package (dependencies first)"
)
public class OrderCommand extends AbstractGraphCommand {

    private static final Logger log = LoggerFactory.getLogger(OrderCommand.class);

    @Override
    protected List<String> produce(GraphStore graph, String root, ExplorerSettings settings) {
        LoadOrder loadOrder = new TopoOrderResolver().computeLoadOrder(graph, root, NameFilter.of(settings.filter()));
        if (loadOrder.hasCycles()) {
            log.debug("Cycles broken at {}", loadOrder.cycles());
        }
        return LoadOrderFormatter.format(loadOrder);
    }
}
