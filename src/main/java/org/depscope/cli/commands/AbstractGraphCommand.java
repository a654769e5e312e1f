package org.depscope.cli.commands;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;

import org.depscope.cli.CommandLineInterface;
import org.depscope.cli.GraphOptions;
import org.depscope.cli.config.ExplorerSettings;
import org.depscope.graph.GraphStore;
import org.depscope.source.GraphSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Base class for commands that load a dependency graph and print lines derived from it.
 * <p>
 * Handles the shared flow: settings resolution, graph loading, the root-not-found check and
 * writing to standard output or {@code --output}. Exit codes: 0 on success and when the root
 * package is absent, 1 when the graph source or the output cannot be handled, 2 for usage errors.
 */
public abstract class AbstractGraphCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AbstractGraphCommand.class);

    @Mixin
    protected GraphOptions options;

    @ParentCommand
    protected CommandLineInterface parent;

    @Spec
    protected CommandSpec spec;

    /**
     * Produces the output lines. Called only when the root package is in the graph.
     */
    protected abstract List<String> produce(GraphStore graph, String root, ExplorerSettings settings);

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();

        ExplorerSettings settings;
        try {
            settings = parent.getSettings().withOverrides(options.maxDepth, options.filter);
        } catch (ConfigException | IllegalArgumentException e) {
            err.println("Error: invalid configuration: " + e.getMessage());
            return 1;
        }

        if (!options.testMode && options.repository == null) {
            throw new ParameterException(spec.commandLine(), "--repo is required when not using test mode");
        }

        GraphStore graph;
        try {
            graph = parent.graphSources(settings).load(options, settings);
        } catch (GraphSourceException e) {
            log.debug("Failed to load dependency graph", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }

        if (!graph.contains(options.packageName)) {
            err.println("Package '" + options.packageName + "' not found in the dependency graph.");
            return 0;
        }

        List<String> lines = produce(graph, options.packageName, settings);
        return write(lines);
    }

    private int write(List<String> lines) {
        File outputFile = options.outputFile;
        if (outputFile == null) {
            PrintWriter out = spec.commandLine().getOut();
            lines.forEach(out::println);
            out.flush();
            return 0;
        }
        try {
            Files.write(outputFile.toPath(), lines, StandardCharsets.UTF_8);
            log.info("Wrote {} lines to {}", lines.size(), outputFile.getAbsolutePath());
            return 0;
        } catch (IOException e) {
            spec.commandLine().getErr().println("Error: could not write " + outputFile.getAbsolutePath() + ": " + e.getMessage());
            return 1;
        }
    }
}
