package org.depscope.cli.commands;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.depscope.cli.CommandLineInterface;
import org.depscope.cli.GraphOptions;
import org.depscope.cli.config.ExplorerSettings;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that prints the effective parameters (command line merged with configuration)
 * without loading any graph. Useful to check what {@code tree} or {@code order} would use.
 */
@Command(
    name = "params",
    mixinStandardHelpOptions = true,
    description = "Print the configured parameters without loading a graph"
)
public class ParamsCommand implements Callable<Integer> {

    @Mixin
    private GraphOptions options;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        if (!options.testMode && options.repository == null) {
            throw new ParameterException(spec.commandLine(), "--repo is required when not using test mode");
        }

        ExplorerSettings settings;
        try {
            settings = parent.getSettings().withOverrides(options.maxDepth, options.filter);
        } catch (ConfigException | IllegalArgumentException e) {
            spec.commandLine().getErr().println("Error: invalid configuration: " + e.getMessage());
            return 1;
        }

        String repository = options.repository;
        if (repository == null) {
            repository = settings.testGraphFile() + " (default test graph)";
        }

        out.println("Configured parameters:");
        out.printf("  Package: %s%n", options.packageName);
        out.printf("  Repository: %s%n", repository);
        out.printf("  Test mode: %s%n", options.testMode);
        out.printf("  Output file: %s%n", options.outputFile != null ? options.outputFile.getPath() : "(standard output)");
        out.printf("  Max depth: %d%n", settings.maxDepth());
        out.printf("  Filter: %s%n", settings.filter());
        out.flush();
        return 0;
    }
}
