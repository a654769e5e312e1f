package org.depscope.cli;

import java.io.File;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;
import java.util.function.Function;

import org.depscope.cli.commands.OrderCommand;
import org.depscope.cli.commands.ParamsCommand;
import org.depscope.cli.commands.TreeCommand;
import org.depscope.cli.config.ConfigLoader;
import org.depscope.cli.config.ExplorerSettings;
import org.depscope.cli.config.LoggingConfigurator;
import org.depscope.source.HttpTextFetcher;
import org.depscope.source.TextFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "depscope",
    mixinStandardHelpOptions = true,
    version = "depscope 1.0",
    description = "depscope - dependency tree and loading order explorer",
    subcommands = {
        TreeCommand.class,
        OrderCommand.class,
        ParamsCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Examples:",
        "  depscope tree -p serde -r https://github.com/serde-rs/serde -d 2",
        "  depscope order -p A -t -r graph.txt -f test"
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/depscope.conf)"
    )
    private File configFile;

    @Option(
        names = {"-v", "--verbose"},
        description = "Log debug output to standard error"
    )
    private boolean verbose;

    private final Function<ExplorerSettings, TextFetcher> fetcherFactory;

    private Config config;
    private boolean initialized = false;

    public CommandLineInterface() {
        this(settings -> new HttpTextFetcher(settings.registryTimeout(), settings.userAgent()));
    }

    CommandLineInterface(final Function<ExplorerSettings, TextFetcher> fetcherFactory) {
        this.fetcherFactory = fetcherFactory;
    }

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        return createCommandLine(new CommandLineInterface());
    }

    /**
     * Creates a CommandLine whose network access goes through the given fetcher factory.
     */
    static CommandLine createCommandLine(final Function<ExplorerSettings, TextFetcher> fetcherFactory) {
        return createCommandLine(new CommandLineInterface(fetcherFactory));
    }

    private static CommandLine createCommandLine(final CommandLineInterface root) {
        final CommandLine commandLine = new CommandLine(root);
        commandLine.setCommandName("depscope");
        // Tree connectors are non-ASCII; the platform charset may be US-ASCII or cp1252.
        commandLine.setOut(utf8Writer(System.out));
        commandLine.setErr(utf8Writer(System.err));
        return commandLine;
    }

    private static PrintWriter utf8Writer(final OutputStream stream) {
        return new PrintWriter(new OutputStreamWriter(stream, StandardCharsets.UTF_8), true);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
            switch (level) {
                case INFO -> logger.debug(message);
                case WARN -> logger.warn(message);
            }
        });

        LoggingConfigurator.configure(config);
        if (verbose) {
            LoggingConfigurator.setLevel("org.depscope", "DEBUG");
        }

        initialized = true;
    }

    /**
     * @return The resolved configuration, loaded on first access.
     * @throws IllegalArgumentException            If an explicit config file does not exist.
     * @throws com.typesafe.config.ConfigException If the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * @return Configured settings, before command-line overrides.
     */
    public ExplorerSettings getSettings() {
        return ExplorerSettings.from(getConfig());
    }

    public GraphSources graphSources(final ExplorerSettings settings) {
        return new GraphSources(fetcherFactory.apply(settings));
    }
}
