package org.depscope.cli.commands;

import org.depscope.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.File;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class ParamsCommandTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute(args);
    }

    @Test
    void printsDefaultsForTestMode() {
        int exitCode = run("params", "-p", "A", "-t");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString())
                .contains("Configured parameters:")
                .contains("  Package: A")
                .contains("  Repository: test-graph.txt (default test graph)")
                .contains("  Test mode: true")
                .contains("  Output file: (standard output)")
                .contains("  Max depth: 3")
                .contains("  Filter: ");
    }

    @Test
    void commandLineValuesWin() {
        int exitCode = run("params", "-p", "serde", "-r", "https://github.com/serde-rs/serde",
                "-d", "4", "-f", "derive", "-o", "out.txt");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString())
                .contains("  Repository: https://github.com/serde-rs/serde")
                .contains("  Test mode: false")
                .contains("  Output file: out.txt")
                .contains("  Max depth: 4")
                .contains("  Filter: derive");
    }

    @Test
    void configFileSuppliesDefaults() throws URISyntaxException {
        File config = new File(getClass().getResource("/org/depscope/cli/config/test-config.conf").toURI());

        int exitCode = run("-c", config.getPath(), "params", "-p", "A", "-t");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("  Max depth: 7").contains("  Filter: test");
    }

    @Test
    void missingConfigFileFails() {
        int exitCode = run("-c", "does/not/exist.conf", "params", "-p", "A", "-t");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Configuration file not found");
    }

    @Test
    void requiresRepositoryOutsideTestMode() {
        int exitCode = run("params", "-p", "A");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--repo is required");
    }
}
