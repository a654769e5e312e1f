package org.depscope.cli;

import java.io.File;

import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.TypeConversionException;

/**
 * Shared CLI options for every command that works on a package's dependency graph.
 * <p>
 * Included as a mixin so all options appear in each subcommand's --help output.
 * Depth and filter default to the configuration when not given.
 */
public class GraphOptions {

    @Option(names = {"-p", "--package"}, required = true, description = "Root package to analyse.")
    public String packageName;

    @Option(names = {"-r", "--repo"},
            description = "Repository URL, manifest path or directory. In test mode: edge-list file.")
    public String repository;

    @Option(names = {"-t", "--test-mode"},
            description = "Read the graph from an edge-list file instead of manifest and registry.")
    public boolean testMode;

    @Option(names = {"-o", "--output"}, description = "Write the result to this file instead of standard output.")
    public File outputFile;

    @Option(names = {"-d", "--max-depth"}, converter = PositiveIntConverter.class,
            description = "Maximum tree depth, a positive integer (default from config: depscope.max-depth).")
    public Integer maxDepth;

    @Option(names = {"-f", "--filter"},
            description = "Exclude every package whose name contains this substring (case-sensitive).")
    public String filter;

    /**
     * Accepts strictly positive integers only.
     */
    public static class PositiveIntConverter implements ITypeConverter<Integer> {
        @Override
        public Integer convert(String value) {
            final int parsed;
            try {
                parsed = Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new TypeConversionException("'" + value + "' is not an integer");
            }
            if (parsed <= 0) {
                throw new TypeConversionException(value + " is not a positive integer");
            }
            return parsed;
        }
    }
}
