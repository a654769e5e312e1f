package org.depscope.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;

/**
 * Loads the HOCON configuration of a depscope run.
 * <p>
 * At most one user file is read. It is the first of:
 * <ol>
 *   <li>the file given with {@code --config}</li>
 *   <li>the file named by {@code -Dconfig.file}</li>
 *   <li>{@code config/depscope.conf} in the working directory</li>
 * </ol>
 * The file sits between the environment and {@code reference.conf}: system properties win over
 * environment variables, which win over the file, which wins over the classpath defaults.
 * Substitutions are resolved once all layers are stacked.
 */
public final class ConfigLoader {

    static final File WORKING_DIR_CONFIG = new File("config", "depscope.conf");

    private ConfigLoader() {
    }

    /**
     * Message severity levels for configuration resolution feedback.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives a note about which configuration source was chosen.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * @param explicitConfigFile the {@code --config} value, or {@code null}.
     * @param handler            told which source was picked.
     * @return the resolved configuration.
     * @throws IllegalArgumentException            if {@code --config} or {@code -Dconfig.file} names a missing file.
     * @throws com.typesafe.config.ConfigException if the file cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        return resolve(explicitConfigFile, WORKING_DIR_CONFIG, handler);
    }

    static Config resolve(final File explicitConfigFile, final File workingDirConfig,
                          final ConfigMessageHandler handler) {
        return load(locate(explicitConfigFile, workingDirConfig, handler));
    }

    /**
     * Stacks system properties, environment, the given file and {@code reference.conf}.
     *
     * @param userFile the user configuration, or {@code null} for defaults only.
     */
    static Config load(final File userFile) {
        Config fileLayer = userFile == null ? ConfigFactory.empty() : ConfigFactory.parseFile(userFile);
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileLayer)
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    private static File locate(final File explicitConfigFile, final File workingDirConfig,
                               final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            return requireExisting(explicitConfigFile, "--config", handler);
        }
        String systemPath = System.getProperty("config.file");
        if (systemPath != null && !systemPath.isBlank()) {
            return requireExisting(new File(systemPath), "-Dconfig.file", handler);
        }
        if (workingDirConfig.isFile()) {
            handler.log(MessageLevel.INFO, "Using configuration file " + workingDirConfig.getAbsolutePath());
            return workingDirConfig;
        }
        handler.log(MessageLevel.INFO, "No " + workingDirConfig.getPath() + " found, using built-in defaults");
        return null;
    }

    private static File requireExisting(final File file, final String origin, final ConfigMessageHandler handler) {
        File absolute = file.getAbsoluteFile();
        if (!absolute.isFile()) {
            throw new IllegalArgumentException("Configuration file not found (" + origin + "): " + absolute);
        }
        handler.log(MessageLevel.INFO, "Using configuration file from " + origin + ": " + absolute);
        return absolute;
    }
}
