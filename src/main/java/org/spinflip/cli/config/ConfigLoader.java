package org.spinflip.cli.config;

import java.io.File;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Central configuration loader for the command line.
 * <p>
 * Composes HOCON configuration with the following precedence (highest to lowest):
 * <ol>
 *   <li>Java system properties ({@code -Dkey=value})</li>
 *   <li>Environment variables</li>
 *   <li>User configuration file</li>
 *   <li>Default reference configuration ({@code reference.conf} on the classpath)</li>
 * </ol>
 * Substitutions are resolved only after all layers are composed, so an override of a
 * substituted value reaches every reference to it in {@code reference.conf}.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "spinflip.conf";

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
     * Receives progress messages while the configuration file is being located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * Locates the user configuration file and loads it on top of the defaults.
     * <ol>
     *   <li>The file passed via {@code --config}</li>
     *   <li>The file named by {@code -Dconfig.file}</li>
     *   <li>{@code config/spinflip.conf} in the working directory</li>
     *   <li>Otherwise {@code reference.conf} alone</li>
     * </ol>
     *
     * @param explicitConfigFile config file from the CLI option, or {@code null}.
     * @param handler            callback for resolution progress messages.
     * @return the fully resolved configuration.
     * @throws IllegalArgumentException                if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException     if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            requireExists(explicitConfigFile, "--config");
            handler.log(MessageLevel.INFO, "Using configuration file " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            requireExists(systemConfigFile, "-Dconfig.file");
            handler.log(MessageLevel.INFO, "Using configuration file " + systemConfigFile.getAbsolutePath());
            return loadFromFile(systemConfigFile);
        }

        final File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            handler.log(MessageLevel.INFO, "Using configuration file " + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        handler.log(MessageLevel.WARN, "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME
                + "' found. Using default configuration from classpath.");
        return loadDefaults();
    }

    /**
     * Loads configuration from a file, merged with classpath defaults.
     */
    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Loads configuration from classpath defaults only.
     */
    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    private static void requireExists(final File file, final String source) {
        if (!file.exists()) {
            throw new IllegalArgumentException(
                    "Configuration file specified via " + source + " not found: " + file.getAbsolutePath());
        }
    }
}
