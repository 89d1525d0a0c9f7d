package org.tessera.cli.config;

import java.io.File;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the HOCON configuration for the command line.
 * <p>
 * Sources, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dtessera.mosaic.tileSize=40})</li>
 *   <li>Environment variables</li>
 *   <li>User configuration file (see {@link #resolve(File, ConfigMessageHandler)})</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "tessera.conf";

    private ConfigLoader() {
    }

    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the config file is being located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * Finds and loads the user configuration file:
     * <ol>
     *   <li>the file passed via {@code --config}</li>
     *   <li>the file named by {@code -Dconfig.file}</li>
     *   <li>{@code config/tessera.conf} in the working directory</li>
     *   <li>otherwise classpath defaults only</li>
     * </ol>
     *
     * @param explicitConfigFile file from the command line, or {@code null}.
     * @param handler            receives which source was chosen.
     * @return the resolved configuration.
     * @throws IllegalArgumentException                if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException     if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via --config: " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file specified via -Dconfig.file not found: " + systemConfigFile);
            }
            handler.log(MessageLevel.INFO, "Using configuration file specified via -Dconfig.file: " + systemConfigFile);
            return loadFromFile(systemConfigFile);
        }

        final File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file found in current directory: " + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        // defaults are normal for this tool, so no WARN
        handler.log(MessageLevel.INFO, "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME + "' found, using defaults.");
        return loadDefaults();
    }

    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }
}
