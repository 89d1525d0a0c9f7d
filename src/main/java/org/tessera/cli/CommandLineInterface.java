package org.tessera.cli;

import java.io.File;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tessera.cli.config.ConfigLoader;
import org.tessera.cli.config.LoggingConfigurator;
import org.tessera.mosaic.MosaicSettings;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(
    name = "tessera",
    mixinStandardHelpOptions = true,
    version = "Tessera 1.0",
    description = "Builds a photo mosaic of <image> out of the pictures in <tiles directory>.",
    footer = {
        "",
        "Settings (tile size, match resolution, enlargement, workers, output path) are read",
        "from config/tessera.conf and can be overridden with system properties, e.g.:",
        "",
        "    java -Dtessera.mosaic.tileSize=40 -jar tessera.jar photo.jpg tiles/"
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/tessera.conf)"
    )
    private File configFile;

    @Parameters(index = "0", arity = "0..1", paramLabel = "<image>", description = "The image to turn into a mosaic.")
    private Path targetImage;

    @Parameters(index = "1", arity = "0..1", paramLabel = "<tiles directory>",
        description = "Directory of candidate tile images, searched recursively.")
    private Path tileDirectory;

    @Spec
    private CommandLine.Model.CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        if (targetImage == null || tileDirectory == null) {
            // Missing arguments are not an error: show how to call the tool.
            spec.commandLine().usage(spec.commandLine().getOut());
            return 0;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        final MosaicSettings settings;
        try {
            initialize(logger);
            settings = MosaicSettings.fromConfig(config.getConfig("tessera.mosaic"));
        } catch (IllegalArgumentException e) {
            logger.error(e.getMessage());
            return 1;
        } catch (ConfigException e) {
            logger.error("Failed to load or parse configuration: {}", e.getMessage());
            return 1;
        }

        logger.debug("Settings: {} (block factor {}, {} worker(s))",
            settings, settings.blockFactor(), settings.effectiveWorkerCount());
        return new MosaicEngine(settings, System.out).execute(targetImage, tileDirectory);
    }

    public static void main(final String[] args) {
        System.setProperty("java.awt.headless", "true");
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
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("tessera");
        return commandLine;
    }

    private void initialize(Logger logger) {
        this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
            switch (level) {
                case INFO -> logger.info(message);
                case WARN -> logger.warn(message);
            }
        });

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty("tessera.logging.format", "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);
    }

    private void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof ch.qos.logback.classic.LoggerContext context)) {
            return;
        }
        java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        try {
            ch.qos.logback.classic.joran.JoranConfigurator configurator = new ch.qos.logback.classic.joran.JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            configurator.doConfigure(configUrl);
        } catch (ch.qos.logback.core.joran.spi.JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    Config getConfig() {
        return config;
    }
}
