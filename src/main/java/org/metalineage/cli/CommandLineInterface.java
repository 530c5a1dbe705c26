package org.metalineage.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import org.metalineage.cli.commands.ClassifyCommand;
import org.metalineage.cli.commands.ProfileCommand;
import org.metalineage.cli.commands.PruneCacheCommand;
import org.metalineage.cli.commands.RunCommand;
import org.metalineage.cli.commands.SelectCommand;
import org.metalineage.cli.config.ConfigLoader;
import org.metalineage.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "metalineage",
    mixinStandardHelpOptions = true,
    version = "metalineage 1.0.0",
    description = "Taxonomic lineage assignment and abundance profiling for metagenomic contigs",
    subcommands = {
        RunCommand.class,
        SelectCommand.class,
        ClassifyCommand.class,
        ProfileCommand.class,
        PruneCacheCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Exit codes: 0 success, 1 stage or input failure, 2 configuration error."
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** Exit code for failures of a stage, an input or an external tool. */
    public static final int EXIT_FAILURE = 1;
    /** Exit code for invalid configuration. */
    public static final int EXIT_CONFIG = 2;

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/metalineage.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
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
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("metalineage");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
            switch (level) {
                case INFO -> logger.info(message);
                case WARN -> logger.warn(message);
            }
        });

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty("metalineage.logging.format",
                    "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);
        initialized = true;
    }

    private void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * Loads the configuration on first access.
     *
     * @throws org.metalineage.pipeline.api.errors.ConfigurationException if it cannot be loaded
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * @return the {@code metalineage} block of the configuration
     */
    public Config getSettings() {
        return getConfig().getConfig("metalineage");
    }
}
