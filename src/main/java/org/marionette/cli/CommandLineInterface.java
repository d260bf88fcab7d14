package org.marionette.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.marionette.cli.commands.CompileCommand;
import org.marionette.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "marionette",
    mixinStandardHelpOptions = true,
    version = "Marionette 1.0",
    description = "Marionette - manifest compiler for declarative configuration management",
    subcommands = {
        CompileCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "marionette.conf";
    private static final String LOGGING_FORMAT_PROPERTY = "marionette.logging.format";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: marionette.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("marionette");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        // Config load order: System Props > Env Vars > File > Classpath defaults
        final File file = resolveConfigFile(logger);
        Config fileConfig = ConfigFactory.empty();
        if (file != null) {
            logger.debug("Using configuration file: {}", file.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(file);
        } else {
            logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
        }
        this.config = ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.load())
                .resolve();

        // Logging setup
        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty(LOGGING_FORMAT_PROPERTY, "DETAILED".equalsIgnoreCase(format) ? "STDERR" : "STDERR_PLAIN");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    /**
     * Finds the configuration file: the {@code --config} option first, then {@code -Dconfig.file},
     * then {@code marionette.conf} in the working directory.
     *
     * @return The file, or {@code null} if only classpath defaults apply.
     * @throws ConfigException.Generic if an explicitly named file does not exist.
     */
    private File resolveConfigFile(final Logger logger) {
        if (this.configFile != null) {
            return requireExisting(this.configFile, "--config");
        }
        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            return requireExisting(new File(systemConfigPath).getAbsoluteFile(), "-Dconfig.file");
        }
        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            logger.debug("Found configuration file in current directory.");
            return cwdConfigFile;
        }
        return null;
    }

    private static File requireExisting(final File file, final String origin) {
        if (!file.exists()) {
            throw new ConfigException.Generic(
                    "Configuration file specified via " + origin + " was not found: " + file.getAbsolutePath());
        }
        return file;
    }

    private void reconfigureLogback() {
        try {
            ch.qos.logback.classic.LoggerContext context = (ch.qos.logback.classic.LoggerContext) LoggerFactory.getILoggerFactory();
            ch.qos.logback.classic.joran.JoranConfigurator configurator = new ch.qos.logback.classic.joran.JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
        } catch (Exception e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * Returns the merged configuration, loading it on first use.
     * @return The configuration.
     * @throws ConfigException if the configuration cannot be found or parsed.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
