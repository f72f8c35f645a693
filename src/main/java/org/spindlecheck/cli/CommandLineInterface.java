package org.spindlecheck.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spindlecheck.cli.commands.RunCommand;
import org.spindlecheck.cli.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "spindlecheck",
    mixinStandardHelpOptions = true,
    version = "SpindleCheck 1.0",
    description = "SpindleCheck - spindle assembly checkpoint simulation with runtime safety monitoring",
    subcommands = {
        RunCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "spindlecheck.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: spindlecheck.conf)"
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
        commandLine.setCommandName("spindlecheck");
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
        Config layered = ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
        if (file != null) {
            layered = layered.withFallback(ConfigFactory.parseFile(file));
        }
        this.config = layered.withFallback(ConfigFactory.load()).resolve();

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty(LoggingConfigurator.FORMAT_PROPERTY, "JSON".equalsIgnoreCase(format) ? "CONSOLE" : "CONSOLE_PLAIN");
            LoggingConfigurator.reloadLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    /**
     * Finds the configuration file to layer over the classpath defaults.
     * <ol>
     *   <li>the {@code --config} option</li>
     *   <li>the standard Typesafe Config system property {@code -Dconfig.file}</li>
     *   <li>{@code spindlecheck.conf} in the current working directory</li>
     * </ol>
     *
     * @return the file, or {@code null} to use classpath defaults only
     * @throws IllegalArgumentException if an explicitly named file does not exist
     */
    private File resolveConfigFile(final Logger logger) {
        if (this.configFile != null) {
            if (!this.configFile.exists()) {
                throw new IllegalArgumentException("Configuration file specified via --config was not found: "
                        + this.configFile.getAbsolutePath());
            }
            logger.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
            return this.configFile;
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException("Configuration file specified via -Dconfig.file was not found: "
                        + systemConfigFile.getAbsolutePath());
            }
            logger.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile.getAbsolutePath());
            return systemConfigFile;
        }

        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            logger.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return cwdConfigFile;
        }

        logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
        return null;
    }

    /**
     * Returns the layered configuration, loading it on first access.
     * @return the resolved configuration
     * @throws com.typesafe.config.ConfigException if a configuration file cannot be parsed
     * @throws IllegalArgumentException if an explicitly named configuration file is missing
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
