package org.olympiac.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.olympiac.cli.commands.ParseCommand;
import org.olympiac.cli.commands.TokensCommand;
import org.olympiac.cli.commands.VerifyCommand;
import org.olympiac.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "olympiac",
    mixinStandardHelpOptions = true,
    version = "Olympiac 1.0",
    description = "Olympiac - parser and verifier for the Olympiac sports language",
    subcommands = {
        TokensCommand.class,
        ParseCommand.class,
        VerifyCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** The program compiled without errors. */
    public static final int EXIT_OK = 0;
    /** The program has lexical, syntax or semantic errors. */
    public static final int EXIT_DIAGNOSTICS = 1;
    /** A file or the configuration could not be read. */
    public static final int EXIT_FAILURE = 2;

    private static final String CONFIG_FILE_NAME = "olympiac.conf";
    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: olympiac.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return EXIT_OK;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates the command line with the exit code mapping used by {@link #main(String[])}:
     * an exception escaping a subcommand is reported on stderr and exits with {@link #EXIT_FAILURE}.
     * @return The configured command line.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("olympiac");
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            cmd.getErr().println("Error: " + ex.getMessage());
            return EXIT_FAILURE;
        });
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }
        try {
            // 1) Highest precedence: explicit CLI option --config
            if (this.configFile != null) {
                if (!this.configFile.exists()) {
                    throw new ConfigurationException("Configuration file specified via --config was not found: "
                            + this.configFile.getAbsolutePath());
                }
                LOG.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
                this.config = layered(this.configFile);
            } else {
                // 2) Next: standard Typesafe Config system property -Dconfig.file
                final String systemConfigPath = System.getProperty("config.file");
                if (systemConfigPath != null && !systemConfigPath.isBlank()) {
                    final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
                    if (!systemConfigFile.exists()) {
                        throw new ConfigurationException("Configuration file specified via -Dconfig.file was not found: "
                                + systemConfigFile.getAbsolutePath());
                    }
                    LOG.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile.getAbsolutePath());
                    this.config = layered(systemConfigFile);
                } else {
                    // 3) Then: olympiac.conf in the current working directory
                    final File cwdConfigFile = new File(CONFIG_FILE_NAME);
                    if (cwdConfigFile.exists()) {
                        LOG.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                        this.config = layered(cwdConfigFile);
                    } else {
                        // 4) Finally: classpath defaults only
                        LOG.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
                        this.config = layered(null);
                    }
                }
            }
        } catch (ConfigException e) {
            throw new ConfigurationException("Failed to load or parse configuration: " + e.getMessage(), e);
        }

        LoggingConfigurator.configure(config);
        initialized = true;
    }

    // Config load order: System Props > Env Vars > File > Classpath defaults
    private static Config layered(File file) {
        Config base = ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
        if (file != null) {
            base = base.withFallback(ConfigFactory.parseFile(file));
        }
        return base.withFallback(ConfigFactory.load()).resolve();
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * The configuration could not be located or parsed.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
