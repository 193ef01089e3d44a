package org.portlang.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.portlang.cli.commands.CompileCommand;
import org.portlang.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "portlang",
    mixinStandardHelpOptions = true,
    version = "PortLang 1.0",
    description = "PortLang - compiler and validator for investment portfolio definitions",
    subcommands = {
        CompileCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "portlang.conf";

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: portlang.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("portlang");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            // 1) Highest precedence: explicit CLI option --config
            if (this.configFile != null) {
                requireExisting(this.configFile, "--config");
                logger.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
                this.config = load(this.configFile);
            } else {
                // 2) Next: standard Typesafe Config system property -Dconfig.file
                final String systemConfigPath = System.getProperty("config.file");
                if (systemConfigPath != null && !systemConfigPath.isBlank()) {
                    final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
                    requireExisting(systemConfigFile, "-Dconfig.file");
                    logger.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile);
                    this.config = load(systemConfigFile);
                } else {
                    // 3) Then: portlang.conf in the current working directory
                    final File cwdConfigFile = new File(CONFIG_FILE_NAME);
                    if (cwdConfigFile.exists()) {
                        logger.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                        this.config = load(cwdConfigFile);
                    } else {
                        // 4) Finally: classpath defaults only
                        logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
                        this.config = load(null);
                    }
                }
            }

            LoggingConfigurator.configure(config);
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load or parse configuration: " + e.getMessage(), e, null, null);
        }

        initialized = true;
    }

    private void requireExisting(File file, String source) {
        if (!file.exists()) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Configuration file specified via " + source + " was not found: " + file.getAbsolutePath());
        }
    }

    // Config load order: System Props > Env Vars > File > Classpath defaults
    private static Config load(File file) {
        Config fileConfig = file == null ? ConfigFactory.empty() : ConfigFactory.parseFile(file);
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.load())
                .resolve();
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
