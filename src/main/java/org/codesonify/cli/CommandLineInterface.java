package org.codesonify.cli;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigOriginFactory;
import org.codesonify.api.SonificationException;
import org.codesonify.cli.commands.AnalyzeCommand;
import org.codesonify.cli.commands.CompareCommand;
import org.codesonify.cli.commands.DiffCommand;
import org.codesonify.cli.commands.ExportMidiCommand;
import org.codesonify.cli.commands.SonifyCommand;
import org.codesonify.cli.commands.StylesCommand;
import org.codesonify.cli.config.LoggingConfigurator;
import org.codesonify.cli.config.SonifyOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.concurrent.Callable;

@Command(
    name = "codesonify",
    mixinStandardHelpOptions = true,
    version = "CodeSonify 1.0",
    description = "CodeSonify - turns source code and diffs into music and MIDI files",
    subcommands = {
        AnalyzeCommand.class,
        SonifyCommand.class,
        DiffCommand.class,
        ExportMidiCommand.class,
        CompareCommand.class,
        StylesCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    static final String CONFIG_FILE_NAME = "codesonify.conf";

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private Config config;
    private SonifyOptions options;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Creates the command line with the error handling all commands share: boundary failures
     * are reported on the error stream and end with exit code 1.
     *
     * @return The configured command line.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("codesonify");
        commandLine.setExecutionExceptionHandler((exception, cmd, parseResult) -> {
            if (exception instanceof SonificationException
                    || exception instanceof ConfigException
                    || exception instanceof IOException
                    || exception instanceof UncheckedIOException) {
                LOG.debug("Command '{}' failed", cmd.getCommandName(), exception);
                cmd.getErr().println("Error: " + exception.getMessage());
                return 1;
            }
            throw exception;
        });
        return commandLine;
    }

    /**
     * Returns the resolved configuration, loading it on first use.
     * <p>
     * Sources by precedence: system properties, environment variables, then the first file found of
     * {@code --config}, {@code -Dconfig.file} and {@code codesonify.conf} in the working directory,
     * then {@code application.conf} and the classpath defaults.
     *
     * @return The configuration.
     * @throws ConfigException if a configuration file is missing or malformed.
     */
    public Config getConfig() {
        if (config == null) {
            config = loadConfig();
            if (config.hasPath("logging.format")) {
                System.setProperty(LoggingConfigurator.FORMAT_PROPERTY,
                        LoggingConfigurator.appenderFor(config.getString("logging.format")));
                reconfigureLogback();
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    /**
     * Returns the typed options of the {@code codesonify} block.
     * @return The options.
     */
    public SonifyOptions getOptions() {
        if (options == null) {
            options = SonifyOptions.from(getConfig());
        }
        return options;
    }

    private Config loadConfig() {
        final File file = locateConfigFile();
        Config fileConfig = ConfigFactory.empty();
        if (file != null) {
            if (!file.exists()) {
                throw new ConfigException.IO(ConfigOriginFactory.newFile(file.getPath()),
                        "Configuration file not found: " + file.getAbsolutePath());
            }
            LOG.info("Using configuration file: {}", file.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(file);
        } else {
            LOG.debug("No '{}' found in current directory. Using default configuration from classpath.",
                    CONFIG_FILE_NAME);
        }
        // Config load order: System Props > Env Vars > File > application.conf > Classpath defaults
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.load())
                .resolve();
    }

    private void reconfigureLogback() {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    private File locateConfigFile() {
        // 1) Highest precedence: explicit CLI option --config
        if (configFile != null) {
            return configFile;
        }
        // 2) Next: standard Typesafe Config system property -Dconfig.file
        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            return new File(systemConfigPath).getAbsoluteFile();
        }
        // 3) Then: codesonify.conf in the current working directory
        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        return cwdConfigFile.exists() ? cwdConfigFile : null;
    }
}
