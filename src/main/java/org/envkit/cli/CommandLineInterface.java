package org.envkit.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.envkit.cli.commands.CheckCommand;
import org.envkit.cli.commands.ExecCommand;
import org.envkit.cli.commands.FormatCommand;
import org.envkit.cli.commands.ParseCommand;
import org.envkit.cli.config.CliSettings;
import org.envkit.cli.config.ConfigLoader;
import org.envkit.cli.config.LoggingConfigurator;
import org.envkit.parser.EnvParser;
import org.envkit.parser.api.IEnvParser;
import org.envkit.parser.api.ParseException;
import org.envkit.parser.io.EnvSourceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "envkit",
    mixinStandardHelpOptions = true,
    version = "envkit 1.0",
    description = "Parse, check, format and run with dotenv files",
    subcommands = {
        ParseCommand.class,
        CheckCommand.class,
        FormatCommand.class,
        ExecCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @Option(names = {"-v", "--verbose"}, description = "Log parser activity at DEBUG level")
    private boolean verbose;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private Config config;
    private CliSettings settings;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("envkit");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }
        try {
            this.config = ConfigLoader.resolve(configFile, (level, message) -> {
                if (level == ConfigLoader.MessageLevel.WARN) {
                    LOG.warn(message);
                } else {
                    LOG.info(message);
                }
            });
            this.settings = CliSettings.from(config);
        } catch (ConfigException | IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load configuration: " + e.getMessage(), e);
        }

        LoggingConfigurator.configure(config);
        if (verbose) {
            LoggingConfigurator.setRootLevel("DEBUG");
        }
        initialized = true;
    }

    public Config getConfig() {
        initialize();
        return config;
    }

    public CliSettings getSettings() {
        initialize();
        return settings;
    }

    /**
     * @return A parser configured from the settings.
     */
    public IEnvParser createParser() {
        return new EnvParser(getSettings().exportPrefix());
    }

    /**
     * Resolves the file a command operates on.
     * @param file The file given on the command line, or {@code null}.
     * @return The given file, or the configured default file.
     */
    public Path resolveFile(Path file) {
        return file != null ? file : Path.of(getSettings().defaultFile());
    }

    /**
     * Loads and parses a dotenv file with the configured parser.
     *
     * @param file The file to parse.
     * @return The parsed variables.
     * @throws IOException if the file cannot be read.
     * @throws ParseException if the file is malformed.
     */
    public Map<String, String> parseFile(Path file) throws IOException, ParseException {
        EnvSourceLoader.LoadResult source = EnvSourceLoader.loadFile(file);
        LOG.debug("Parsing {}", source.logicalName());
        return createParser().parse(source.content(), source.logicalName());
    }
}
