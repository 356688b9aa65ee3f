package org.envkit.cli.commands;

import org.envkit.cli.CommandLineInterface;
import org.envkit.env.ApplyException;
import org.envkit.env.EnvironmentApplier;
import org.envkit.env.ProcessEnvironmentAccessor;
import org.envkit.parser.api.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "exec",
        description = {
            "Runs a command with the variables of a dotenv file added to its environment.",
            "Separate the command from envkit's options with '--', e.g. envkit exec -f .env -- ./server --port 8080"
        })
public class ExecCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ExecCommand.class);

    /** Exit code when the command cannot be started, as in POSIX shells. */
    static final int EXIT_CANNOT_START = 127;
    /** Exit code when interrupted while waiting for the command. */
    static final int EXIT_INTERRUPTED = 130;

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-f", "--file"}, description = "The dotenv file (default: envkit.default-file).")
    private Path file;

    @Option(names = {"-k", "--keep-existing"}, description = "Variables already set in the environment take precedence over the file.")
    private boolean keepExisting;

    @Parameters(arity = "1..*", paramLabel = "COMMAND", description = "The command and its arguments.")
    private List<String> command;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        Path path = parent.resolveFile(file);
        ProcessEnvironmentAccessor environment = new ProcessEnvironmentAccessor(System.getenv());
        try {
            Map<String, String> env = new LinkedHashMap<>(parent.parseFile(path));
            if (keepExisting) {
                env.keySet().removeIf(environment::has);
            }
            new EnvironmentApplier(environment).apply(env);
        } catch (ParseException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return 1;
        } catch (IOException e) {
            spec.commandLine().getErr().println("Cannot read " + path + ": " + e.getMessage());
            return 1;
        } catch (ApplyException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return 1;
        }

        ProcessBuilder builder = new ProcessBuilder(command).inheritIO();
        builder.environment().clear();
        builder.environment().putAll(environment.snapshot());

        LOG.debug("Starting {} with variables from {}", command.get(0), path);
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            spec.commandLine().getErr().println("Cannot run " + command.get(0) + ": " + e.getMessage());
            return EXIT_CANNOT_START;
        }

        try {
            return process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            return EXIT_INTERRUPTED;
        }
    }
}
