package org.envkit.cli.commands;

import org.envkit.cli.CommandLineInterface;
import org.envkit.parser.api.ParseException;
import org.envkit.writer.EnvWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "format",
        description = {
            "Rewrites a dotenv file in canonical form: sorted keys, expanded values, quoting where needed.",
            "Comments and the 'export' prefix are not preserved."
        })
public class FormatCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(FormatCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", arity = "0..1", description = "The dotenv file (default: envkit.default-file).")
    private Path file;

    @Option(names = {"-i", "--in-place"}, description = "Overwrite the file instead of printing to stdout.")
    private boolean inPlace;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        Path path = parent.resolveFile(file);
        try {
            Map<String, String> env = parent.parseFile(path);
            if (inPlace) {
                EnvWriter.write(path, env);
                LOG.info("Formatted {} ({} variables)", path, env.size());
            } else {
                spec.commandLine().getOut().print(EnvWriter.serialize(env));
                spec.commandLine().getOut().flush();
            }
            return 0;
        } catch (ParseException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return 1;
        } catch (IOException e) {
            spec.commandLine().getErr().println("Cannot format " + path + ": " + e.getMessage());
            return 1;
        }
    }
}
