package org.envkit.cli.commands;

import org.envkit.cli.CommandLineInterface;
import org.envkit.parser.api.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "check", description = "Validates dotenv files. Exits with 1 if any file is malformed or unreadable.")
public class CheckCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CheckCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(arity = "0..*", description = "The dotenv files (default: envkit.default-file).")
    private List<Path> files = new ArrayList<>();

    @Option(names = {"-q", "--quiet"}, description = "Only report failures.")
    private boolean quiet;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        List<Path> targets = files.isEmpty() ? List.of(parent.resolveFile(null)) : files;
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        int failures = 0;

        for (Path path : targets) {
            try {
                Map<String, String> env = parent.parseFile(path);
                if (!quiet) {
                    out.println("OK   " + path + " (" + env.size() + " variables)");
                }
            } catch (ParseException e) {
                failures++;
                err.println("FAIL " + e.getMessage());
            } catch (IOException e) {
                failures++;
                err.println("FAIL " + path + ": cannot read: " + e.getMessage());
            }
        }
        out.flush();
        err.flush();

        LOG.debug("Checked {} files, {} failed", targets.size(), failures);
        return failures == 0 ? 0 : 1;
    }
}
