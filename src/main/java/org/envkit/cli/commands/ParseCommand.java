package org.envkit.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.reflect.TypeToken;
import org.envkit.cli.CommandLineInterface;
import org.envkit.cli.config.CliSettings;
import org.envkit.cli.config.CliSettings.OutputFormat;
import org.envkit.parser.api.ParseException;
import org.envkit.writer.EnvWriter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.lang.reflect.Type;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "parse", description = "Parses a dotenv file and prints its variables as JSON or dotenv.")
public class ParseCommand implements Callable<Integer> {

    private static final Type MAP_TYPE = new TypeToken<Map<String, String>>() {}.getType();

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", arity = "0..1", description = "The dotenv file (default: envkit.default-file).")
    private Path file;

    @Option(names = {"-f", "--format"}, description = "Output format: ${COMPLETION-CANDIDATES} (default: envkit.output.format).")
    private OutputFormat format;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        CliSettings settings = parent.getSettings();
        Path path = parent.resolveFile(file);
        Map<String, String> env;
        try {
            env = parent.parseFile(path);
        } catch (IOException e) {
            spec.commandLine().getErr().println("Cannot read " + path + ": " + e.getMessage());
            return 1;
        } catch (ParseException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return 1;
        }

        PrintWriter out = spec.commandLine().getOut();
        OutputFormat effective = format != null ? format : settings.outputFormat();
        if (effective == OutputFormat.JSON) {
            GsonBuilder builder = new GsonBuilder().disableHtmlEscaping();
            if (settings.pretty()) {
                builder.setPrettyPrinting();
            }
            Gson gson = builder.create();
            out.println(gson.toJson(env, MAP_TYPE));
        } else {
            out.print(EnvWriter.serialize(env));
        }
        out.flush();
        return 0;
    }
}
