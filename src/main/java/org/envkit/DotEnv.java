package org.envkit;

import org.envkit.env.ApplyException;
import org.envkit.env.EnvironmentAccessor;
import org.envkit.env.EnvironmentApplier;
import org.envkit.parser.EnvParser;
import org.envkit.parser.api.IEnvParser;
import org.envkit.parser.api.ParseException;
import org.envkit.parser.io.EnvSourceLoader;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Entry points for the common cases: load a dotenv file, optionally apply it to an environment.
 *
 * <pre>
 * Map&lt;String, String&gt; env = DotEnv.load(Path.of(".env"));
 * DotEnv.apply(env, ProcessEnvironmentAccessor.shared());
 * </pre>
 */
public final class DotEnv {

    private static final IEnvParser PARSER = new EnvParser();

    private DotEnv() {}

    /**
     * Loads and parses a dotenv file.
     *
     * @param path The file to load.
     * @return The parsed variables.
     * @throws IOException if the file cannot be read.
     * @throws ParseException if the file is malformed.
     */
    public static Map<String, String> load(Path path) throws IOException, ParseException {
        EnvSourceLoader.LoadResult source = EnvSourceLoader.loadFile(path);
        return PARSER.parse(source.content(), source.logicalName());
    }

    /**
     * Reads and parses a dotenv document. The reader is not closed.
     *
     * @param reader The source.
     * @return The parsed variables.
     * @throws IOException if reading fails.
     * @throws ParseException if the document is malformed.
     */
    public static Map<String, String> load(Reader reader) throws IOException, ParseException {
        EnvSourceLoader.LoadResult source = EnvSourceLoader.loadReader(reader, "<reader>");
        return PARSER.parse(source.content(), source.logicalName());
    }

    /**
     * Loads a dotenv file, failing with an unchecked exception.
     *
     * @param path The file to load.
     * @return The parsed variables.
     * @throws UncheckedIOException if the file cannot be read.
     * @throws IllegalStateException if the file is malformed.
     */
    public static Map<String, String> loadOrThrow(Path path) {
        try {
            return load(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read file " + path, e);
        } catch (ParseException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    /**
     * Sets every variable in the target environment.
     *
     * @param env The variables.
     * @param target The environment to write into.
     * @throws ApplyException at the first variable that cannot be set; earlier ones stay set.
     */
    public static void apply(Map<String, String> env, EnvironmentAccessor target) throws ApplyException {
        new EnvironmentApplier(target).apply(env);
    }

    /**
     * Loads a dotenv file and applies it.
     *
     * @param path The file to load.
     * @param target The environment to write into.
     * @return The applied variables.
     * @throws IOException if the file cannot be read.
     * @throws ParseException if the file is malformed.
     * @throws ApplyException if a variable cannot be set.
     */
    public static Map<String, String> loadAndApply(Path path, EnvironmentAccessor target)
            throws IOException, ParseException, ApplyException {
        Map<String, String> env = load(path);
        apply(env, target);
        return env;
    }
}
