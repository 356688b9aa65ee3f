package org.envkit.parser.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Defines the public, clean interface for the dotenv parser.
 */
public interface IEnvParser {

    /**
     * Parses the given dotenv text.
     *
     * @param text The full document text.
     * @return An unmodifiable mapping of variable names to values.
     * @throws ParseException if any line of the document is malformed.
     */
    default Map<String, String> parse(String text) throws ParseException {
        return parse(text, "<memory>");
    }

    /**
     * Parses the given dotenv text, naming it in error messages.
     *
     * @param text The full document text.
     * @param sourceName A name for the document, used in diagnostics.
     * @return An unmodifiable mapping of variable names to values.
     * @throws ParseException if any line of the document is malformed.
     */
    Map<String, String> parse(String text, String sourceName) throws ParseException;

    /**
     * Parses a dotenv file.
     * @param path The path to the file, read as UTF-8.
     * @return An unmodifiable mapping of variable names to values.
     * @throws ParseException if any line of the file is malformed.
     * @throws IOException if the file cannot be read.
     */
    default Map<String, String> parse(Path path) throws ParseException, IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8), path.toString().replace('\\', '/'));
    }
}
