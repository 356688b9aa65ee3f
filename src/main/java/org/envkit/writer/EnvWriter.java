package org.envkit.writer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

/**
 * Serializes variables into dotenv text that the parser reads back to the same mapping.
 * <p>
 * Keys are written in sorted order, one {@code KEY=value} per line, with a final line feed.
 * Values containing whitespace, quotes, a backslash, {@code #} or {@code $} are written in
 * double quotes with backslash, double quote, line feed, tab and carriage return escaped.
 * A value holding {@code $} is written in single quotes instead when it has no single quote
 * and no line break, so that no reference in it is expanded when read back.
 */
public final class EnvWriter {

    private static final Logger LOG = LoggerFactory.getLogger(EnvWriter.class);

    private EnvWriter() {}

    /**
     * @param env The variables.
     * @return The dotenv text; empty for an empty mapping.
     */
    public static String serialize(Map<String, String> env) {
        StringBuilder out = new StringBuilder();
        for (Map.Entry<String, String> entry : new TreeMap<>(env).entrySet()) {
            String value = entry.getValue();
            String formatted = format(value);
            if (value.indexOf('$') >= 0 && formatted.charAt(0) == '"') {
                LOG.warn("Value of {} holds '$' but cannot be single-quoted; references in it expand when read back",
                        entry.getKey());
            }
            out.append(entry.getKey()).append('=')
                    .append(formatted)
                    .append('\n');
        }
        return out.toString();
    }

    /**
     * Writes the variables to a file, replacing its content.
     *
     * @param path The target file.
     * @param env The variables.
     * @throws IOException if the file cannot be written.
     */
    public static void write(Path path, Map<String, String> env) throws IOException {
        Files.writeString(path, serialize(env), StandardCharsets.UTF_8);
        LOG.debug("Wrote {} variables to {}", env.size(), path);
    }

    /**
     * @param value The raw value.
     * @return The value as written on the right-hand side of {@code =}.
     */
    public static String format(String value) {
        if (!needsQuoting(value)) {
            return value;
        }
        if (value.indexOf('$') >= 0 && value.indexOf('\'') < 0
                && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return '\'' + value + '\'';
        }
        return quote(value);
    }

    /**
     * @param value The raw value.
     * @return Whether the value must be quoted to survive a parse.
     */
    public static boolean needsQuoting(String value) {
        for (int i = 0; i < value.length(); i++) {
            switch (value.charAt(i)) {
                case ' ', '\t', '\n', '\r', '"', '\'', '\\', '#', '$':
                    return true;
                default:
                    break;
            }
        }
        return false;
    }

    /**
     * @param value The raw value.
     * @return The value in double quotes, with special characters escaped.
     */
    public static String quote(String value) {
        StringBuilder out = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\': out.append("\\\\"); break;
                case '"': out.append("\\\""); break;
                case '\n': out.append("\\n"); break;
                case '\t': out.append("\\t"); break;
                case '\r': out.append("\\r"); break;
                default: out.append(c); break;
            }
        }
        return out.append('"').toString();
    }
}
