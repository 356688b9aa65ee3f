package org.envkit.cli.config;

import com.typesafe.config.Config;

import java.util.Locale;

/**
 * The {@code envkit} section of the configuration.
 *
 * <pre>
 * envkit {
 *   default-file = ".env"
 *   parser.export-prefix = true
 *   output {
 *     format = "JSON"   # JSON or DOTENV
 *     pretty = true
 *   }
 * }
 * </pre>
 *
 * @param defaultFile The file used when a command is given none.
 * @param exportPrefix Whether the parser skips a leading {@code export }.
 * @param outputFormat How the {@code parse} command prints variables.
 * @param pretty Whether JSON output is indented.
 */
public record CliSettings(String defaultFile, boolean exportPrefix, OutputFormat outputFormat, boolean pretty) {

    /**
     * Output formats of the {@code parse} command.
     */
    public enum OutputFormat {
        JSON,
        DOTENV
    }

    /**
     * Reads the settings from a resolved configuration.
     *
     * @param config The configuration; must contain the {@code envkit} section from {@code reference.conf}.
     * @return The settings.
     * @throws IllegalArgumentException if {@code envkit.output.format} is not a known format.
     */
    public static CliSettings from(Config config) {
        Config envkit = config.getConfig("envkit");
        return new CliSettings(
                envkit.getString("default-file"),
                envkit.getBoolean("parser.export-prefix"),
                OutputFormat.valueOf(envkit.getString("output.format").toUpperCase(Locale.ROOT)),
                envkit.getBoolean("output.pretty"));
    }
}
