package org.envkit.parser.frontend.parser;

import org.envkit.parser.diagnostics.ParseError;
import org.envkit.parser.frontend.lexer.QuoteContext;

/**
 * The result of parsing one logical line with the {@link LineParser}.
 * <p>
 * An empty {@code key} without an error denotes a blank line or a full-line comment;
 * the caller must skip it.
 *
 * @param key The variable name, or empty for blank and comment lines.
 * @param value The raw value, before any expansion.
 * @param quoteContext How the value was written.
 * @param line The 1-based line on which the entry started.
 * @param error The error detected on this line, or {@code null}.
 */
public record ParsedLine(
        String key,
        String value,
        QuoteContext quoteContext,
        int line,
        ParseError error
) {

    /**
     * @param line The line that was skipped.
     * @return A result representing a blank or comment line.
     */
    public static ParsedLine blank(int line) {
        return new ParsedLine("", "", QuoteContext.UNQUOTED, line, null);
    }

    /**
     * @param error The error detected.
     * @return A result carrying only the error.
     */
    public static ParsedLine failed(ParseError error) {
        return new ParsedLine("", "", QuoteContext.UNQUOTED, error.lineNumber(), error);
    }

    /**
     * @return Whether the line holds no entry and no error.
     */
    public boolean isBlank() {
        return error == null && key.isEmpty();
    }

    /**
     * @return Whether an error was detected.
     */
    public boolean hasError() {
        return error != null;
    }

    /**
     * @return Whether {@code $VAR} references in the value may be expanded.
     */
    public boolean allowExpansion() {
        return error == null && quoteContext.isExpansionAllowed();
    }
}
