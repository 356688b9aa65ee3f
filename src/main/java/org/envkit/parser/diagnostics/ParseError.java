package org.envkit.parser.diagnostics;

import org.envkit.parser.api.ParseErrorCode;

/**
 * Represents a single error detected while parsing one logical line.
 *
 * @param code The error code identifying the kind of error.
 * @param message The human-readable error message.
 * @param sourceName The name of the source (file name or {@code <memory>}).
 * @param lineNumber The 1-based line at which the offending construct began.
 */
public record ParseError(
        ParseErrorCode code,
        String message,
        String sourceName,
        int lineNumber
) {

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", code, sourceName, lineNumber, message);
    }
}
