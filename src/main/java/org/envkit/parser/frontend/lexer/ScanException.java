package org.envkit.parser.frontend.lexer;

import org.envkit.parser.diagnostics.ParseError;

/**
 * Thrown by the {@link Scanner} when a grammar-specific sub-scan fails.
 * The line parser catches it and turns it into the error of the current line.
 */
public class ScanException extends RuntimeException {

    private final transient ParseError error;

    /**
     * @param error The positioned error describing the failure.
     */
    public ScanException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    /**
     * @return The positioned error describing the failure.
     */
    public ParseError getError() {
        return error;
    }
}
