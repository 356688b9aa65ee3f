package org.envkit.parser.api;

import org.envkit.parser.diagnostics.ParseError;

/**
 * An exception that is thrown when a dotenv document cannot be parsed.
 * <p>
 * Parsing is all-or-nothing: the first malformed line aborts the whole document,
 * so an exception always describes exactly one error.
 */
public class ParseException extends Exception {

    private final ParseErrorCode code;
    private final String sourceName;
    private final int lineNumber;

    /**
     * Constructs a new parse exception from a positioned parse error.
     * @param error The error detected by the line parser.
     */
    public ParseException(ParseError error) {
        super(String.format("%s:%d: %s", error.sourceName(), error.lineNumber(), error.message()));
        this.code = error.code();
        this.sourceName = error.sourceName();
        this.lineNumber = error.lineNumber();
    }

    /**
     * @return The code identifying the kind of error.
     */
    public ParseErrorCode getCode() {
        return code;
    }

    /**
     * @return The name of the source in which the error occurred.
     */
    public String getSourceName() {
        return sourceName;
    }

    /**
     * @return The 1-based line number at which the offending construct began.
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
