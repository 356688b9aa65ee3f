package org.envkit.parser.frontend.parser;

import org.envkit.parser.api.ParseErrorCode;
import org.envkit.parser.frontend.lexer.QuoteContext;
import org.envkit.parser.frontend.lexer.ScanException;
import org.envkit.parser.frontend.lexer.Scanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses a dotenv document one logical line at a time. It drives the {@link Scanner}
 * and produces a {@link ParsedLine} per call, handling blank lines, full-line comments,
 * the optional {@code export} keyword, the key/assignment/value grammar and inline comments.
 * <p>
 * Whole-document iteration and variable expansion are left to the caller.
 */
public class LineParser {

    private static final Logger LOG = LoggerFactory.getLogger(LineParser.class);
    private static final String EXPORT_PREFIX = "export ";

    private final Scanner scanner;
    private final boolean exportPrefixEnabled;

    /**
     * Constructs a new LineParser with the {@code export} prefix enabled.
     * @param scanner The scanner positioned at the start of the document.
     */
    public LineParser(Scanner scanner) {
        this(scanner, true);
    }

    /**
     * Constructs a new LineParser.
     * @param scanner The scanner positioned at the start of the document.
     * @param exportPrefixEnabled Whether a leading {@code export } is skipped.
     */
    public LineParser(Scanner scanner, boolean exportPrefixEnabled) {
        this.scanner = scanner;
        this.exportPrefixEnabled = exportPrefixEnabled;
    }

    /**
     * @return Whether input remains to be parsed.
     */
    public boolean hasMoreLines() {
        return !scanner.isAtEnd();
    }

    /**
     * Parses exactly one logical line.
     * @return The parsed entry, a blank result, or a result carrying the error.
     */
    public ParsedLine parseLine() {
        try {
            return line();
        } catch (ScanException ex) {
            LOG.debug("{}: line parse failed: {}", scanner.sourceName(), ex.getError());
            return ParsedLine.failed(ex.getError());
        }
    }

    private ParsedLine line() {
        scanner.skipWhitespace();
        int startLine = scanner.line();

        if (isBlankOrComment()) {
            scanner.skipToNextLine();
            return ParsedLine.blank(startLine);
        }

        if (exportPrefixEnabled && scanner.consumeKeyword(EXPORT_PREFIX)) {
            scanner.skipWhitespace();
        }

        String key = scanner.parseKey();
        if (key.isEmpty()) {
            throw scanner.error(ParseErrorCode.MISSING_VARIABLE_NAME, "Expected variable name", scanner.line());
        }

        scanner.skipWhitespace();
        if (scanner.peek() != '=') {
            throw scanner.error(ParseErrorCode.MISSING_ASSIGNMENT,
                    "Expected '=' after variable name '" + key + "'", scanner.line());
        }
        scanner.advance();
        scanner.skipWhitespace();

        QuoteContext context = QuoteContext.of(scanner.peek());
        String value;
        if (context == QuoteContext.UNQUOTED) {
            Scanner.UnquotedValue unquoted = scanner.parseUnquotedValue();
            value = unquoted.value();
            if (unquoted.hadComment()) {
                scanner.skipToNextLine();
            }
        } else {
            value = scanner.parseQuotedValue(context.quoteChar());
        }

        // Comment after a quoted value.
        scanner.skipWhitespace();
        if (scanner.peek() == '#') {
            scanner.skipToNextLine();
        }

        return new ParsedLine(key, value, context, startLine, null);
    }

    private boolean isBlankOrComment() {
        char c = scanner.peek();
        return scanner.isAtEnd() || c == '\n' || c == '\r' || c == '#';
    }
}
