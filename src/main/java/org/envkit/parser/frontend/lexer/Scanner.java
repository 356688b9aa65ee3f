package org.envkit.parser.frontend.lexer;

import org.envkit.parser.api.ParseErrorCode;
import org.envkit.parser.diagnostics.ParseError;

/**
 * The Scanner is a cursor over the raw text of a dotenv document. It offers safe,
 * bounds-checked character access with line/column bookkeeping, plus the sub-scans
 * the grammar needs: keys, quoted literals and unquoted literals.
 * <p>
 * The cursor only ever moves forward. {@link #line()} and {@link #column()} always
 * describe the position of the next unread character.
 */
public class Scanner {

    /** Returned by {@link #peek()}, {@link #peekNext()} and {@link #advance()} past the end of input. */
    public static final char END = '\0';

    private final String source;
    private final String sourceName;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    /**
     * Creates a new Scanner.
     * @param source The document text.
     */
    public Scanner(String source) {
        this(source, "<memory>");
    }

    /**
     * Creates a new Scanner with an explicit source name.
     * @param source The document text.
     * @param sourceName The name of the document, for error reporting.
     */
    public Scanner(String source, String sourceName) {
        this.source = source;
        this.sourceName = sourceName;
    }

    /**
     * @return The character at the cursor, or {@link #END} past the end.
     */
    public char peek() {
        if (isAtEnd()) return END;
        return source.charAt(current);
    }

    /**
     * @return The character after the cursor, or {@link #END} past the end.
     */
    public char peekNext() {
        if (current + 1 >= source.length()) return END;
        return source.charAt(current + 1);
    }

    /**
     * Consumes the character at the cursor.
     * @return The consumed character, or {@link #END} if the input is exhausted.
     */
    public char advance() {
        if (isAtEnd()) return END;
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    /**
     * Consumes runs of spaces and tabs. Line breaks are significant and are never skipped here.
     */
    public void skipWhitespace() {
        while (peek() == ' ' || peek() == '\t') advance();
    }

    /**
     * Consumes everything through and including the next line feed, or up to the end of input.
     */
    public void skipToNextLine() {
        while (!isAtEnd() && peek() != '\n') advance();
        if (!isAtEnd()) advance();
    }

    /**
     * Consumes {@code keyword} if the remaining input starts with it.
     * @param keyword The literal text to match.
     * @return {@code true} if the keyword was consumed.
     */
    public boolean consumeKeyword(String keyword) {
        if (!source.startsWith(keyword, current)) {
            return false;
        }
        for (int i = 0; i < keyword.length(); i++) advance();
        return true;
    }

    /**
     * Consumes the maximal run of key characters at the cursor.
     * @return The key name.
     * @throws ScanException with {@link ParseErrorCode#INVALID_KEY} if the cursor is not at a key start character.
     */
    public String parseKey() {
        int start = current;
        if (!isKeyStartChar(peek())) {
            throw error(ParseErrorCode.INVALID_KEY,
                    "Invalid key name: keys must start with a letter or underscore", line);
        }
        while (isKeyChar(peek())) advance();
        return source.substring(start, current);
    }

    /**
     * Consumes an unquoted value up to a line feed, carriage return or {@code #}.
     * The delimiter itself is not consumed. Trailing spaces and tabs are trimmed;
     * whitespace inside the value is preserved.
     *
     * @return The value, and whether it was terminated by a comment.
     */
    public UnquotedValue parseUnquotedValue() {
        int start = current;
        boolean hadComment = false;
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\n' || c == '\r') break;
            if (c == '#') {
                hadComment = true;
                break;
            }
            advance();
        }
        int end = current;
        while (end > start && (source.charAt(end - 1) == ' ' || source.charAt(end - 1) == '\t')) {
            end--;
        }
        return new UnquotedValue(source.substring(start, end), hadComment);
    }

    /**
     * Consumes a quoted value, including both quotes. Inside double quotes, backslash escapes
     * are interpreted; inside single quotes every character is literal.
     *
     * @param quote The opening quote character, {@code '"'} or {@code '\''}.
     * @return The value without its quotes.
     * @throws ScanException with {@link ParseErrorCode#UNTERMINATED_STRING} if the input ends before the closing quote.
     */
    public String parseQuotedValue(char quote) {
        int startLine = line;
        StringBuilder value = new StringBuilder();
        advance(); // opening quote

        while (!isAtEnd()) {
            char c = peek();
            if (c == quote) {
                advance();
                return value.toString();
            }
            if (c == '\\' && quote == '"') {
                advance();
                if (isAtEnd()) break;
                appendEscape(value, advance());
            } else {
                value.append(advance());
            }
        }
        throw error(ParseErrorCode.UNTERMINATED_STRING, "Unterminated quoted string", startLine);
    }

    private void appendEscape(StringBuilder value, char escaped) {
        switch (escaped) {
            case 'n': value.append('\n'); break;
            case 't': value.append('\t'); break;
            case 'r': value.append('\r'); break;
            case '\\': value.append('\\'); break;
            case '"': value.append('"'); break;
            case '\'': value.append('\''); break;
            default:
                // Unknown escapes are kept verbatim.
                value.append('\\').append(escaped);
                break;
        }
    }

    /**
     * @param c The character to classify.
     * @return Whether {@code c} may start a key (ASCII letter or underscore).
     */
    public static boolean isKeyStartChar(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    /**
     * @param c The character to classify.
     * @return Whether {@code c} may appear inside a key (ASCII letter, digit or underscore).
     */
    public static boolean isKeyChar(char c) {
        return isKeyStartChar(c) || (c >= '0' && c <= '9');
    }

    /**
     * @return Whether all input has been consumed.
     */
    public boolean isAtEnd() {
        return current >= source.length();
    }

    /**
     * @return The 1-based line of the next unread character.
     */
    public int line() {
        return line;
    }

    /**
     * @return The 1-based column of the next unread character.
     */
    public int column() {
        return column;
    }

    /**
     * @return The offset of the next unread character.
     */
    public int position() {
        return current;
    }

    /**
     * @return The name of the document being scanned.
     */
    public String sourceName() {
        return sourceName;
    }

    /**
     * Builds a positioned error for this source.
     * @param code The error code.
     * @param message The message.
     * @param atLine The line the offending construct began on.
     * @return An exception ready to be thrown.
     */
    public ScanException error(ParseErrorCode code, String message, int atLine) {
        return new ScanException(new ParseError(code, message, sourceName, atLine));
    }

    /**
     * Result of {@link #parseUnquotedValue()}.
     *
     * @param value The trimmed value.
     * @param hadComment Whether scanning stopped at a {@code #}.
     */
    public record UnquotedValue(String value, boolean hadComment) {}
}
