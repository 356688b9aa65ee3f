package org.envkit.parser.frontend.lexer;

import org.envkit.parser.api.ParseErrorCode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link Scanner}.
 * These tests verify cursor bookkeeping and the key, quoted and unquoted sub-scans.
 * These are unit tests and do not require external resources.
 */
public class ScannerTest {

    /**
     * Verifies that peeking past the end yields the end marker and that line and column
     * track consumed line feeds.
     */
    @Test
    @Tag("unit")
    void testCursorTracksLinesAndColumns() {
        // Arrange
        Scanner scanner = new Scanner("ab\nc");

        // Act
        scanner.advance();
        scanner.advance();
        int columnBeforeNewline = scanner.column();
        scanner.advance();

        // Assert
        assertThat(columnBeforeNewline).isEqualTo(3);
        assertThat(scanner.line()).isEqualTo(2);
        assertThat(scanner.column()).isEqualTo(1);
        assertThat(scanner.peek()).isEqualTo('c');
        assertThat(scanner.peekNext()).isEqualTo(Scanner.END);
        scanner.advance();
        assertThat(scanner.isAtEnd()).isTrue();
        assertThat(scanner.advance()).isEqualTo(Scanner.END);
    }

    /**
     * Verifies that a key is the maximal run of letters, digits and underscores.
     */
    @Test
    @Tag("unit")
    void testParseKeyStopsAtFirstNonKeyCharacter() {
        // Arrange
        Scanner scanner = new Scanner("_DB_HOST2 =x");

        // Act
        String key = scanner.parseKey();

        // Assert
        assertThat(key).isEqualTo("_DB_HOST2");
        assertThat(scanner.peek()).isEqualTo(' ');
    }

    /**
     * Verifies that a key starting with a digit is rejected as an invalid key on the current line.
     */
    @Test
    @Tag("unit")
    void testParseKeyRejectsLeadingDigit() {
        Scanner scanner = new Scanner("123INVALID=value");

        assertThatThrownBy(scanner::parseKey)
                .isInstanceOf(ScanException.class)
                .satisfies(e -> {
                    ScanException ex = (ScanException) e;
                    assertThat(ex.getError().code()).isEqualTo(ParseErrorCode.INVALID_KEY);
                    assertThat(ex.getError().lineNumber()).isEqualTo(1);
                });
    }

    @Test
    @Tag("unit")
    void testUnquotedValueIsTrimmedAtCommentAndLineEnd() {
        Scanner withComment = new Scanner("a value \t# note\n");
        Scanner withCrLf = new Scanner("plain  \r\nNEXT=1");

        Scanner.UnquotedValue commented = withComment.parseUnquotedValue();
        Scanner.UnquotedValue crlf = withCrLf.parseUnquotedValue();

        assertThat(commented.value()).isEqualTo("a value");
        assertThat(commented.hadComment()).isTrue();
        assertThat(crlf.value()).isEqualTo("plain");
        assertThat(crlf.hadComment()).isFalse();
        assertThat(withCrLf.peek()).isEqualTo('\r');
    }

    /**
     * Verifies that known escapes are decoded inside double quotes while unknown escapes
     * are kept verbatim.
     */
    @Test
    @Tag("unit")
    void testDoubleQuotedEscapes() {
        // Arrange
        Scanner scanner = new Scanner("\"a\\nb\\tc\\\\d\\\"e\\x\"");

        // Act
        String value = scanner.parseQuotedValue('"');

        // Assert
        assertThat(value).isEqualTo("a\nb\tc\\d\"e\\x");
        assertThat(scanner.isAtEnd()).isTrue();
    }

    /**
     * Verifies that single-quoted values are taken literally, backslashes included.
     */
    @Test
    @Tag("unit")
    void testSingleQuotedValueIsLiteral() {
        Scanner scanner = new Scanner("'raw\\n $HOME # not a comment'");

        String value = scanner.parseQuotedValue('\'');

        assertThat(value).isEqualTo("raw\\n $HOME # not a comment");
    }

    /**
     * Verifies that a quoted value may span lines and that an unterminated one is reported
     * on the line where it opened.
     */
    @Test
    @Tag("unit")
    void testQuotedValueAcrossLinesAndUnterminated() {
        // Arrange
        Scanner multiLine = new Scanner("\"first\nsecond\"");
        Scanner unterminated = new Scanner("\n\"open\nstill open\n");
        unterminated.advance();

        // Act
        String value = multiLine.parseQuotedValue('"');

        // Assert
        assertThat(value).isEqualTo("first\nsecond");
        assertThatThrownBy(() -> unterminated.parseQuotedValue('"'))
                .isInstanceOf(ScanException.class)
                .satisfies(e -> {
                    ScanException ex = (ScanException) e;
                    assertThat(ex.getError().code()).isEqualTo(ParseErrorCode.UNTERMINATED_STRING);
                    assertThat(ex.getError().lineNumber()).isEqualTo(2);
                });
    }

    /**
     * Verifies that a backslash right before the end of input leaves the string unterminated.
     */
    @Test
    @Tag("unit")
    void testTrailingBackslashIsUnterminated() {
        Scanner scanner = new Scanner("\"abc\\");

        assertThatThrownBy(() -> scanner.parseQuotedValue('"'))
                .isInstanceOf(ScanException.class)
                .hasMessageContaining("Unterminated");
    }

    /**
     * Verifies that the source name is reported by the scanner and carried by its errors.
     */
    @Test
    @Tag("unit")
    void testSourceNameIsCarriedIntoErrors() {
        Scanner named = new Scanner("1X=2", "config/app.env");
        Scanner unnamed = new Scanner("1X=2");

        assertThat(named.sourceName()).isEqualTo("config/app.env");
        assertThat(unnamed.sourceName()).isEqualTo("<memory>");
        assertThatThrownBy(named::parseKey)
                .isInstanceOf(ScanException.class)
                .satisfies(e -> assertThat(((ScanException) e).getError().sourceName()).isEqualTo("config/app.env"));
    }

    @Test
    @Tag("unit")
    void testConsumeKeywordOnlyOnExactMatch() {
        Scanner scanner = new Scanner("exported=1");

        assertThat(scanner.consumeKeyword("export ")).isFalse();
        assertThat(scanner.position()).isZero();
        assertThat(scanner.consumeKeyword("export")).isTrue();
        assertThat(scanner.peek()).isEqualTo('e');
    }
}
